package com.example.demo.pdfform.command;

import com.example.demo.pdfform.event.Event;
import com.example.demo.pdfform.event.EventType;
import com.example.demo.pdfform.event.InspectEventData;
import com.example.demo.pdfform.exception.ErrorCode;
import com.example.demo.pdfform.exception.ExtractionException;
import com.example.demo.pdfform.exception.Stage;
import com.example.demo.pdfform.model.FormTemplate;
import com.example.demo.pdfform.model.Provenance;
import com.example.demo.pdfform.support.EventRecorder;
import com.example.demo.pdfform.support.FormFixtures;
import com.example.demo.pdfform.support.TestWiring;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class InspectCommandTest {
    @TempDir
    Path dataDir;

    private TestWiring wiring;
    private EventRecorder recorder;
    private Path pdf;

    @BeforeEach
    public void setUp() throws IOException {
        wiring = new TestWiring(dataDir, TestWiring.fillableFormFetcher());
        recorder = new EventRecorder(wiring.bus, "inspect.*");
        pdf = FormFixtures.textForm(dataDir.resolve("transfer.pdf"), "Name", "Date", "Signature Block");
    }

    @Test
    public void testInspectIntoDirectory() throws Exception {
        Path templates = dataDir.resolve("templates");

        InspectResult result = wiring.inspectCommand.inspectInto(pdf, templates);

        assertEquals(templates.resolve("transfer_template.json"), result.getTemplatePath());
        assertEquals(List.of("Name", "Date", "Signature Block"), result.getFields());
        assertFalse(result.isProvenanceUpdated());

        FormTemplate written = wiring.templateStore.read(result.getTemplatePath());
        assertEquals(pdf.toString(), written.getDocumentReference());
        assertEquals(List.of("Name", "Date", "Signature Block"), List.copyOf(written.getFields().keySet()));
        assertTrue(written.getFields().values().stream().allMatch(String::isEmpty));

        List<Event> events = recorder.drain();
        assertEquals(List.of(EventType.INSPECT_STARTED, EventType.INSPECT_COMPLETED), EventRecorder.types(events));
        assertEquals(3, events.get(1).dataAs(InspectEventData.class).getFieldCount());
    }

    @Test
    public void testInspectCopiesAndStampsProvenance() throws Exception {
        wiring.provenanceStore.recordDownloadAdvisory(pdf, "F3520", "QLD", "https://host/f3520.pdf");

        InspectResult result = wiring.inspectCommand.inspect(pdf, dataDir.resolve("out.json").toString());

        assertEquals(dataDir.resolve("out.json"), result.getTemplatePath());
        assertTrue(result.isProvenanceUpdated());
        assertEquals("F3520", result.getTemplate().getProvenance().getOriginFormCode());
        Provenance stamped = wiring.provenanceStore.read(pdf).orElseThrow();
        assertNotNull(stamped.getInspectedAt());
    }

    @Test
    public void testMissingPdf() throws Exception {
        Path missing = dataDir.resolve("missing.pdf");

        ExtractionException e = assertThrows(ExtractionException.class,
                () -> wiring.inspectCommand.inspectInto(missing, dataDir));

        assertEquals(ErrorCode.DOCUMENT_NOT_FOUND, e.getCode());
        assertEquals(Stage.VALIDATE_INPUT, e.getStage());
        assertFalse(Files.exists(dataDir.resolve("missing_template.json")));
        Event error = EventRecorder.assertSingleTerminal(recorder.drain());
        assertEquals(EventType.INSPECT_ERROR, error.getType());
        assertEquals(Stage.VALIDATE_INPUT, error.getStage());
    }

    @Test
    public void testDocumentWithoutFormGivesEmptyTemplate() throws Exception {
        Path plain = FormFixtures.plainDocument(dataDir.resolve("letter.pdf"));

        InspectResult result = wiring.inspectCommand.inspectInto(plain, dataDir);

        assertTrue(result.getFields().isEmpty());
        assertTrue(Files.exists(dataDir.resolve("letter_template.json")));
    }
}
