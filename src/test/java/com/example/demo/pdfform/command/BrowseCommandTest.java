package com.example.demo.pdfform.command;

import com.example.demo.pdfform.event.BrowseEventData;
import com.example.demo.pdfform.event.Event;
import com.example.demo.pdfform.event.EventType;
import com.example.demo.pdfform.exception.CatalogException;
import com.example.demo.pdfform.exception.ErrorCode;
import com.example.demo.pdfform.exception.PdfFormException;
import com.example.demo.pdfform.exception.Stage;
import com.example.demo.pdfform.support.EventRecorder;
import com.example.demo.pdfform.support.TestWiring;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class BrowseCommandTest {
    @TempDir
    Path dataDir;

    private TestWiring wiring;
    private EventRecorder recorder;

    @BeforeEach
    public void setUp() throws IOException {
        wiring = new TestWiring(dataDir, TestWiring.fillableFormFetcher());
        recorder = new EventRecorder(wiring.bus, "browse.*");
    }

    @Test
    public void testBrowseAll() throws Exception {
        BrowseResult result = wiring.browseCommand.browse(null);

        assertEquals(List.of("NSW", "QLD", "VIC"), result.getRegions());
        assertEquals(4, result.getForms().size());
        assertNull(result.getRegion());

        List<Event> events = recorder.drain();
        assertEquals(List.of(EventType.BROWSE_STARTED, EventType.BROWSE_COMPLETED), EventRecorder.types(events));
        BrowseEventData completed = events.get(1).dataAs(BrowseEventData.class);
        assertEquals(3, completed.getRegionCount());
        assertEquals(4, completed.getFormCount());
    }

    @Test
    public void testBrowseRegion() throws Exception {
        BrowseResult result = wiring.browseCommand.browse("NSW");

        assertEquals(2, result.getForms().size());
        assertEquals("TF01", result.getForms().get(0).getFormCode());
        assertEquals("NSW", result.getRegion());
        assertEquals(EventType.BROWSE_COMPLETED, EventRecorder.assertSingleTerminal(recorder.drain()).getType());
    }

    @Test
    public void testUnknownRegionIsNotFound() throws Exception {
        CatalogException e = assertThrows(CatalogException.class, () -> wiring.browseCommand.browse("WA"));

        assertEquals(ErrorCode.NOT_FOUND, e.getCode());
        assertEquals(Stage.FILTER_FORMS, e.getStage());
        Event error = EventRecorder.assertSingleTerminal(recorder.drain());
        assertEquals(EventType.BROWSE_ERROR, error.getType());
        assertEquals(e.getMessage(), error.getError());
    }

    @Test
    public void testMissingCatalog() throws Exception {
        PdfFormException e = assertThrows(PdfFormException.class,
                () -> wiring.browseCommand.browse(dataDir.resolve("missing.csv"), null));

        assertEquals(Stage.LOAD_CATALOG, e.getStage());
        assertEquals(EventType.BROWSE_ERROR, EventRecorder.assertSingleTerminal(recorder.drain()).getType());
    }
}
