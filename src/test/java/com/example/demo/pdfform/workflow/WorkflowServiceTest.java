package com.example.demo.pdfform.workflow;

import com.example.demo.pdfform.event.Event;
import com.example.demo.pdfform.event.EventType;
import com.example.demo.pdfform.event.WorkflowEventData;
import com.example.demo.pdfform.exception.ErrorCode;
import com.example.demo.pdfform.exception.Stage;
import com.example.demo.pdfform.exception.WorkflowException;
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
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end workflow runs over the fixture catalog with an in-memory fetcher
 */
public class WorkflowServiceTest {
    @TempDir
    Path dataDir;

    private TestWiring wiring;
    private EventRecorder recorder;
    private Path outputDir;

    @BeforeEach
    public void setUp() throws IOException {
        wiring = new TestWiring(dataDir, TestWiring.fillableFormFetcher());
        recorder = new EventRecorder(wiring.bus, "workflow.*");
        outputDir = dataDir.resolve("run");
    }

    @Test
    public void testRunWorkflow() throws Exception {
        WorkflowResult result = wiring.workflowService.runWorkflow(WorkflowRequest.builder()
                .formCode("F3520")
                .fields(Map.of("Name", "Alice"))
                .outputDir(outputDir)
                .build());

        assertEquals(outputDir.resolve("downloads").resolve("f3520.pdf"), result.getDownloadPath());
        assertEquals(outputDir.resolve("templates").resolve("f3520_template.json"), result.getTemplatePath());
        assertEquals(outputDir.resolve("outputs").resolve("f3520_filled.pdf"), result.getFilledPath());
        assertEquals("Alice", FormFixtures.values(result.getFilledPath()).get("Name"));
        assertEquals("F3520", result.getProvenance().getOriginFormCode());
        assertNotNull(result.getProvenance().getInspectedAt());

        List<Event> events = recorder.drain();
        assertEquals(List.of(EventType.WORKFLOW_STARTED, EventType.WORKFLOW_COMPLETED), EventRecorder.types(events));
        assertEquals(result.getFilledPath().toString(), events.get(1).dataAs(WorkflowEventData.class).getOutputPath());
    }

    @Test
    public void testUnknownFormFailsBeforeWriting() throws Exception {
        WorkflowException e = assertThrows(WorkflowException.class, () -> wiring.workflowService.runWorkflow(
                WorkflowRequest.builder().formCode("NOPE").outputDir(outputDir).build()));

        assertEquals(WorkflowService.STEP_BROWSE, e.getStep());
        assertEquals(ErrorCode.NOT_FOUND, e.getCode());
        assertFalse(Files.exists(outputDir));

        Event error = EventRecorder.assertSingleTerminal(recorder.drain());
        assertEquals(EventType.WORKFLOW_ERROR, error.getType());
        WorkflowEventData data = error.dataAs(WorkflowEventData.class);
        assertEquals(WorkflowService.STEP_BROWSE, data.getStep());
        assertEquals(Stage.FIND_FORM, data.getStage());
    }

    @Test
    public void testDownloadStepFailureNamesTheStep() throws Exception {
        WorkflowException e = assertThrows(WorkflowException.class, () -> wiring.workflowService.runWorkflow(
                WorkflowRequest.builder().formCode("VT1").outputDir(outputDir).build()));

        assertEquals(WorkflowService.STEP_DOWNLOAD, e.getStep());
        assertEquals(ErrorCode.NO_SOURCE, e.getCode());
        assertTrue(e.getMessage().contains("step 'download' failed"));
    }

    @Test
    public void testBulkWorkflowKeepsGoing() {
        BulkWorkflowResult result = wiring.workflowService.runBulkWorkflow(List.of("F3520", "VT1", "NOS"),
                Map.of("F3520", Map.of("Name", "Alice")), outputDir, false);

        assertEquals(3, result.getTotal());
        assertEquals(2, result.getSuccess());
        assertEquals(1, result.getFailed());
        assertEquals(List.of("F3520", "NOS"), List.copyOf(result.getResults().keySet()));
        assertTrue(result.getErrors().get("VT1").contains("NO_SOURCE"));
    }

    @Test
    public void testSubmitCompletesOnExecutor() throws Exception {
        WorkflowResult result = wiring.workflowService.submit(WorkflowRequest.builder()
                .formCode("TF01")
                .outputDir(outputDir)
                .flatten(true)
                .build()).get();

        assertTrue(result.isFlattened());
        assertEquals(outputDir.resolve("outputs").resolve("tf01_filled_flat.pdf"), result.getFilledPath());
    }

    @Test
    public void testUpdateWorkflowSkipsExistingCopy() throws Exception {
        Path existing = wiring.properties.downloadsPath();
        FormFixtures.textForm(existing.resolve("tf01.pdf"), "Name");

        UpdateWorkflowResult skipped = wiring.workflowService.runUpdateWorkflow("TF01", existing, null, false);

        assertFalse(skipped.isUpdated());
        assertEquals(existing.resolve("tf01.pdf"), skipped.getNewPath());

        UpdateWorkflowResult forced = wiring.workflowService.runUpdateWorkflow("TF01", existing, outputDir, true);

        assertTrue(forced.isUpdated());
        assertEquals(existing.resolve("tf01.pdf"), forced.getOldPath());
        assertEquals(outputDir.resolve("tf01.pdf"), forced.getNewPath());
        assertEquals("TF01", forced.getNewProvenance().getOriginFormCode());
    }

    @Test
    public void testUpdateWorkflowDownloadsMissingCopy() throws Exception {
        Path existing = dataDir.resolve("empty");

        UpdateWorkflowResult result = wiring.workflowService.runUpdateWorkflow("NOS", existing, null, false);

        assertTrue(result.isUpdated());
        assertNull(result.getOldPath());
        assertEquals(existing.resolve("nos.pdf"), result.getNewPath());
    }
}
