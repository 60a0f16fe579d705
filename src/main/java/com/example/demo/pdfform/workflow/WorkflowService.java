package com.example.demo.pdfform.workflow;

import com.example.demo.pdfform.aspect.LogExecutionTime;
import com.example.demo.pdfform.catalog.CatalogLoader;
import com.example.demo.pdfform.catalog.FormsCatalog;
import com.example.demo.pdfform.command.DownloadCommand;
import com.example.demo.pdfform.command.DownloadResult;
import com.example.demo.pdfform.command.FillCommand;
import com.example.demo.pdfform.command.InspectCommand;
import com.example.demo.pdfform.command.InspectResult;
import com.example.demo.pdfform.config.PdfFormProperties;
import com.example.demo.pdfform.config.WorkflowExecutorConfiguration;
import com.example.demo.pdfform.event.EventPublisher;
import com.example.demo.pdfform.event.EventType;
import com.example.demo.pdfform.event.WorkflowEventData;
import com.example.demo.pdfform.exception.CatalogException;
import com.example.demo.pdfform.exception.ErrorCode;
import com.example.demo.pdfform.exception.PdfFormException;
import com.example.demo.pdfform.exception.Stage;
import com.example.demo.pdfform.exception.WorkflowException;
import com.example.demo.pdfform.fill.FillResult;
import com.example.demo.pdfform.model.CatalogEntry;
import com.example.demo.pdfform.model.FormTemplate;
import com.example.demo.pdfform.model.Provenance;
import com.example.demo.pdfform.provenance.ProvenanceStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Runs catalog lookup, download, inspect and fill as one workflow.
 *
 * Each step keeps its own error; a failure is rethrown as a {@link WorkflowException}
 * naming the step. Background runs go through {@link #submit} and report progress on
 * the event bus only.
 */
@Slf4j
@Service
public class WorkflowService {
    public static final String STEP_BROWSE = "browse";
    public static final String STEP_DOWNLOAD = "download";
    public static final String STEP_INSPECT = "inspect";
    public static final String STEP_FILL = "fill";

    private final CatalogLoader catalogLoader;
    private final DownloadCommand downloadCommand;
    private final InspectCommand inspectCommand;
    private final FillCommand fillCommand;
    private final ProvenanceStore provenanceStore;
    private final EventPublisher events;
    private final PdfFormProperties properties;
    private final Executor executor;

    public WorkflowService(CatalogLoader catalogLoader,
                           DownloadCommand downloadCommand,
                           InspectCommand inspectCommand,
                           FillCommand fillCommand,
                           ProvenanceStore provenanceStore,
                           EventPublisher events,
                           PdfFormProperties properties,
                           @Qualifier(WorkflowExecutorConfiguration.WORKFLOW_EXECUTOR) Executor executor) {
        this.catalogLoader = catalogLoader;
        this.downloadCommand = downloadCommand;
        this.inspectCommand = inspectCommand;
        this.fillCommand = fillCommand;
        this.provenanceStore = provenanceStore;
        this.events = events;
        this.properties = properties;
        this.executor = executor;
    }

    @LogExecutionTime("Form Workflow")
    public WorkflowResult runWorkflow(WorkflowRequest request) {
        return runWorkflow(properties.catalogFilePath(), request);
    }

    @LogExecutionTime("Form Workflow")
    public WorkflowResult runWorkflow(Path catalogPath, WorkflowRequest request) {
        String formCode = request.getFormCode();
        Path outputDir = request.getOutputDir() == null ? properties.dataPath() : request.getOutputDir();
        WorkflowEventData data = WorkflowEventData.builder()
                .formCode(formCode)
                .outputDir(outputDir.toString())
                .build();
        events.emit(EventType.WORKFLOW_STARTED, data);
        log.info("Starting workflow for {} into {}", formCode, outputDir);

        try {
            // 1. the form must exist before anything is written
            FormsCatalog catalog = step(STEP_BROWSE, () -> {
                FormsCatalog loaded = catalogLoader.load(catalogPath);
                if (loaded.byCode(formCode).isEmpty()) {
                    throw new CatalogException(ErrorCode.NOT_FOUND, Stage.FIND_FORM, "form '" + formCode + "' not found");
                }
                return loaded;
            });

            // 2. download
            DownloadResult download = step(STEP_DOWNLOAD,
                    () -> downloadCommand.download(catalog, formCode, outputDir.resolve(properties.getDownloadsDir())));
            data = data.toBuilder().pdfPath(download.getPdfPath().toString()).build();

            // 3. inspect
            InspectResult inspect = step(STEP_INSPECT,
                    () -> inspectCommand.inspectInto(download.getPdfPath(), outputDir.resolve(properties.getTemplatesDir())));
            data = data.toBuilder().templatePath(inspect.getTemplatePath().toString()).build();

            // 4. fill the downloaded document with the caller's values
            FormTemplate template = FormTemplate.builder()
                    .documentReference(download.getPdfPath().toString())
                    .provenance(inspect.getTemplate().getProvenance())
                    .fields(request.getFields() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(request.getFields()))
                    .build();
            FillResult fill = step(STEP_FILL,
                    () -> fillCommand.fill(template, null, outputDir.resolve(properties.getOutputsDir()), request.isFlatten()));

            Provenance provenance = provenanceStore.readAdvisory(download.getPdfPath()).orElse(null);
            events.emit(EventType.WORKFLOW_COMPLETED, data.toBuilder()
                    .outputPath(fill.getOutputPath().toString())
                    .build());
            return WorkflowResult.builder()
                    .formCode(formCode)
                    .downloadPath(download.getPdfPath())
                    .templatePath(inspect.getTemplatePath())
                    .filledPath(fill.getOutputPath())
                    .flattened(fill.isFlattened())
                    .provenance(provenance)
                    .build();
        } catch (WorkflowException e) {
            events.emitError(EventType.WORKFLOW_ERROR, e, data.toBuilder()
                    .step(e.getStep())
                    .stage(e.getStage())
                    .build());
            throw e;
        }
    }

    /**
     * Run the workflow for each code. A failing form does not stop the others.
     *
     * @param fieldData values per form code; codes without an entry are filled with no values
     */
    public BulkWorkflowResult runBulkWorkflow(List<String> formCodes, Map<String, Map<String, String>> fieldData,
                                              Path outputDir, boolean flatten) {
        BulkWorkflowResult result = new BulkWorkflowResult();
        for (String formCode : formCodes) {
            Map<String, String> fields = fieldData == null ? null : fieldData.get(formCode);
            WorkflowRequest request = WorkflowRequest.builder()
                    .formCode(formCode)
                    .fields(fields == null ? new LinkedHashMap<>() : fields)
                    .outputDir(outputDir)
                    .flatten(flatten)
                    .build();
            try {
                result.recordSuccess(formCode, runWorkflow(request));
            } catch (PdfFormException e) {
                log.warn("Bulk workflow: {} failed: {}", formCode, e.getMessage());
                result.recordFailure(formCode, e);
            }
        }
        log.info("Bulk workflow finished: {} of {} forms succeeded", result.getSuccess(), result.getTotal());
        return result;
    }

    /**
     * Re-download a form only when forced or when {@code existingDir} has no copy of it.
     * Existing copies are never compared by content.
     *
     * @param outputDir where a new copy goes; null means {@code existingDir}
     */
    public UpdateWorkflowResult runUpdateWorkflow(String formCode, Path existingDir, Path outputDir, boolean force) {
        FormsCatalog catalog = catalogLoader.load(properties.catalogFilePath());
        CatalogEntry form = catalog.byCode(formCode).orElseThrow(() -> new CatalogException(
                ErrorCode.NOT_FOUND, Stage.FIND_FORM, "form '" + formCode + "' not found in catalog"));

        Path existing = existingDir.resolve(DownloadCommand.fileName(form));
        Path oldPath = Files.isRegularFile(existing) ? existing : null;
        Provenance oldProvenance = oldPath == null ? null : provenanceStore.readAdvisory(oldPath).orElse(null);

        UpdateWorkflowResult.UpdateWorkflowResultBuilder result = UpdateWorkflowResult.builder()
                .formCode(form.getFormCode())
                .oldPath(oldPath)
                .oldProvenance(oldProvenance);
        if (!force && oldPath != null) {
            log.info("{} already present at {}, not updating", form.getFormCode(), oldPath);
            return result.updated(false).newPath(oldPath).newProvenance(oldProvenance).build();
        }

        Path target = outputDir == null ? existingDir : outputDir;
        DownloadResult download = downloadCommand.download(catalog, formCode, target);
        return result.updated(true)
                .newPath(download.getPdfPath())
                .newProvenance(provenanceStore.readAdvisory(download.getPdfPath()).orElse(null))
                .build();
    }

    public CompletableFuture<WorkflowResult> submit(WorkflowRequest request) {
        return CompletableFuture.supplyAsync(() -> runWorkflow(request), executor);
    }

    public CompletableFuture<BulkWorkflowResult> submitBulk(List<String> formCodes, Map<String, Map<String, String>> fieldData,
                                                            Path outputDir, boolean flatten) {
        return CompletableFuture.supplyAsync(() -> runBulkWorkflow(formCodes, fieldData, outputDir, flatten), executor);
    }

    private <T> T step(String step, Supplier<T> action) {
        try {
            return action.get();
        } catch (PdfFormException e) {
            throw new WorkflowException(step, e);
        }
    }
}
