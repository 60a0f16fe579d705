package com.example.demo.pdfform.controller;

import com.example.demo.pdfform.command.BrowseCommand;
import com.example.demo.pdfform.command.BrowseResult;
import com.example.demo.pdfform.command.DownloadCommand;
import com.example.demo.pdfform.command.DownloadResult;
import com.example.demo.pdfform.command.FillCommand;
import com.example.demo.pdfform.command.InspectCommand;
import com.example.demo.pdfform.command.InspectResult;
import com.example.demo.pdfform.config.PdfFormProperties;
import com.example.demo.pdfform.exception.PdfFormException;
import com.example.demo.pdfform.fill.FillResult;
import com.example.demo.pdfform.fill.OutputPaths;
import com.example.demo.pdfform.model.DownloadRequest;
import com.example.demo.pdfform.model.FillFormRequest;
import com.example.demo.pdfform.model.InspectRequest;
import com.example.demo.pdfform.model.WorkflowRunRequest;
import com.example.demo.pdfform.workflow.WorkflowRequest;
import com.example.demo.pdfform.workflow.WorkflowService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST API for the catalog, download, inspect, fill and workflow operations.
 *
 * Progress is not part of the responses; subscribe to {@code /api/events} for it.
 */
@Slf4j
@RestController
@RequestMapping("/api/forms")
@RequiredArgsConstructor
public class FormController {
    private final BrowseCommand browseCommand;
    private final DownloadCommand downloadCommand;
    private final InspectCommand inspectCommand;
    private final FillCommand fillCommand;
    private final WorkflowService workflowService;
    private final PdfFormProperties properties;

    /**
     * GET /api/forms/browse?region=QLD
     */
    @GetMapping("/browse")
    public ResponseEntity<?> browse(@RequestParam(required = false) String region) {
        try {
            BrowseResult result = browseCommand.browse(region);
            return ResponseEntity.ok(result);
        } catch (PdfFormException e) {
            return ApiErrors.toResponse(e);
        }
    }

    @PostMapping("/download")
    public ResponseEntity<?> download(@RequestBody DownloadRequest request) {
        log.info("Received download request for form: {}", request.getFormCode());
        try {
            Path outputDir = isBlank(request.getOutputDir()) ? properties.downloadsPath() : Paths.get(request.getOutputDir());
            DownloadResult result = downloadCommand.download(request.getFormCode(), outputDir);
            return ResponseEntity.ok(result);
        } catch (PdfFormException e) {
            return ApiErrors.toResponse(e);
        }
    }

    @PostMapping("/inspect")
    public ResponseEntity<?> inspect(@RequestBody InspectRequest request) {
        log.info("Received inspect request for: {}", request.getPdfPath());
        try {
            String output = isBlank(request.getOutput()) ? properties.templatesPath().toString() : request.getOutput();
            InspectResult result = inspectCommand.inspect(Paths.get(request.getPdfPath()), output);
            return ResponseEntity.ok(result);
        } catch (PdfFormException e) {
            return ApiErrors.toResponse(e);
        }
    }

    /**
     * POST /api/forms/fill
     * {
     *   "templatePath": ".data/templates/f3520_template.json",
     *   "flatten": true
     * }
     *
     * An inline {@code template} can be sent instead of {@code templatePath}.
     */
    @PostMapping("/fill")
    public ResponseEntity<?> fill(@RequestBody FillFormRequest request) {
        try {
            String output = isBlank(request.getOutput()) ? properties.outputsPath().toString() : request.getOutput();
            FillResult result;
            if (request.getTemplate() != null) {
                boolean toDirectory = OutputPaths.isDirectoryArgument(output);
                result = fillCommand.fill(request.getTemplate(),
                        toDirectory ? null : Paths.get(output),
                        toDirectory ? Paths.get(output) : null,
                        request.isFlatten());
            } else if (!isBlank(request.getTemplatePath())) {
                result = fillCommand.fill(Paths.get(request.getTemplatePath()), output, request.isFlatten());
            } else {
                return ResponseEntity.badRequest().body(Map.of(
                        "code", "INVALID_REQUEST",
                        "description", "Either templatePath or template is required"));
            }
            return ResponseEntity.ok(result);
        } catch (PdfFormException e) {
            return ApiErrors.toResponse(e);
        }
    }

    /**
     * Start a workflow in the background and return immediately. Outcome and progress
     * arrive as {@code workflow.*} events.
     */
    @PostMapping("/workflow")
    public ResponseEntity<Map<String, Object>> workflow(@RequestBody WorkflowRunRequest request) {
        Path outputDir = isBlank(request.getOutputDir()) ? properties.dataPath() : Paths.get(request.getOutputDir());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "accepted");

        if (!request.getFormCodes().isEmpty()) {
            workflowService.submitBulk(request.getFormCodes(), request.getFieldData(), outputDir, request.isFlatten())
                    .whenComplete((result, error) -> {
                        if (error != null) {
                            log.error("Bulk workflow failed", error);
                        }
                    });
            body.put("formCodes", request.getFormCodes());
        } else if (!isBlank(request.getFormCode())) {
            WorkflowRequest workflowRequest = WorkflowRequest.builder()
                    .formCode(request.getFormCode())
                    .fields(request.getFields() == null ? new LinkedHashMap<>() : request.getFields())
                    .outputDir(outputDir)
                    .flatten(request.isFlatten())
                    .build();
            workflowService.submit(workflowRequest).whenComplete((result, error) -> {
                if (error != null) {
                    log.warn("Workflow for {} failed: {}", request.getFormCode(), error.getMessage());
                }
            });
            body.put("formCode", request.getFormCode());
        } else {
            body.put("status", "rejected");
            body.put("description", "formCode or formCodes is required");
            return ResponseEntity.badRequest().body(body);
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
