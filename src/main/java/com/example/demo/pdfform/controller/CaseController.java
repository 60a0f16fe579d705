package com.example.demo.pdfform.controller;

import com.example.demo.pdfform.cases.CaseStore;
import com.example.demo.pdfform.command.CaseCommand;
import com.example.demo.pdfform.command.FillCommand;
import com.example.demo.pdfform.config.PdfFormProperties;
import com.example.demo.pdfform.exception.PdfFormException;
import com.example.demo.pdfform.model.CreateCaseRequest;
import com.example.demo.pdfform.model.FormCase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST API for cases. Cases are addressed by id and located under the configured cases directory.
 */
@Slf4j
@RestController
@RequestMapping("/api/cases")
@RequiredArgsConstructor
public class CaseController {
    private final CaseCommand caseCommand;
    private final FillCommand fillCommand;
    private final PdfFormProperties properties;

    @PostMapping
    public ResponseEntity<?> create(@RequestBody CreateCaseRequest request) {
        try {
            CaseStore.CreatedCase created = caseCommand.create(
                    request.getFormCode(), request.getCaseName(), request.getEntityName());
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("path", created.getPath().toString());
            body.put("case", created.getFormCase());
            return ResponseEntity.status(HttpStatus.CREATED).body(body);
        } catch (PdfFormException e) {
            return ApiErrors.toResponse(e);
        }
    }

    @GetMapping
    public ResponseEntity<?> list(@RequestParam(required = false) String entity) {
        try {
            List<String> paths = caseCommand.list(entity).stream()
                    .map(Path::toString)
                    .collect(Collectors.toList());
            return ResponseEntity.ok(paths);
        } catch (PdfFormException e) {
            return ApiErrors.toResponse(e);
        }
    }

    @GetMapping("/{caseId}")
    public ResponseEntity<?> get(@PathVariable String caseId) {
        try {
            return ResponseEntity.ok(caseCommand.load(caseCommand.findById(caseId)));
        } catch (PdfFormException e) {
            return ApiErrors.toResponse(e);
        }
    }

    /**
     * Merge the given values into the case's fields and save it.
     */
    @PutMapping("/{caseId}/fields")
    public ResponseEntity<?> saveFields(@PathVariable String caseId, @RequestBody Map<String, String> fields) {
        try {
            FormCase updated = caseCommand.updateFields(caseCommand.findById(caseId), fields);
            return ResponseEntity.ok(updated);
        } catch (PdfFormException e) {
            return ApiErrors.toResponse(e);
        }
    }

    @PostMapping("/{caseId}/validate")
    public ResponseEntity<?> validate(@PathVariable String caseId,
                                      @RequestParam(defaultValue = "false") boolean save) {
        try {
            FormCase validated = caseCommand.validate(caseCommand.findById(caseId), save);
            return ResponseEntity.ok(validated.getValidation());
        } catch (PdfFormException e) {
            return ApiErrors.toResponse(e);
        }
    }

    @PostMapping("/{caseId}/fill")
    public ResponseEntity<?> fill(@PathVariable String caseId,
                                  @RequestParam(defaultValue = "false") boolean flatten) {
        log.info("Received fill request for case: {}", caseId);
        try {
            Path casePath = caseCommand.findById(caseId);
            return ResponseEntity.ok(fillCommand.fillFromCase(casePath, properties.outputsPath(), flatten));
        } catch (PdfFormException e) {
            return ApiErrors.toResponse(e);
        }
    }
}
