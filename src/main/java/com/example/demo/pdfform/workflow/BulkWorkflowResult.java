package com.example.demo.pdfform.workflow;

import com.example.demo.pdfform.exception.PdfFormException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-form outcome of a bulk run, keyed by form code.
 */
@Getter
public class BulkWorkflowResult {
    private final Map<String, WorkflowResult> results = new LinkedHashMap<>();
    @JsonIgnore
    private final Map<String, PdfFormException> failures = new LinkedHashMap<>();
    private int total;
    private int success;
    private int failed;

    void recordSuccess(String formCode, WorkflowResult result) {
        results.put(formCode, result);
        total++;
        success++;
    }

    void recordFailure(String formCode, PdfFormException error) {
        failures.put(formCode, error);
        total++;
        failed++;
    }

    /**
     * Failure message per form code
     */
    public Map<String, String> getErrors() {
        Map<String, String> messages = new LinkedHashMap<>();
        failures.forEach((code, error) -> messages.put(code, error.getMessage()));
        return Collections.unmodifiableMap(messages);
    }
}
