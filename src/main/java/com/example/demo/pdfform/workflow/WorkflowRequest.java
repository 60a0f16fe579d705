package com.example.demo.pdfform.workflow;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

@Value
@Builder
public class WorkflowRequest {
    String formCode;

    @Builder.Default
    Map<String, String> fields = new LinkedHashMap<>();

    /**
     * Root for the {@code downloads}, {@code templates} and {@code outputs} subdirectories
     */
    Path outputDir;

    boolean flatten;
}
