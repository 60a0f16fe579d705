package com.example.demo.pdfform.fill;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

@Value
@Builder
public class FillRequest {
    String documentReference;

    @Builder.Default
    Map<String, String> fields = new LinkedHashMap<>();

    /**
     * Exact output file; takes precedence over {@link #outputDir}
     */
    Path outputPath;

    Path outputDir;

    boolean flatten;
}
