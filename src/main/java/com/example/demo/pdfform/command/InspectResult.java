package com.example.demo.pdfform.command;

import com.example.demo.pdfform.model.FormTemplate;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

@Value
@Builder
public class InspectResult {
    Path pdfPath;
    Path templatePath;
    List<String> fields;
    FormTemplate template;
    /**
     * Whether a provenance sidecar existed and got its inspected timestamp
     */
    boolean provenanceUpdated;
}
