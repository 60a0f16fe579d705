package com.example.demo.pdfform.workflow;

import com.example.demo.pdfform.model.Provenance;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

@Value
@Builder
public class WorkflowResult {
    String formCode;
    Path downloadPath;
    Path templatePath;
    Path filledPath;
    boolean flattened;
    /**
     * Provenance of the downloaded form, null when its sidecar could not be read
     */
    Provenance provenance;
}
