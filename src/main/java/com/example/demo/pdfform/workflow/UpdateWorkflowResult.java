package com.example.demo.pdfform.workflow;

import com.example.demo.pdfform.model.Provenance;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

@Value
@Builder
public class UpdateWorkflowResult {
    String formCode;
    /**
     * False when a copy already existed and no update was forced
     */
    boolean updated;
    Path oldPath;
    Path newPath;
    Provenance oldProvenance;
    Provenance newProvenance;
}
