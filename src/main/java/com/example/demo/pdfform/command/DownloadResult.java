package com.example.demo.pdfform.command;

import com.example.demo.pdfform.model.CatalogEntry;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

@Value
@Builder
public class DownloadResult {
    Path pdfPath;
    CatalogEntry form;
    /**
     * Provenance sidecar, null if it could not be written
     */
    Path metadataPath;
    @Singular
    List<String> warnings;
}
