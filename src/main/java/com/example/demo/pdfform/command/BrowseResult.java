package com.example.demo.pdfform.command;

import com.example.demo.pdfform.model.CatalogEntry;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class BrowseResult {
    String catalogPath;
    /**
     * Requested region, null when browsing everything
     */
    String region;
    List<String> regions;
    List<CatalogEntry> forms;
}
