package com.example.demo.pdfform.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * One row of the forms catalog. Immutable once loaded.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CatalogEntry {
    String region;
    String formName;
    /**
     * Unique within a catalog, compared case-insensitively
     */
    String formCode;
    String description;
    /**
     * Document format, e.g. PDF or DOCX
     */
    String format;
    String sourceUrl;
    String infoUrl;
    boolean onlineAvailable;
    String notes;

    public boolean hasSource() {
        return sourceUrl != null && !sourceUrl.isBlank();
    }

    public boolean isPdf() {
        return "PDF".equalsIgnoreCase(format);
    }
}
