package com.example.demo.pdfform.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Origin and processing history of a downloaded form, stored as a sidecar next to the PDF.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Provenance {
    @JsonAlias("catalog_form_code")
    private String originFormCode;

    @JsonAlias("catalog_state")
    private String originRegion;

    private String sourceUrl;

    private Instant downloadedAt;

    /**
     * Set when the document's fields were last inspected; null until then
     */
    private Instant inspectedAt;
}
