package com.example.demo.pdfform.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Canonical field-name to value mapping for one document.
 *
 * Produced by the extractor with empty values, filled in by a user or a case, and
 * consumed by the fill engine. Field names are kept byte-for-byte as the document
 * declares them and their order is the document's field order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"document_reference", "provenance", "fields"})
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FormTemplate {
    /**
     * Local path or http(s) URL of the fillable document
     */
    @JsonAlias("pdf_url")
    private String documentReference;

    private Provenance provenance;

    @Builder.Default
    private Map<String, String> fields = new LinkedHashMap<>();
}
