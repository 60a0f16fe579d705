package com.example.demo.pdfform.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A saved fill run with an expected outcome, kept under {@code cases/test_scenarios}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TestScenario {
    private String name;
    private String description;

    @JsonAlias("pdf_url")
    private String documentReference;

    @Builder.Default
    private Map<String, String> fields = new LinkedHashMap<>();

    /**
     * The scenario passes when the fill fails
     */
    private boolean expectError;
}
