package com.example.demo.pdfform.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named, reusable set of field values for one form, owned by one entity.
 *
 * Cases are only written by explicit saves; validation results live in memory
 * until the case is saved again.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"case_metadata", "form_reference", "fields", "validation"})
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FormCase {

    @Builder.Default
    private CaseMetadata caseMetadata = new CaseMetadata();

    @Builder.Default
    private FormReference formReference = new FormReference();

    @Builder.Default
    private Map<String, String> fields = new LinkedHashMap<>();

    private ValidationStatus validation;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class CaseMetadata {
        private String caseId;
        private String caseName;
        private String entityName;
        private Instant createdAt;
        private Instant updatedAt;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class FormReference {
        private String formCode;

        /**
         * Template JSON the case was built from; its document reference is used when the
         * case does not carry one itself
         */
        private String templatePath;

        private String documentReference;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class ValidationStatus {
        private boolean valid;

        @Builder.Default
        private List<String> missingFields = new ArrayList<>();

        @Builder.Default
        private List<String> invalidFields = new ArrayList<>();

        private Instant checkedAt;
    }
}
