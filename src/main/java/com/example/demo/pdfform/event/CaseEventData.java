package com.example.demo.pdfform.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Payload of {@code case.*} events.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CaseEventData implements EventData {
    String caseId;
    String casePath;
    String entityName;
    String formCode;
    Integer caseCount;
    Integer fieldCount;
    Boolean valid;
    List<String> missingFields;
    String stage;
}
