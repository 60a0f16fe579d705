package com.example.demo.pdfform.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * Payload of {@code fill.*} events. Either {@code templatePath} or {@code casePath} names the input.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FillEventData implements EventData {
    String templatePath;
    String casePath;
    String inputPdf;
    String outputPath;
    String filledPath;
    Boolean flattened;
    String strategy;
    String fallbackReason;
    String stage;
}
