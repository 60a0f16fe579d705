package com.example.demo.pdfform.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * Payload of {@code workflow.*} events; {@code step} is the workflow step (browse, download, inspect, fill),
 * {@code stage} the internal stage that step was in.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class WorkflowEventData implements EventData {
    String formCode;
    String step;
    String outputDir;
    String pdfPath;
    String templatePath;
    String outputPath;
    String stage;
}
