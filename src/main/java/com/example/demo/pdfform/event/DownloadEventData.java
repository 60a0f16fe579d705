package com.example.demo.pdfform.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * Payload of {@code download.*} events. {@code progress} is a fraction between 0 and 1.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DownloadEventData implements EventData {
    String formCode;
    String formName;
    String region;
    String outputDir;
    String pdfPath;
    String metadataPath;
    Double progress;
    String warning;
    String stage;
}
