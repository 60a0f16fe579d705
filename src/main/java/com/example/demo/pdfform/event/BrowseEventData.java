package com.example.demo.pdfform.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * Payload of {@code browse.*} events. Stages: load_catalog, filter_forms.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BrowseEventData implements EventData {
    String catalogPath;
    String region;
    Integer regionCount;
    Integer formCount;
    String stage;
}
