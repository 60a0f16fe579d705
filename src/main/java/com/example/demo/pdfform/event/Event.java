package com.example.demo.pdfform.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

import java.time.Instant;

/**
 * Something that happened during a command. Immutable once published.
 *
 * Wire form: {@code {"type": "download.progress", "timestamp": "...", "data": {...}, "error": "..."}}
 */
@Value
@JsonPropertyOrder({"type", "timestamp", "data", "error"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Event {
    EventType type;
    Instant timestamp;
    EventData data;
    /**
     * Message of the failure, only on error events
     */
    String error;

    public static Event of(EventType type, Instant timestamp, EventData data) {
        return new Event(type, timestamp, data, null);
    }

    public static Event error(EventType type, Instant timestamp, EventData data, String error) {
        return new Event(type, timestamp, data, error);
    }

    @JsonIgnore
    public String getStage() {
        return data == null ? null : data.getStage();
    }

    /**
     * Payload cast to its family type, for subscribers that know what they subscribed to.
     */
    public <T extends EventData> T dataAs(Class<T> dataType) {
        return dataType.cast(data);
    }
}
