package com.example.demo.pdfform.event;

import com.example.demo.pdfform.exception.PdfFormException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Builds and publishes command events.
 */
@Slf4j
@Component
public class EventPublisher {
    private final EventBus eventBus;
    private final Clock clock;

    @Autowired
    public EventPublisher(EventBus eventBus) {
        this(eventBus, Clock.systemUTC());
    }

    public EventPublisher(EventBus eventBus, Clock clock) {
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public Event emit(EventType type, EventData data) {
        Event event = Event.of(type, clock.instant(), data);
        eventBus.publish(event);
        return event;
    }

    /**
     * Publish the error event for {@code failure}. {@code data} should carry the
     * failure's stage; the event's error text is the exception message.
     */
    public Event emitError(EventType type, PdfFormException failure, EventData data) {
        log.error("{} at stage '{}': {}", type, failure.getStage(), failure.getMessage());
        Event event = Event.error(type, clock.instant(), data, failure.getMessage());
        eventBus.publish(event);
        return event;
    }
}
