package com.example.demo.pdfform.event;

import com.example.demo.pdfform.config.EventStreamExecutorConfiguration;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Forwards event bus subscriptions to server-sent event clients.
 *
 * Each client gets its own subscription and pump thread. Events go out one per SSE
 * message, named by event type, in publish order. A comment line is sent as heartbeat
 * whenever no event arrived within the heartbeat interval.
 */
@Slf4j
@Component
public class SseEventStream {
    static final Duration HEARTBEAT_INTERVAL = Duration.ofSeconds(15);

    private final EventBus eventBus;
    private final ObjectMapper objectMapper;
    private final Executor pumps;

    public SseEventStream(EventBus eventBus, ObjectMapper objectMapper,
                          @Qualifier(EventStreamExecutorConfiguration.EVENT_STREAM_EXECUTOR) Executor pumps) {
        this.eventBus = eventBus;
        this.objectMapper = objectMapper;
        this.pumps = pumps;
    }

    public SseEmitter open(String pattern) {
        SseEmitter emitter = new SseEmitter(0L);
        Subscription subscription = eventBus.subscribe(pattern);
        emitter.onCompletion(subscription::close);
        emitter.onTimeout(subscription::close);
        emitter.onError(error -> subscription.close());
        try {
            pumps.execute(() -> pump(subscription, emitter));
        } catch (RejectedExecutionException e) {
            subscription.close();
            log.warn("Event stream for '{}' refused, all stream threads busy", pattern);
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Too many open event streams", e);
        }
        log.info("Event stream opened for '{}'", pattern);
        return emitter;
    }

    void pump(Subscription subscription, SseEmitter emitter) {
        try {
            while (!subscription.isClosed()) {
                Event event = subscription.poll(HEARTBEAT_INTERVAL);
                if (event == null) {
                    if (!subscription.isClosed()) {
                        emitter.send(SseEmitter.event().comment("heartbeat"));
                    }
                } else {
                    emitter.send(SseEmitter.event()
                            .name(event.getType().wireName())
                            .data(toJson(event), MediaType.APPLICATION_JSON));
                }
            }
            emitter.complete();
        } catch (IOException e) {
            log.debug("Event stream client went away: {}", e.getMessage());
            emitter.completeWithError(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            emitter.complete();
        } finally {
            subscription.close();
        }
    }

    String toJson(Event event) throws JsonProcessingException {
        return objectMapper.writeValueAsString(event);
    }
}
