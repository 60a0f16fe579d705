package com.example.demo.pdfform.event;

import com.example.demo.pdfform.config.JacksonConfiguration;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

/**
 * Stream setup of SseEventStream against the injected pump executor
 */
public class SseEventStreamTest {
    private final EventBus bus = new EventBus(10);

    @Test
    public void testOpenHandsOnePumpToExecutor() {
        List<Runnable> submitted = new ArrayList<>();
        SseEventStream stream = new SseEventStream(bus, JacksonConfiguration.createObjectMapper(), submitted::add);

        SseEmitter emitter = stream.open("fill.*");

        assertNotNull(emitter);
        assertEquals(1, submitted.size());
        assertEquals(1, bus.subscriberCount());
    }

    @Test
    public void testBusyExecutorRefusesStreamAndReleasesSubscription() {
        Executor busy = mock(Executor.class);
        doThrow(new RejectedExecutionException("pool exhausted")).when(busy).execute(any());
        SseEventStream stream = new SseEventStream(bus, JacksonConfiguration.createObjectMapper(), busy);

        ResponseStatusException e = assertThrows(ResponseStatusException.class, () -> stream.open("*"));

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, e.getStatusCode());
        assertEquals(0, bus.subscriberCount());
    }
}
