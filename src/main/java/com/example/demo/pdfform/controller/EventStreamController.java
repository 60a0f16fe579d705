package com.example.demo.pdfform.controller;

import com.example.demo.pdfform.event.EventBus;
import com.example.demo.pdfform.event.SseEventStream;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Live event stream. {@code pattern} uses the event bus syntax: {@code *}, {@code fill.*} or an exact type.
 */
@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
public class EventStreamController {
    private final SseEventStream eventStream;

    @GetMapping(produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestParam(defaultValue = EventBus.ALL) String pattern) {
        return eventStream.open(pattern);
    }
}
