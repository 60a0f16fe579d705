package com.example.demo.pdfform.event;

/**
 * Typed payload of an {@link Event}. One implementation per event family.
 */
public interface EventData {

    /**
     * Internal step the event refers to; on error events, the step that failed
     */
    String getStage();
}
