package com.example.demo.pdfform.event;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Namespaced event types as they appear on the wire ({@code family.action}).
 */
public enum EventType {
    BROWSE_STARTED("browse.started"),
    BROWSE_COMPLETED("browse.completed"),
    BROWSE_ERROR("browse.error"),

    DOWNLOAD_STARTED("download.started"),
    DOWNLOAD_PROGRESS("download.progress"),
    DOWNLOAD_COMPLETED("download.completed"),
    DOWNLOAD_ERROR("download.error"),

    INSPECT_STARTED("inspect.started"),
    INSPECT_COMPLETED("inspect.completed"),
    INSPECT_ERROR("inspect.error"),

    FILL_STARTED("fill.started"),
    FILL_COMPLETED("fill.completed"),
    FILL_ERROR("fill.error"),

    CASE_STARTED("case.started"),
    CASE_CREATED("case.created"),
    CASE_LOADED("case.loaded"),
    CASE_UPDATED("case.updated"),
    CASE_ERROR("case.error"),

    WORKFLOW_STARTED("workflow.started"),
    WORKFLOW_COMPLETED("workflow.completed"),
    WORKFLOW_ERROR("workflow.error"),

    TEST_STARTED("test.started"),
    TEST_COMPLETED("test.completed"),
    TEST_ERROR("test.error");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String family() {
        return wireName.substring(0, wireName.indexOf('.'));
    }

    public boolean isStarted() {
        return wireName.endsWith(".started");
    }

    public boolean isProgress() {
        return wireName.endsWith(".progress");
    }

    /**
     * Completed, created, loaded, updated or error: the last event of a command.
     */
    public boolean isTerminal() {
        return !isStarted() && !isProgress();
    }

    public boolean isError() {
        return wireName.endsWith(".error");
    }

    public static EventType fromWireName(String wireName) {
        for (EventType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown event type: " + wireName);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
