package com.salesanalytics.streaming;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a call's stream ended, as reported in {@code stream_stopped}.
 */
public enum StopReason {

    STOPPED("stopped", "Streaming stopped by client request."),
    FAILURE("failure", "Streaming stopped after repeated sampling failures."),
    IDLE("idle", "Streaming stopped because no subscribers remain."),
    SHUTDOWN("shutdown", "Server is shutting down.");

    private final String value;
    private final String description;

    StopReason(String value, String description) {
        this.value = value;
        this.description = description;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDescription() {
        return description;
    }
}
