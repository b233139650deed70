package com.txlens.pipeline.progress;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Event published by {@link ProgressTracker}: a component update, the final result, or the final error.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgressEvent(String type, ComponentUpdate component, Object result, String error, Instant timestamp) {

    public static final String COMPONENT_UPDATE = "component_update";
    public static final String COMPLETE = "complete";
    public static final String ERROR = "error";

    public static ProgressEvent componentUpdate(ComponentUpdate component) {
        return new ProgressEvent(COMPONENT_UPDATE, component, null, null, Instant.now());
    }

    public static ProgressEvent complete(Object result) {
        return new ProgressEvent(COMPLETE, null, result, null, Instant.now());
    }

    public static ProgressEvent error(String message) {
        return new ProgressEvent(ERROR, null, null, message, Instant.now());
    }

    public boolean isTerminal() {
        return COMPLETE.equals(type) || ERROR.equals(type);
    }
}
