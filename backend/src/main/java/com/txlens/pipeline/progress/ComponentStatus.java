package com.txlens.pipeline.progress;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Phase of a progress component (a tool or a coarse analysis step).
 */
public enum ComponentStatus {
    INITIATED("initiated"),
    RUNNING("running"),
    FINISHED("finished"),
    ERROR("error");

    private final String wireName;

    ComponentStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == FINISHED || this == ERROR;
    }
}
