package com.txlens.pipeline;

import java.time.Duration;
import java.time.Instant;

/**
 * Timing and outcome of one tool invocation within a run.
 */
public record ToolRunRecord(String toolName, Instant startedAt, Duration elapsed, Outcome outcome, String failureMessage) {

    public enum Outcome {
        SUCCEEDED,
        FAILED
    }

    public static ToolRunRecord succeeded(String toolName, Instant startedAt, Duration elapsed) {
        return new ToolRunRecord(toolName, startedAt, elapsed, Outcome.SUCCEEDED, null);
    }

    public static ToolRunRecord failed(String toolName, Instant startedAt, Duration elapsed, Throwable failure) {
        return new ToolRunRecord(toolName, startedAt, elapsed, Outcome.FAILED, failure.getMessage());
    }
}
