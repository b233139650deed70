package com.txlens.pipeline;

import lombok.Getter;

/**
 * A tool's {@code process} failed and the run was stopped. The original failure is the {@link #getCause() cause}.
 */
@Getter
public class ToolExecutionException extends PipelineException {

    private final String toolName;

    public ToolExecutionException(String toolName, Throwable cause) {
        super("Tool " + toolName + " failed: " + cause.getMessage(), cause);
        this.toolName = toolName;
    }
}
