package com.txlens.pipeline;

import lombok.Getter;

/**
 * Failure raised by a tool itself, carrying a machine-readable code (e.g. MISSING_INPUT, LLM_UNAVAILABLE).
 */
@Getter
public class ToolException extends RuntimeException {

    private final String toolName;
    private final String code;

    public ToolException(String toolName, String code, String message) {
        super(message);
        this.toolName = toolName;
        this.code = code;
    }

    public ToolException(String toolName, String code, String message, Throwable cause) {
        super(message, cause);
        this.toolName = toolName;
        this.code = code;
    }
}
