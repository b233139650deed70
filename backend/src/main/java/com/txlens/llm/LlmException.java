package com.txlens.llm;

import lombok.Getter;

/**
 * Failure talking to the language model. Retryable failures are rate limits, upstream 5xx and transport
 * errors.
 */
@Getter
public class LlmException extends RuntimeException {

    private final boolean retryable;

    public LlmException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public LlmException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }
}
