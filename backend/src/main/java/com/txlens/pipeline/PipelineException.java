package com.txlens.pipeline;

/**
 * Base of all pipeline failures: construction errors at registration time and tool failures at run time.
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
