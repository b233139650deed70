package com.txlens.pipeline;

/**
 * Lifecycle of one {@link BaggagePipeline#execute} call.
 */
public enum PipelineRunState {
    NOT_STARTED,
    RUNNING,
    COMPLETED,
    FAILED
}
