package com.txlens.pipeline.progress;

/**
 * Optional receiver of per-tool phase transitions from the pipeline. Failures thrown from here are logged
 * by the pipeline and never change the run outcome.
 */
@FunctionalInterface
public interface ProgressSink {

    void onToolStatus(String toolName, ComponentStatus status, String description);
}
