package com.txlens.pipeline.progress;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Snapshot of one component's progress. Duration is measured from the first update seen for the id.
 */
public record ComponentUpdate(
        String id,
        ComponentGroup group,
        String title,
        ComponentStatus status,
        String description,
        Instant timestamp,
        @JsonProperty("start_time") Instant startTime,
        @JsonProperty("duration_ms") long durationMs
) {
}
