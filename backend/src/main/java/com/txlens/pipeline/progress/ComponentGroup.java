package com.txlens.pipeline.progress;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Processing phase a component belongs to; clients use it for visual grouping.
 */
public enum ComponentGroup {
    DATA("data"),
    DECODING("decoding"),
    ENRICHMENT("enrichment"),
    ANALYSIS("analysis"),
    FINISHING("finishing");

    private final String wireName;

    ComponentGroup(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
