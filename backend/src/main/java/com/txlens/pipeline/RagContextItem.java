package com.txlens.pipeline;

import java.util.List;
import java.util.Map;

/**
 * One retrieval fragment contributed by a tool.
 *
 * @param id        unique id, stable for the same fact (e.g. "token:1:0xa0b8...")
 * @param type      category such as "token", "protocol", "address"
 * @param title     short description used for retrieval
 * @param content   text to embed or place into a prompt
 * @param metadata  structured data for filtering
 * @param keywords  retrieval hints
 * @param relevance base relevance in [0, 1]
 */
public record RagContextItem(
        String id,
        String type,
        String title,
        String content,
        Map<String, Object> metadata,
        List<String> keywords,
        double relevance
) {

    public RagContextItem {
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
        keywords = keywords != null ? List.copyOf(keywords) : List.of();
        relevance = Math.max(0.0, Math.min(1.0, relevance));
    }
}
