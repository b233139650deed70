package com.txlens.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Set of retrieval fragments returned by {@link Tool#getRagContext}.
 */
public final class RagContext {

    private final List<RagContextItem> items = new ArrayList<>();

    public static RagContext empty() {
        return new RagContext();
    }

    public RagContext addItem(RagContextItem item) {
        if (item != null) {
            items.add(item);
        }
        return this;
    }

    public RagContext merge(RagContext other) {
        if (other != null) {
            items.addAll(other.items);
        }
        return this;
    }

    public List<RagContextItem> getItems() {
        return Collections.unmodifiableList(items);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    /** Items ordered by descending relevance, limited to {@code limit}. */
    public List<RagContextItem> topByRelevance(int limit) {
        return items.stream()
                .sorted(Comparator.comparingDouble(RagContextItem::relevance).reversed())
                .limit(Math.max(0, limit))
                .toList();
    }
}
