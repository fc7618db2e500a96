package com.entity.linkage.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A persisted similarity edge between two records.
 * The key is derived from the canonical endpoint order, so an edge and its
 * reverse share one key.
 */
public record MatchEdge(String key, String fromId, String toId, double similarity,
                        String method, Instant timestamp, Map<String, Object> metadata) {

    public MatchEdge {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(fromId, "fromId must not be null");
        Objects.requireNonNull(toId, "toId must not be null");
        Objects.requireNonNull(method, "method must not be null");
        timestamp = timestamp != null ? timestamp : Instant.now();
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    /**
     * Returns the same edge with endpoints swapped; the key is unchanged.
     */
    public MatchEdge reversed() {
        return new MatchEdge(key, toId, fromId, similarity, method, timestamp, metadata);
    }
}
