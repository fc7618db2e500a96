package com.entity.linkage.edge;

import java.util.Map;

/**
 * An edge to create between two records.
 */
public record EdgeRequest(String fromId, String toId, double similarity, Map<String, Object> metadata) {

    public EdgeRequest {
        if (fromId == null || toId == null) {
            throw new IllegalArgumentException("Edge endpoints must not be null");
        }
        if (fromId.equals(toId)) {
            throw new IllegalArgumentException("Self edges are not allowed: " + fromId);
        }
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public static EdgeRequest of(String fromId, String toId, double similarity) {
        return new EdgeRequest(fromId, toId, similarity, Map.of());
    }
}
