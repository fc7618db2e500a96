package com.entity.linkage.embedding;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Node vectors keyed by record id, in id order.
 */
public record EmbeddingResult(Map<String, double[]> vectors, EmbeddingMetadata metadata) {

    public EmbeddingResult {
        vectors = Collections.unmodifiableMap(new TreeMap<>(vectors));
    }

    public boolean isEmpty() {
        return vectors.isEmpty();
    }

    public double[] vector(String recordId) {
        double[] v = vectors.get(recordId);
        return v != null ? v.clone() : null;
    }
}
