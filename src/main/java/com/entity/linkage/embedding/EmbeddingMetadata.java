package com.entity.linkage.embedding;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * How a set of embeddings was produced, stored next to each vector.
 */
public record EmbeddingMetadata(String method, int dimensions, int requestedDimensions, int walkLength,
                                int numWalks, int windowSize, long seed, int nodes) {

    public static final String METHOD = "node2vec_svd";

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("method", method);
        map.put("dimensions", dimensions);
        map.put("walk_length", walkLength);
        map.put("num_walks", numWalks);
        map.put("window_size", windowSize);
        map.put("seed", seed);
        return map;
    }
}
