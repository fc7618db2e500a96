package com.entity.linkage.ann;

import java.util.Comparator;

/**
 * A record found by a similarity search.
 */
public record VectorMatch(String key, double similarity, String method) {

    /**
     * Most similar first, ties broken by key.
     */
    public static final Comparator<VectorMatch> BY_SIMILARITY =
            Comparator.comparingDouble(VectorMatch::similarity).reversed()
                    .thenComparing(VectorMatch::key);
}
