package com.entity.linkage.embedding;

/**
 * An edge of the match graph with its walk weight.
 */
public record WeightedEdge(String from, String to, double weight) {

    public static final double DEFAULT_WEIGHT = 1.0;

    public WeightedEdge {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Edge endpoints must not be null");
        }
        if (Double.isNaN(weight) || weight <= 0.0) {
            weight = DEFAULT_WEIGHT;
        }
    }

    /**
     * Creates an edge; a missing weight defaults to 1.0.
     */
    public static WeightedEdge of(String from, String to, Double weight) {
        return new WeightedEdge(from, to, weight != null ? weight : DEFAULT_WEIGHT);
    }
}
