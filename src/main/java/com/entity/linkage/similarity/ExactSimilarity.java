package com.entity.linkage.similarity;

/**
 * Exact equality after trimming and case folding.
 */
public class ExactSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        String a = s1.trim();
        return !a.isEmpty() && a.equalsIgnoreCase(s2.trim()) ? 1.0 : 0.0;
    }

    @Override
    public String getName() {
        return "exact";
    }
}
