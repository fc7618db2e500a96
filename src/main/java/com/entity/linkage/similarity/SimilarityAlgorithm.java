package com.entity.linkage.similarity;

/**
 * Pure string similarity function.
 * All implementations return a score between 0.0 (no similarity) and 1.0 (identical)
 * and return 0.0 when either side is null.
 */
public interface SimilarityAlgorithm {

    /**
     * Computes the similarity between two strings.
     *
     * @param s1 first string
     * @param s2 second string
     * @return similarity score between 0.0 and 1.0
     */
    double compute(String s1, String s2);

    /**
     * Returns the name of this algorithm, used as the algorithm tag on field results.
     */
    String getName();
}
