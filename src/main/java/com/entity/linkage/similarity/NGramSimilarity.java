package com.entity.linkage.similarity;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Character n-gram overlap similarity, using either the Jaccard index
 * ({@code |A∩B| / |A∪B|}) or the Dice coefficient ({@code 2|A∩B| / (|A|+|B|)}).
 * Strings shorter than {@code n} contribute themselves as a single gram.
 */
public class NGramSimilarity implements SimilarityAlgorithm {

    public enum Coefficient { JACCARD, DICE }

    private final int n;
    private final Coefficient coefficient;

    public NGramSimilarity() {
        this(3, Coefficient.JACCARD);
    }

    public NGramSimilarity(int n, Coefficient coefficient) {
        if (n < 1) {
            throw new IllegalArgumentException("n-gram size must be >= 1");
        }
        this.n = n;
        this.coefficient = coefficient;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        Set<String> a = grams(s1.trim().toLowerCase(Locale.ROOT), n);
        Set<String> b = grams(s2.trim().toLowerCase(Locale.ROOT), n);
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }

        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        if (coefficient == Coefficient.DICE) {
            return 2.0 * intersection.size() / (a.size() + b.size());
        }
        int union = a.size() + b.size() - intersection.size();
        return (double) intersection.size() / union;
    }

    @Override
    public String getName() {
        return coefficient == Coefficient.DICE ? "ngram_dice" : "ngram_jaccard";
    }

    /**
     * Returns the distinct character n-grams of a string in order of first appearance.
     */
    public static Set<String> grams(String value, int n) {
        Set<String> result = new LinkedHashSet<>();
        if (value == null || value.isEmpty()) {
            return result;
        }
        if (value.length() < n) {
            result.add(value);
            return result;
        }
        for (int i = 0; i + n <= value.length(); i++) {
            result.add(value.substring(i, i + n));
        }
        return result;
    }
}
