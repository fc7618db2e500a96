package com.entity.linkage.similarity;

import java.util.Locale;

/**
 * Per-field comparison methods available to the scorer.
 */
public enum ComparisonMethod {
    EXACT(new ExactSimilarity()),
    NGRAM(new NGramSimilarity()),
    NGRAM_DICE(new NGramSimilarity(3, NGramSimilarity.Coefficient.DICE)),
    LEVENSHTEIN(new LevenshteinSimilarity()),
    JARO_WINKLER(new JaroWinklerSimilarity()),
    PHONETIC(new PhoneticSimilarity());

    private final SimilarityAlgorithm algorithm;

    ComparisonMethod(SimilarityAlgorithm algorithm) {
        this.algorithm = algorithm;
    }

    public SimilarityAlgorithm algorithm() {
        return algorithm;
    }

    /**
     * Resolves a method from a config suffix such as {@code ngram} or {@code jaro_winkler}.
     */
    public static ComparisonMethod fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Comparison method name must not be null");
        }
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
