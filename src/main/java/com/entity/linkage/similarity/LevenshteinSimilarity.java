package com.entity.linkage.similarity;

import java.util.Locale;

/**
 * Normalized Levenshtein similarity: {@code 1 - distance / max(len)}.
 * Inputs are lower-cased and trimmed before comparison.
 */
public class LevenshteinSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        String a = s1.trim().toLowerCase(Locale.ROOT);
        String b = s2.trim().toLowerCase(Locale.ROOT);
        if (a.equals(b)) {
            return a.isEmpty() ? 0.0 : 1.0;
        }
        int maxLength = Math.max(a.length(), b.length());
        return 1.0 - ((double) distance(a, b) / maxLength);
    }

    @Override
    public String getName() {
        return "levenshtein";
    }

    /**
     * Edit distance using two rolling rows sized to the shorter string.
     */
    public static int distance(String s1, String s2) {
        String shorter = s1.length() <= s2.length() ? s1 : s2;
        String longer = shorter == s1 ? s2 : s1;

        int[] previous = new int[shorter.length() + 1];
        int[] current = new int[shorter.length() + 1];
        for (int i = 0; i < previous.length; i++) {
            previous[i] = i;
        }

        for (int j = 1; j <= longer.length(); j++) {
            current[0] = j;
            char c = longer.charAt(j - 1);
            for (int i = 1; i <= shorter.length(); i++) {
                int substitution = previous[i - 1] + (shorter.charAt(i - 1) == c ? 0 : 1);
                current[i] = Math.min(substitution, Math.min(current[i - 1], previous[i]) + 1);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[shorter.length()];
    }
}
