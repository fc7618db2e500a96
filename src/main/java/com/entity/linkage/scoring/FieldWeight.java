package com.entity.linkage.scoring;

import com.entity.linkage.similarity.ComparisonMethod;

import java.util.Locale;

/**
 * Fellegi-Sunter parameters for one compared field.
 *
 * @param field        the record field to compare
 * @param method       the similarity primitive used on the field
 * @param mProbability P(agreement | true match)
 * @param uProbability P(agreement | non-match)
 * @param threshold    raw similarity at or above which the field agrees
 * @param importance   multiplier applied to the field's log-likelihood ratio
 */
public record FieldWeight(String field, ComparisonMethod method, double mProbability,
                          double uProbability, double threshold, double importance) {

    public FieldWeight {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("field must not be null or blank");
        }
        if (method == null) {
            throw new IllegalArgumentException("method must not be null");
        }
        if (mProbability <= 0.0 || mProbability >= 1.0) {
            throw new IllegalArgumentException("m probability must be in (0, 1), got " + mProbability);
        }
        if (uProbability <= 0.0 || uProbability >= 1.0) {
            throw new IllegalArgumentException("u probability must be in (0, 1), got " + uProbability);
        }
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be in [0, 1], got " + threshold);
        }
        if (importance < 0.0) {
            throw new IllegalArgumentException("importance must be >= 0, got " + importance);
        }
    }

    /**
     * Builds a weight from a config key of the form {@code <field>_<method>},
     * e.g. {@code first_name_ngram} or {@code email_exact}.
     */
    public static FieldWeight fromKey(String key, double m, double u, double threshold, double importance) {
        for (ComparisonMethod method : ComparisonMethod.values()) {
            String suffix = "_" + method.name().toLowerCase(Locale.ROOT);
            if (key.endsWith(suffix) && key.length() > suffix.length()) {
                String field = key.substring(0, key.length() - suffix.length());
                return new FieldWeight(field, method, m, u, threshold, importance);
            }
        }
        throw new IllegalArgumentException("Cannot derive field and method from weight key '" + key + "'");
    }

    /**
     * Config key of this weight, the inverse of {@link #fromKey}.
     */
    public String key() {
        return field + "_" + method.name().toLowerCase(Locale.ROOT);
    }

    public double agreementWeight() {
        return importance * log2(mProbability / uProbability);
    }

    public double disagreementWeight() {
        return importance * log2((1.0 - mProbability) / (1.0 - uProbability));
    }

    private static double log2(double x) {
        return Math.log(x) / Math.log(2.0);
    }
}
