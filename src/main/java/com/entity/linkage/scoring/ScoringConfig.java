package com.entity.linkage.scoring;

import com.entity.linkage.core.exception.ConfigurationException;
import com.entity.linkage.similarity.ComparisonMethod;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Field weights and decision thresholds for the Fellegi-Sunter scorer.
 * m/u probabilities are externally calibrated inputs.
 */
public final class ScoringConfig {

    public static final double DEFAULT_UPPER_THRESHOLD = 2.0;
    public static final double DEFAULT_LOWER_THRESHOLD = -1.0;

    private final List<FieldWeight> fieldWeights;
    private final double upperThreshold;
    private final double lowerThreshold;

    private ScoringConfig(Builder builder) {
        this.fieldWeights = List.copyOf(builder.fieldWeights.values());
        this.upperThreshold = builder.upperThreshold;
        this.lowerThreshold = builder.lowerThreshold;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Person/company field weights used when no calibration is supplied.
     */
    public static ScoringConfig defaults() {
        return builder()
                .field(FieldWeight.fromKey("name_ngram", 0.9, 0.01, 0.7, 1.0))
                .field(FieldWeight.fromKey("first_name_ngram", 0.85, 0.02, 0.7, 0.8))
                .field(FieldWeight.fromKey("last_name_ngram", 0.9, 0.015, 0.7, 1.0))
                .field(FieldWeight.fromKey("first_name_levenshtein", 0.8, 0.05, 0.6, 0.7))
                .field(FieldWeight.fromKey("last_name_levenshtein", 0.85, 0.03, 0.6, 0.9))
                .field(FieldWeight.fromKey("address_ngram", 0.8, 0.03, 0.6, 0.8))
                .field(FieldWeight.fromKey("city_ngram", 0.9, 0.05, 0.8, 0.6))
                .field(FieldWeight.fromKey("email_exact", 0.95, 0.001, 1.0, 1.2))
                .field(FieldWeight.fromKey("phone_exact", 0.9, 0.005, 1.0, 1.1))
                .field(FieldWeight.fromKey("company_ngram", 0.8, 0.02, 0.7, 0.7))
                .build();
    }

    public List<FieldWeight> getFieldWeights() {
        return fieldWeights;
    }

    public double getUpperThreshold() {
        return upperThreshold;
    }

    public double getLowerThreshold() {
        return lowerThreshold;
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .upperThreshold(upperThreshold)
                .lowerThreshold(lowerThreshold);
        fieldWeights.forEach(builder::field);
        return builder;
    }

    @Override
    public String toString() {
        return "ScoringConfig{" +
                "fields=" + fieldWeights.size() +
                ", upperThreshold=" + upperThreshold +
                ", lowerThreshold=" + lowerThreshold +
                '}';
    }

    public static class Builder {
        private final Map<String, FieldWeight> fieldWeights = new LinkedHashMap<>();
        private double upperThreshold = DEFAULT_UPPER_THRESHOLD;
        private double lowerThreshold = DEFAULT_LOWER_THRESHOLD;

        /**
         * Adds or replaces the weight for a field/method combination.
         */
        public Builder field(FieldWeight weight) {
            fieldWeights.put(weight.key(), weight);
            return this;
        }

        public Builder field(String field, ComparisonMethod method, double m, double u,
                             double threshold, double importance) {
            return field(new FieldWeight(field, method, m, u, threshold, importance));
        }

        public Builder clearFields() {
            fieldWeights.clear();
            return this;
        }

        public Builder upperThreshold(double upperThreshold) {
            this.upperThreshold = upperThreshold;
            return this;
        }

        public Builder lowerThreshold(double lowerThreshold) {
            this.lowerThreshold = lowerThreshold;
            return this;
        }

        public ScoringConfig build() {
            if (fieldWeights.isEmpty()) {
                throw new ConfigurationException("Scoring requires at least one field weight");
            }
            List<FieldWeight> weights = new ArrayList<>(fieldWeights.values());
            if (weights.stream().allMatch(w -> w.importance() == 0.0)) {
                throw new ConfigurationException("All field weights have zero importance");
            }
            if (Double.isNaN(upperThreshold) || Double.isNaN(lowerThreshold)
                    || upperThreshold <= lowerThreshold) {
                throw new ConfigurationException(
                        "upperThreshold (" + upperThreshold + ") must be greater than lowerThreshold ("
                                + lowerThreshold + ")");
            }
            return new ScoringConfig(this);
        }
    }
}
