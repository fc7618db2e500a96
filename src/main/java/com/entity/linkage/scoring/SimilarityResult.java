package com.entity.linkage.scoring;

import com.entity.linkage.core.model.MatchDecision;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Aggregate Fellegi-Sunter outcome for one record pair.
 *
 * @param score          sum of field log-likelihood contributions
 * @param decision       classification against the global thresholds
 * @param confidence     score normalized between the thresholds, clamped to [0, 1]
 * @param fieldsCompared number of fields present on both sides
 * @param fields         per-field detail (empty when details were not requested)
 */
public record SimilarityResult(double score, MatchDecision decision, double confidence,
                               int fieldsCompared, List<FieldSimilarity> fields) {

    private static final int SCORE_SCALE = 4;

    public SimilarityResult {
        fields = fields != null ? List.copyOf(fields) : List.of();
    }

    public boolean isMatch() {
        return decision == MatchDecision.MATCH;
    }

    /**
     * The score rounded to four decimal places, as stored downstream.
     */
    public double roundedScore() {
        return round(score);
    }

    /**
     * Rounds half-up to four decimal places.
     */
    public static double round(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(SCORE_SCALE, RoundingMode.HALF_UP).doubleValue();
    }
}
