package com.entity.linkage.similarity;

import com.entity.linkage.core.exception.ConfigurationException;
import com.entity.linkage.core.model.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Weighted average of per-field similarities, a simpler alternative to the
 * Fellegi-Sunter score for ranking candidates.
 * Formula: score = Σ w_f * sim_f / Σ w_f over the compared fields.
 */
public class WeightedFieldSimilarity {
    private static final Logger log = LoggerFactory.getLogger(WeightedFieldSimilarity.class);

    /**
     * What to do when a field is missing on either side.
     */
    public enum NullHandling {
        /** Leave the field out and renormalize the remaining weights. */
        SKIP,
        /** Count the field with similarity 0. */
        ZERO
    }

    /**
     * A field comparison with its weight.
     */
    public record FieldSpec(ComparisonMethod method, double weight) {
        public FieldSpec {
            if (method == null) {
                throw new IllegalArgumentException("method must not be null");
            }
            if (weight < 0) {
                throw new IllegalArgumentException("weight must be >= 0");
            }
        }
    }

    /**
     * Per-field similarities plus the weighted score.
     */
    public record Breakdown(double score, Map<String, Double> fieldScores, int fieldsCompared) {
        public Breakdown {
            fieldScores = Collections.unmodifiableMap(new LinkedHashMap<>(fieldScores));
        }
    }

    private final Map<String, FieldSpec> fields;
    private final NullHandling nullHandling;

    public WeightedFieldSimilarity(Map<String, FieldSpec> fields, NullHandling nullHandling) {
        if (fields == null || fields.isEmpty()) {
            throw new ConfigurationException("Weighted field similarity requires at least one field");
        }
        double total = fields.values().stream().mapToDouble(FieldSpec::weight).sum();
        if (total <= 0.0) {
            throw new ConfigurationException("All field weights are zero");
        }
        Map<String, FieldSpec> normalized = new LinkedHashMap<>();
        fields.forEach((name, spec) -> normalized.put(name, new FieldSpec(spec.method(), spec.weight() / total)));
        this.fields = Collections.unmodifiableMap(normalized);
        this.nullHandling = nullHandling != null ? nullHandling : NullHandling.SKIP;
    }

    /**
     * Computes the weighted similarity of two records.
     */
    public double compute(Record a, Record b) {
        return computeWithBreakdown(a, b).score();
    }

    public Breakdown computeWithBreakdown(Record a, Record b) {
        Map<String, Double> scores = new LinkedHashMap<>();
        double weighted = 0.0;
        double usedWeight = 0.0;

        for (Map.Entry<String, FieldSpec> entry : fields.entrySet()) {
            String field = entry.getKey();
            FieldSpec spec = entry.getValue();
            String left = normalize(a.getString(field));
            String right = normalize(b.getString(field));

            if (left == null || right == null) {
                if (nullHandling == NullHandling.ZERO) {
                    scores.put(field, 0.0);
                    usedWeight += spec.weight();
                }
                continue;
            }
            double sim = spec.method().algorithm().compute(left, right);
            scores.put(field, sim);
            weighted += spec.weight() * sim;
            usedWeight += spec.weight();
        }

        double score = usedWeight > 0.0 ? weighted / usedWeight : 0.0;
        log.debug("weighted.similarity left={} right={} score={} fields={}", a.id(), b.id(), score, scores.size());
        return new Breakdown(score, scores, scores.size());
    }

    /**
     * Normalized weights keyed by field name; they sum to 1.
     */
    public Map<String, FieldSpec> getFields() {
        return fields;
    }

    /**
     * Trims, upper-cases and collapses internal whitespace. Blank values become null.
     */
    static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String result = value.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
        return result.isEmpty() ? null : result;
    }
}
