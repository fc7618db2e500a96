package com.entity.linkage.ann;

import com.entity.linkage.core.model.Record;
import com.entity.linkage.core.model.RecordFilter;

import java.util.List;
import java.util.Objects;

/**
 * Constraints shared by single-vector searches and all-pairs searches.
 *
 * @param threshold     minimum cosine similarity, inclusive
 * @param limit         maximum results per query vector
 * @param excludeKey    record to leave out of the results, or null
 * @param blockingField field that must be equal on both sides, or null
 * @param blockingValue value the blocking field must have for single searches, or null
 * @param filters       scalar pre-filters candidates must pass
 */
public record SearchRequest(double threshold, int limit, String excludeKey,
                            String blockingField, Object blockingValue, List<RecordFilter> filters) {

    public SearchRequest {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be in [0, 1], got " + threshold);
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got " + limit);
        }
        filters = filters != null ? List.copyOf(filters) : List.of();
    }

    /**
     * Whether a candidate record passes the blocking value and filters.
     */
    public boolean accepts(Record candidate) {
        if (excludeKey != null && excludeKey.equals(candidate.id())) {
            return false;
        }
        if (blockingField != null && blockingValue != null
                && !Objects.equals(String.valueOf(blockingValue), candidate.getString(blockingField))) {
            return false;
        }
        return RecordFilter.all(filters, candidate);
    }
}
