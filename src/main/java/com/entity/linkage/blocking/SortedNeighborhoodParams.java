package com.entity.linkage.blocking;

import com.entity.linkage.core.exception.ConfigurationException;
import com.entity.linkage.core.model.RecordFilter;

import java.util.List;

/**
 * Sorted-neighborhood blocking: records are sorted by a composite key and
 * every pair within a sliding window of {@code windowSize} records is a candidate.
 */
public record SortedNeighborhoodParams(List<String> sortFields, int windowSize,
                                       List<RecordFilter> filters) implements BlockingParams {

    public static final int DEFAULT_WINDOW_SIZE = 5;

    public SortedNeighborhoodParams {
        sortFields = sortFields != null ? List.copyOf(sortFields) : List.of();
        if (sortFields.isEmpty()) {
            throw new ConfigurationException("Sorted-neighborhood blocking requires at least one sort field");
        }
        ExactBlockingParams.validateFields(sortFields);
        if (windowSize < 2) {
            throw new ConfigurationException("windowSize must be >= 2, got " + windowSize);
        }
        filters = filters != null ? List.copyOf(filters) : List.of();
    }

    public static SortedNeighborhoodParams of(int windowSize, String... sortFields) {
        return new SortedNeighborhoodParams(List.of(sortFields), windowSize, List.of());
    }

    @Override
    public BlockingStrategyType type() {
        return BlockingStrategyType.SORTED_NEIGHBORHOOD;
    }
}
