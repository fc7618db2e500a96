package com.entity.linkage.blocking;

import com.entity.linkage.core.exception.ConfigurationException;
import com.entity.linkage.core.model.RecordFilter;

import java.util.List;

/**
 * Vector blocking through the ANN adapter.
 *
 * @param threshold      minimum cosine similarity in [0, 1]
 * @param limitPerEntity maximum neighbours kept per record
 * @param blockingField  optional field that must be equal on both records
 * @param filters        scalar pre-filters
 */
public record VectorBlockingParams(double threshold, int limitPerEntity, String blockingField,
                                   List<RecordFilter> filters) implements BlockingParams {

    public static final double DEFAULT_THRESHOLD = 0.7;
    public static final int DEFAULT_LIMIT_PER_ENTITY = 20;

    public VectorBlockingParams {
        if (threshold < 0.0 || threshold > 1.0 || Double.isNaN(threshold)) {
            throw new ConfigurationException("threshold must be in [0, 1], got " + threshold);
        }
        if (limitPerEntity < 1) {
            throw new ConfigurationException("limitPerEntity must be >= 1, got " + limitPerEntity);
        }
        if (blockingField != null) {
            ExactBlockingParams.validateFields(List.of(blockingField));
        }
        filters = filters != null ? List.copyOf(filters) : List.of();
    }

    public static VectorBlockingParams defaults() {
        return new VectorBlockingParams(DEFAULT_THRESHOLD, DEFAULT_LIMIT_PER_ENTITY, null, List.of());
    }

    @Override
    public BlockingStrategyType type() {
        return BlockingStrategyType.VECTOR;
    }
}
