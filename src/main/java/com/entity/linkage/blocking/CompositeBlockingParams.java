package com.entity.linkage.blocking;

import com.entity.linkage.core.exception.ConfigurationException;
import com.entity.linkage.core.model.RecordFilter;

import java.util.List;

/**
 * Union of several strategies, deduplicated across strategies.
 * The first strategy that emits a pair is credited with it.
 */
public record CompositeBlockingParams(List<BlockingParams> strategies) implements BlockingParams {

    public CompositeBlockingParams {
        strategies = strategies != null ? List.copyOf(strategies) : List.of();
        if (strategies.isEmpty()) {
            throw new ConfigurationException("Composite blocking requires at least one strategy");
        }
    }

    public static CompositeBlockingParams of(BlockingParams... strategies) {
        return new CompositeBlockingParams(List.of(strategies));
    }

    @Override
    public BlockingStrategyType type() {
        return BlockingStrategyType.COMPOSITE;
    }

    @Override
    public List<RecordFilter> filters() {
        return List.of();
    }
}
