package com.entity.linkage.blocking;

import com.entity.linkage.core.exception.ConfigurationException;
import com.entity.linkage.core.model.CandidatePair;
import com.entity.linkage.metrics.MetricsService;
import com.entity.linkage.store.RecordStore;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs several strategies and unions their pairs.
 * A pair keeps the strategy name and key of the first strategy that emitted it.
 */
public class CompositeBlockingStrategy extends AbstractBlockingStrategy {

    private final List<BlockingStrategy> strategies;

    public CompositeBlockingStrategy(RecordStore store, List<BlockingStrategy> strategies,
                                     int pageSize, MetricsService metricsService) {
        super(store, List.of(), pageSize, metricsService);
        if (strategies == null || strategies.isEmpty()) {
            throw new ConfigurationException("Composite blocking requires at least one strategy");
        }
        this.strategies = List.copyOf(strategies);
    }

    @Override
    public BlockingStrategyType getType() {
        return BlockingStrategyType.COMPOSITE;
    }

    public List<BlockingStrategy> getStrategies() {
        return strategies;
    }

    @Override
    protected void collect(Run run) {
        Map<String, Integer> perStrategy = new LinkedHashMap<>();
        for (BlockingStrategy strategy : strategies) {
            List<CandidatePair> pairs = strategy.generateCandidates();
            BlockingStatistics stats = strategy.getStatistics();
            run.addBlocks(stats.blocksFormed());
            run.addSkippedBlocks(stats.skippedOversizedBlocks());
            run.addRecordsScanned(Math.max(0, stats.recordsScanned() - run.recordsScanned()));
            pairs.forEach(run::emit);
            perStrategy.merge(strategy.getName(), pairs.size(), Integer::sum);
        }
        run.detail("pairs_per_strategy", perStrategy);
    }
}
