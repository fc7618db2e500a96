package com.entity.linkage.blocking;

import com.entity.linkage.core.model.RecordFilter;
import com.entity.linkage.metrics.MetricsService;
import com.entity.linkage.store.RecordStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Blocks records by the keys a {@link BlockingKeyStrategy} generates.
 * Only identifiers are kept per block while the store is paged through.
 */
public abstract class KeyBasedBlockingStrategy extends AbstractBlockingStrategy implements BlockingKeyStrategy {

    private final int minBlockSize;
    private final int maxBlockSize;

    protected KeyBasedBlockingStrategy(RecordStore store, List<RecordFilter> filters, int pageSize,
                                       int minBlockSize, int maxBlockSize, MetricsService metricsService) {
        super(store, filters, pageSize, metricsService);
        this.minBlockSize = minBlockSize;
        this.maxBlockSize = maxBlockSize;
    }

    @Override
    protected void collect(Run run) {
        Map<String, List<String>> blocks = new TreeMap<>();
        forEachFilteredRecord(run, record -> {
            for (String key : generateKeys(record)) {
                blocks.computeIfAbsent(key, k -> new ArrayList<>()).add(record.id());
            }
        });
        blocks.forEach((key, ids) -> emitBlock(run, key, ids, minBlockSize, maxBlockSize));
        run.detail("distinct_keys", blocks.size());
    }
}
