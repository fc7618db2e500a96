package com.entity.linkage.blocking;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome counters of one blocking run.
 *
 * @param strategyName           the strategy that ran
 * @param recordsScanned         records read from the store after filtering
 * @param blocksFormed           blocks (or windows) that emitted pairs
 * @param candidatePairs         distinct pairs returned
 * @param skippedOversizedBlocks blocks skipped for exceeding the maximum size
 * @param durationMillis         wall time of the run
 * @param timestamp              when the run finished
 * @param details                strategy-specific figures
 */
public record BlockingStatistics(String strategyName, int recordsScanned, int blocksFormed,
                                 int candidatePairs, int skippedOversizedBlocks, long durationMillis,
                                 Instant timestamp, Map<String, Object> details) {

    public BlockingStatistics {
        details = details != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(details))
                : Map.of();
    }

    public static BlockingStatistics notRun(String strategyName) {
        return new BlockingStatistics(strategyName, 0, 0, 0, 0, 0L, null, Map.of());
    }

    public double executionTimeSeconds() {
        return durationMillis / 1000.0;
    }
}
