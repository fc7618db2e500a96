package com.entity.linkage.edge;

import java.util.List;

/**
 * Outcome of a batched edge write. A failed batch is counted and described
 * in {@link #errors()} while the remaining batches still run.
 */
public record EdgeWriteResult(int edgesCreated, int batchesProcessed, int failedBatches,
                              List<String> errors, long durationMillis) {

    public EdgeWriteResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public boolean isSuccess() {
        return failedBatches == 0;
    }

    public double avgBatchSize() {
        int succeeded = batchesProcessed - failedBatches;
        return succeeded > 0 ? (double) edgesCreated / succeeded : 0.0;
    }

    public double edgesPerSecond() {
        return durationMillis > 0 ? edgesCreated * 1000.0 / durationMillis : edgesCreated;
    }
}
