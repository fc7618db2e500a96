package com.entity.linkage.blocking;

import com.entity.linkage.core.exception.ConfigurationException;
import com.entity.linkage.core.model.RecordFilter;

import java.util.List;

/**
 * Random-hyperplane LSH blocking.
 *
 * @param embeddingField field holding each record's vector
 * @param numHashTables  independent tables (L); more tables raise recall
 * @param numHyperplanes hyperplanes per table (k); more hyperplanes raise precision
 * @param seed           seed for the hyperplanes
 * @param blockingField  optional field that must also be equal, or null
 * @param maxBucketSize  buckets larger than this are skipped
 * @param filters        record pre-filters
 */
public record LshBlockingParams(String embeddingField, int numHashTables, int numHyperplanes, long seed,
                                String blockingField, int maxBucketSize,
                                List<RecordFilter> filters) implements BlockingParams {

    public static final int DEFAULT_NUM_HASH_TABLES = 10;
    public static final int DEFAULT_NUM_HYPERPLANES = 8;
    public static final long DEFAULT_SEED = 42L;
    public static final int DEFAULT_MAX_BUCKET_SIZE = 1000;

    public LshBlockingParams {
        if (embeddingField == null) {
            throw new ConfigurationException("LSH blocking requires an embedding field");
        }
        ExactBlockingParams.validateFields(List.of(embeddingField));
        if (blockingField != null) {
            ExactBlockingParams.validateFields(List.of(blockingField));
        }
        if (numHashTables < 1) {
            throw new ConfigurationException("numHashTables must be >= 1, got " + numHashTables);
        }
        if (numHyperplanes < 1 || numHyperplanes > 64) {
            throw new ConfigurationException("numHyperplanes must be in [1, 64], got " + numHyperplanes);
        }
        if (maxBucketSize < 2) {
            throw new ConfigurationException("maxBucketSize must be >= 2, got " + maxBucketSize);
        }
        filters = filters != null ? List.copyOf(filters) : List.of();
    }

    public static LshBlockingParams of(String embeddingField) {
        return new LshBlockingParams(embeddingField, DEFAULT_NUM_HASH_TABLES, DEFAULT_NUM_HYPERPLANES,
                DEFAULT_SEED, null, DEFAULT_MAX_BUCKET_SIZE, List.of());
    }

    public LshBlockingParams withTables(int tables, int hyperplanes, long newSeed) {
        return new LshBlockingParams(embeddingField, tables, hyperplanes, newSeed, blockingField,
                maxBucketSize, filters);
    }

    @Override
    public BlockingStrategyType type() {
        return BlockingStrategyType.LSH;
    }
}
