package com.entity.linkage.blocking;

import com.entity.linkage.ann.VectorMath;
import com.entity.linkage.core.exception.ConfigurationException;
import com.entity.linkage.core.model.Record;
import com.entity.linkage.metrics.MetricsService;
import com.entity.linkage.store.CursorPage;
import com.entity.linkage.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

/**
 * Random-hyperplane locality-sensitive hashing over record embeddings.
 *
 * <p>Each of the {@code L} tables owns {@code k} hyperplanes drawn from a
 * seeded Gaussian; a vector's signature in a table is the sign pattern of its
 * dot products with those hyperplanes. Records sharing a signature in any
 * table become candidates. Hyperplanes depend only on the seed, the table
 * layout and the embedding dimension, so the candidate set is reproducible.</p>
 *
 * <p>A collection with no embeddings at all is a configuration error; when
 * only the filters leave no embedded record, the strategy yields no pairs.</p>
 */
public class LshBlockingStrategy extends AbstractBlockingStrategy {
    private static final Logger log = LoggerFactory.getLogger(LshBlockingStrategy.class);

    private final LshBlockingParams params;

    public LshBlockingStrategy(RecordStore store, LshBlockingParams params,
                               int pageSize, MetricsService metricsService) {
        super(store, params.filters(), pageSize, metricsService);
        this.params = params;
    }

    @Override
    public BlockingStrategyType getType() {
        return BlockingStrategyType.LSH;
    }

    @Override
    protected void collect(Run run) {
        HashingState state = new HashingState(params.numHashTables());
        forEachFilteredRecord(run, record -> hash(record, state));

        run.detail("num_hash_tables", params.numHashTables());
        run.detail("num_hyperplanes", params.numHyperplanes());
        run.detail("seed", params.seed());
        if (state.hyperplanes == null) {
            if (!collectionHasEmbeddings()) {
                throw new ConfigurationException("No embeddings found in collection '" + store.getCollectionName()
                        + "' for field '" + params.embeddingField() + "'; generate embeddings before LSH blocking");
            }
            log.warn("lsh.noEmbeddings.afterFiltering collection={} field={}",
                    store.getCollectionName(), params.embeddingField());
            run.detail("records_with_embeddings", 0);
            run.detail("coverage", 0.0);
            return;
        }
        if (state.dimensionMismatches > 0) {
            log.warn("lsh.dimensionMismatch expected={} skipped={}", state.dimension, state.dimensionMismatches);
        }

        int nonEmpty = 0;
        for (int t = 0; t < state.tables.size(); t++) {
            Map<String, List<String>> table = state.tables.get(t);
            nonEmpty += table.size();
            for (Map.Entry<String, List<String>> bucket : table.entrySet()) {
                List<String> ids = bucket.getValue();
                if (ids.size() < 2) {
                    continue;
                }
                if (ids.size() > params.maxBucketSize()) {
                    run.addSkippedBlocks(1);
                    continue;
                }
                run.addBlocks(1);
                Map<String, Object> metadata = Map.of("hash_table", t, "lsh_hash", bucket.getKey());
                for (int i = 0; i < ids.size(); i++) {
                    for (int j = i + 1; j < ids.size(); j++) {
                        run.emit(ids.get(i), ids.get(j), "t" + t + ":" + bucket.getKey(), metadata);
                    }
                }
            }
        }

        run.detail("embedding_dimension", state.dimension);
        run.detail("total_buckets", totalBuckets(params.numHashTables(), params.numHyperplanes()));
        run.detail("non_empty_buckets", nonEmpty);
        run.detail("records_with_embeddings", state.hashed);
        run.detail("coverage", run.recordsScanned() == 0 ? 0.0 : (double) state.hashed / run.recordsScanned());
    }

    private boolean collectionHasEmbeddings() {
        String cursor = null;
        CursorPage<Record> page;
        do {
            page = store.fetchPage(cursor, pageSize);
            for (Record record : page.content()) {
                double[] vector = record.getVector(params.embeddingField());
                if (vector != null && vector.length > 0) {
                    return true;
                }
            }
            cursor = page.nextCursor();
        } while (page.hasMore());
        return false;
    }

    private void hash(Record record, HashingState state) {
        double[] vector = record.getVector(params.embeddingField());
        if (vector == null || vector.length == 0) {
            return;
        }
        if (state.hyperplanes == null) {
            state.dimension = vector.length;
            state.hyperplanes = generateHyperplanes(
                    params.numHashTables() * params.numHyperplanes(), vector.length, params.seed());
        }
        if (vector.length != state.dimension) {
            state.dimensionMismatches++;
            return;
        }
        String prefix = "";
        if (params.blockingField() != null) {
            String blockValue = record.getString(params.blockingField());
            if (blockValue == null) {
                return;
            }
            prefix = keyPart(blockValue) + "|";
        }

        double[] unit = VectorMath.normalize(vector);
        for (int t = 0; t < params.numHashTables(); t++) {
            String key = prefix + signature(unit, state.hyperplanes, t * params.numHyperplanes(),
                    params.numHyperplanes());
            state.tables.get(t).computeIfAbsent(key, k -> new ArrayList<>()).add(record.id());
        }
        state.hashed++;
    }

    /**
     * Number of possible signatures over all tables, saturating at {@link Long#MAX_VALUE}.
     */
    static long totalBuckets(int tables, int hyperplanes) {
        if (hyperplanes >= Long.SIZE - 1) {
            return Long.MAX_VALUE;
        }
        long perTable = 1L << hyperplanes;
        return perTable > Long.MAX_VALUE / tables ? Long.MAX_VALUE : tables * perTable;
    }

    /**
     * Draws {@code count} unit-length Gaussian hyperplanes of the given dimension.
     */
    static double[][] generateHyperplanes(int count, int dimension, long seed) {
        Random random = new Random(seed);
        double[][] planes = new double[count][dimension];
        for (int p = 0; p < count; p++) {
            for (int d = 0; d < dimension; d++) {
                planes[p][d] = random.nextGaussian();
            }
            planes[p] = VectorMath.normalize(planes[p]);
        }
        return planes;
    }

    /**
     * Sign pattern of the vector against {@code k} consecutive hyperplanes.
     */
    static String signature(double[] vector, double[][] planes, int offset, int k) {
        char[] bits = new char[k];
        for (int i = 0; i < k; i++) {
            bits[i] = VectorMath.dot(vector, planes[offset + i]) >= 0 ? '1' : '0';
        }
        return new String(bits);
    }

    private static final class HashingState {
        private final List<Map<String, List<String>>> tables = new ArrayList<>();
        private double[][] hyperplanes;
        private int dimension;
        private int dimensionMismatches;
        private int hashed;

        private HashingState(int tableCount) {
            for (int i = 0; i < tableCount; i++) {
                tables.add(new TreeMap<>());
            }
        }
    }
}
