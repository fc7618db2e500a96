package com.entity.linkage.ann;

import com.entity.linkage.core.InputSanitizer;
import com.entity.linkage.core.model.RecordFilter;
import com.entity.linkage.metrics.MetricsService;
import com.entity.linkage.metrics.NoOpMetricsService;
import com.entity.linkage.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Vector similarity search that hides whether the store can search vectors natively.
 *
 * <p>The executor is chosen once, at construction: the native executor is
 * probed unless brute force is forced, and a failed or negative probe selects
 * the in-process brute-force scan. If the native executor fails mid-query,
 * the query is retried once by brute force and the results carry the
 * {@code brute_force} method tag.</p>
 */
public class AnnAdapter {
    private static final Logger log = LoggerFactory.getLogger(AnnAdapter.class);

    private final RecordStore store;
    private final String embeddingField;
    private final VectorQueryExecutor executor;
    private final VectorQueryExecutor fallback;
    private final MetricsService metricsService;

    public AnnAdapter(RecordStore store, String embeddingField) {
        this(store, embeddingField, null, true, NoOpMetricsService.INSTANCE);
    }

    /**
     * @param store            the record store holding the vectors
     * @param embeddingField   field that stores each record's vector
     * @param nativeExecutor   native search executor, or null if the store has none
     * @param forceBruteForce  skip the probe and always scan in process
     * @param metricsService   metrics sink
     */
    public AnnAdapter(RecordStore store, String embeddingField, VectorQueryExecutor nativeExecutor,
                      boolean forceBruteForce, MetricsService metricsService) {
        if (store == null) {
            throw new IllegalArgumentException("store must not be null");
        }
        InputSanitizer.validateFieldName(embeddingField);
        this.store = store;
        this.embeddingField = embeddingField;
        this.metricsService = metricsService != null ? metricsService : NoOpMetricsService.INSTANCE;
        this.fallback = new BruteForceVectorQueryExecutor(store, embeddingField);
        this.executor = selectExecutor(nativeExecutor, forceBruteForce);
        log.info("ann.initialized collection={} field={} method={}",
                store.getCollectionName(), embeddingField, executor.method().tag());
    }

    /**
     * The search method fixed for this adapter's lifetime.
     */
    public SearchMethod getMethod() {
        return executor.method();
    }

    public String getEmbeddingField() {
        return embeddingField;
    }

    /**
     * Finds records similar to a vector or to a stored record, most similar first.
     * A query key whose record or vector is missing yields an empty list.
     */
    public List<VectorMatch> findSimilarVectors(VectorQuery query) {
        double[] vector = query.getQueryVector();
        String excludeKey = null;
        if (vector == null) {
            Optional<double[]> stored = store.fetchVector(query.getQueryDocKey(), embeddingField);
            if (stored.isEmpty() || stored.get() == null) {
                log.debug("ann.query.noVector key={}", query.getQueryDocKey());
                return List.of();
            }
            vector = stored.get();
            excludeKey = query.isExcludeSelf() ? query.getQueryDocKey() : null;
        }

        SearchRequest request = new SearchRequest(query.getThreshold(), query.getLimit(), excludeKey,
                query.getBlockingField(), query.getBlockingValue(), query.getFilters());
        double[] queryVector = vector;
        List<VectorMatch> matches = runWithFallback(
                () -> executor.search(queryVector, request),
                () -> fallback.search(queryVector, request));

        List<VectorMatch> sorted = new ArrayList<>(matches);
        sorted.sort(VectorMatch.BY_SIMILARITY);
        return sorted;
    }

    /**
     * Finds every pair of records whose vectors reach the threshold, each record
     * capped at {@code limitPerEntity} neighbours.
     */
    public List<VectorPair> findAllPairs(double threshold, int limitPerEntity, String blockingField,
                                         List<RecordFilter> filters) {
        if (blockingField != null) {
            InputSanitizer.validateFieldName(blockingField);
        }
        SearchRequest request = new SearchRequest(threshold, limitPerEntity, null, blockingField, null, filters);
        return runWithFallback(() -> executor.findAllPairs(request), () -> fallback.findAllPairs(request));
    }

    /**
     * Brute-force search regardless of the selected method. Used by callers
     * that already saw a failure from this adapter.
     */
    public List<VectorPair> findAllPairsBruteForce(double threshold, int limitPerEntity, String blockingField,
                                                   List<RecordFilter> filters) {
        SearchRequest request = new SearchRequest(threshold, limitPerEntity, null, blockingField, null, filters);
        metricsService.recordAnnQuery(fallback.method().tag());
        return fallback.findAllPairs(request);
    }

    private <T> List<T> runWithFallback(QuerySupplier<T> primary, QuerySupplier<T> bruteForce) {
        if (executor == fallback) {
            metricsService.recordAnnQuery(fallback.method().tag());
            return primary.get();
        }
        try {
            List<T> results = primary.get();
            metricsService.recordAnnQuery(executor.method().tag());
            return results;
        } catch (RuntimeException e) {
            log.warn("ann.native.failed collection={} error={}; retrying with brute force",
                    store.getCollectionName(), e.getMessage());
            metricsService.incrementAnnFallback();
            metricsService.recordAnnQuery(fallback.method().tag());
            return bruteForce.get();
        }
    }

    private VectorQueryExecutor selectExecutor(VectorQueryExecutor nativeExecutor, boolean forceBruteForce) {
        if (forceBruteForce || nativeExecutor == null) {
            return fallback;
        }
        try {
            if (nativeExecutor.probe()) {
                return nativeExecutor;
            }
            log.info("ann.probe.unsupported collection={}", store.getCollectionName());
        } catch (RuntimeException e) {
            log.warn("ann.probe.failed collection={} error={}", store.getCollectionName(), e.getMessage());
        }
        return fallback;
    }

    @FunctionalInterface
    private interface QuerySupplier<T> {
        List<T> get();
    }
}
