package com.entity.linkage.blocking;

import com.entity.linkage.ann.AnnAdapter;
import com.entity.linkage.ann.SearchMethod;
import com.entity.linkage.ann.VectorPair;
import com.entity.linkage.core.exception.ConfigurationException;
import com.entity.linkage.core.exception.StorageException;
import com.entity.linkage.metrics.MetricsService;
import com.entity.linkage.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Candidate pairs from approximate nearest-neighbour search over record vectors.
 * A failed search is retried once by brute force before the error surfaces.
 */
public class VectorBlockingStrategy extends AbstractBlockingStrategy {
    private static final Logger log = LoggerFactory.getLogger(VectorBlockingStrategy.class);

    private final VectorBlockingParams params;
    private final AnnAdapter annAdapter;

    public VectorBlockingStrategy(RecordStore store, AnnAdapter annAdapter, VectorBlockingParams params,
                                  int pageSize, MetricsService metricsService) {
        super(store, List.of(), pageSize, metricsService);
        if (annAdapter == null) {
            throw new ConfigurationException("Vector blocking requires an ANN adapter");
        }
        this.annAdapter = annAdapter;
        this.params = params;
    }

    @Override
    public BlockingStrategyType getType() {
        return BlockingStrategyType.VECTOR;
    }

    @Override
    protected void collect(Run run) {
        List<VectorPair> pairs;
        String method;
        try {
            pairs = annAdapter.findAllPairs(params.threshold(), params.limitPerEntity(),
                    params.blockingField(), params.filters());
            method = pairs.isEmpty() ? annAdapter.getMethod().tag() : pairs.get(0).method();
        } catch (RuntimeException e) {
            log.warn("blocking.vector.failed error={}; retrying with brute force", e.getMessage());
            try {
                pairs = annAdapter.findAllPairsBruteForce(params.threshold(), params.limitPerEntity(),
                        params.blockingField(), params.filters());
                method = SearchMethod.BRUTE_FORCE.tag();
            } catch (RuntimeException retryFailure) {
                retryFailure.addSuppressed(e);
                throw new StorageException("Vector blocking failed after brute-force retry", retryFailure);
            }
        }

        for (VectorPair pair : pairs) {
            run.emit(pair.doc1Key(), pair.doc2Key(), "ann",
                    Map.of("similarity", pair.similarity(), "ann_method", pair.method()));
        }
        run.addBlocks(pairs.isEmpty() ? 0 : 1);
        run.detail("ann_method", method);
        run.detail("threshold", params.threshold());
        run.detail("limit_per_entity", params.limitPerEntity());
    }
}
