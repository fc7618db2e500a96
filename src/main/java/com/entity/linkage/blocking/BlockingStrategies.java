package com.entity.linkage.blocking;

import com.entity.linkage.ann.AnnAdapter;
import com.entity.linkage.core.exception.ConfigurationException;
import com.entity.linkage.metrics.MetricsService;
import com.entity.linkage.metrics.NoOpMetricsService;
import com.entity.linkage.store.RecordStore;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a {@link BlockingStrategy} from its typed parameters.
 */
public final class BlockingStrategies {

    private final RecordStore store;
    private final AnnAdapter annAdapter;
    private final SharedNeighbourSource neighbours;
    private final int pageSize;
    private final MetricsService metricsService;

    public BlockingStrategies(RecordStore store) {
        this(store, null, RecordStore.DEFAULT_PAGE_SIZE, NoOpMetricsService.INSTANCE);
    }

    /**
     * @param store          the record store to block
     * @param annAdapter     adapter for vector blocking, or null when vector blocking is unused
     * @param pageSize       records fetched per page
     * @param metricsService metrics sink
     */
    public BlockingStrategies(RecordStore store, AnnAdapter annAdapter, int pageSize,
                              MetricsService metricsService) {
        this(store, annAdapter, null, pageSize, metricsService);
    }

    /**
     * @param neighbours shared neighbour source for graph traversal blocking, or null when unused
     */
    public BlockingStrategies(RecordStore store, AnnAdapter annAdapter, SharedNeighbourSource neighbours,
                              int pageSize, MetricsService metricsService) {
        if (store == null) {
            throw new ConfigurationException("Blocking requires a record store");
        }
        this.store = store;
        this.annAdapter = annAdapter;
        this.neighbours = neighbours;
        this.pageSize = pageSize;
        this.metricsService = metricsService != null ? metricsService : NoOpMetricsService.INSTANCE;
    }

    public BlockingStrategy create(BlockingParams params) {
        if (params == null) {
            throw new ConfigurationException("Blocking parameters must not be null");
        }
        return switch (params.type()) {
            case EXACT -> new ExactBlockingStrategy(store, (ExactBlockingParams) params, pageSize, metricsService);
            case NGRAM -> new NGramBlockingStrategy(store, (NGramBlockingParams) params, pageSize, metricsService);
            case PHONETIC ->
                    new PhoneticBlockingStrategy(store, (PhoneticBlockingParams) params, pageSize, metricsService);
            case SORTED_NEIGHBORHOOD ->
                    new SortedNeighborhoodStrategy(store, (SortedNeighborhoodParams) params, pageSize, metricsService);
            case LSH -> new LshBlockingStrategy(store, (LshBlockingParams) params, pageSize, metricsService);
            case VECTOR -> new VectorBlockingStrategy(store, annAdapter, (VectorBlockingParams) params,
                    pageSize, metricsService);
            case GEOGRAPHIC ->
                    new GeographicBlockingStrategy(store, (GeographicBlockingParams) params, pageSize, metricsService);
            case GRAPH_TRAVERSAL -> new GraphTraversalBlockingStrategy(store, neighbours,
                    (GraphTraversalBlockingParams) params, pageSize, metricsService);
            case COMPOSITE -> {
                List<BlockingStrategy> children = new ArrayList<>();
                for (BlockingParams child : ((CompositeBlockingParams) params).strategies()) {
                    children.add(create(child));
                }
                yield new CompositeBlockingStrategy(store, children, pageSize, metricsService);
            }
        };
    }
}
