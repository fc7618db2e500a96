package com.entity.linkage.blocking;

import com.entity.linkage.core.exception.ConfigurationException;
import com.entity.linkage.core.model.RecordFilter;
import com.entity.linkage.metrics.MetricsService;
import com.entity.linkage.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Emits every pair of records that share an intermediate node over existing
 * graph relationships. Nodes failing the filters, or shared by too few or too
 * many records, are ignored.
 */
public class GraphTraversalBlockingStrategy extends AbstractBlockingStrategy {
    private static final Logger log = LoggerFactory.getLogger(GraphTraversalBlockingStrategy.class);

    private final GraphTraversalBlockingParams params;
    private final SharedNeighbourSource neighbours;

    public GraphTraversalBlockingStrategy(RecordStore store, SharedNeighbourSource neighbours,
                                          GraphTraversalBlockingParams params, int pageSize,
                                          MetricsService metricsService) {
        super(store, List.of(), pageSize, metricsService);
        if (neighbours == null) {
            throw new ConfigurationException("Graph traversal blocking requires a shared neighbour source");
        }
        this.params = params;
        this.neighbours = neighbours;
    }

    @Override
    public BlockingStrategyType getType() {
        return BlockingStrategyType.GRAPH_TRAVERSAL;
    }

    @Override
    protected void collect(Run run) {
        Set<String> linkedRecords = new HashSet<>();
        int sharedNodes = 0;
        long degreeSum = 0;
        int filteredOut = 0;
        for (SharedNeighbourSource.SharedNode node : neighbours.sharedNodes(params)) {
            if (!RecordFilter.all(params.filters(), node.asRecord())) {
                filteredOut++;
                continue;
            }
            List<String> ids = new ArrayList<>(new TreeSet<>(node.recordIds()));
            linkedRecords.addAll(ids);
            if (ids.size() < params.minEntitiesPerNode()) {
                continue;
            }
            if (ids.size() > params.maxEntitiesPerNode()) {
                run.addSkippedBlocks(1);
                log.debug("blocking.node.skipped node={} degree={} maxEntitiesPerNode={}",
                        node.nodeId(), ids.size(), params.maxEntitiesPerNode());
                continue;
            }
            run.addBlocks(1);
            sharedNodes++;
            degreeSum += ids.size();
            Map<String, Object> metadata = Map.of("shared_node", node.nodeId(), "node_degree", ids.size());
            for (int i = 0; i < ids.size(); i++) {
                for (int j = i + 1; j < ids.size(); j++) {
                    run.emit(ids.get(i), ids.get(j), node.nodeId(), metadata);
                }
            }
        }
        run.addRecordsScanned(linkedRecords.size());
        run.detail("edge_type", params.edgeType());
        run.detail("intermediate_label", params.intermediateLabel());
        run.detail("direction", params.direction().name());
        run.detail("unique_shared_nodes", sharedNodes);
        run.detail("avg_node_degree", sharedNodes == 0 ? 0.0 : (double) degreeSum / sharedNodes);
        run.detail("filtered_nodes", filteredOut);
    }
}
