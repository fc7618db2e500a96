package com.entity.linkage.graph;

import com.entity.linkage.blocking.GraphTraversalBlockingParams;
import com.entity.linkage.blocking.SharedNeighbourSource;
import com.entity.linkage.core.InputSanitizer;
import com.entity.linkage.core.exception.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads shared neighbours from FalkorDB: for every intermediate node, the ids
 * of the records of one collection linked to it by the configured relationship.
 */
public class GraphSharedNeighbourSource implements SharedNeighbourSource {
    private static final Logger log = LoggerFactory.getLogger(GraphSharedNeighbourSource.class);

    private final GraphConnection connection;
    private final String recordLabel;

    public GraphSharedNeighbourSource(GraphConnection connection, String recordLabel) {
        InputSanitizer.validateCollectionName(recordLabel);
        this.connection = connection;
        this.recordLabel = recordLabel;
    }

    @Override
    public List<SharedNode> sharedNodes(GraphTraversalBlockingParams params) {
        String query = """
                MATCH %s
                WHERE r.id IS NOT NULL
                WITH n, collect(DISTINCT r.id) as recordIds
                RETURN coalesce(toString(n.id), toString(id(n))) as nodeId, properties(n) as props, recordIds
                ORDER BY nodeId
                """.formatted(pattern(params));
        List<Map<String, Object>> rows;
        try {
            rows = connection.query(query, Map.of());
        } catch (RuntimeException e) {
            throw new StorageException("Shared neighbour query over " + params.edgeType() + " failed: "
                    + e.getMessage(), e);
        }
        List<SharedNode> nodes = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            nodes.add(new SharedNode(String.valueOf(row.get("nodeId")), props(row.get("props")),
                    ids(row.get("recordIds"))));
        }
        log.debug("blocking.shared_nodes label={} edge={} nodes={}", recordLabel, params.edgeType(), nodes.size());
        return nodes;
    }

    private String pattern(GraphTraversalBlockingParams params) {
        String record = "(r:" + recordLabel + ")";
        String node = "(n:" + params.intermediateLabel() + ")";
        String edge = "[:" + params.edgeType() + "]";
        return switch (params.direction()) {
            case OUTGOING -> record + "-" + edge + "->" + node;
            case INCOMING -> record + "<-" + edge + "-" + node;
            case ANY -> record + "-" + edge + "-" + node;
        };
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> props(Object value) {
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    private static List<String> ids(Object value) {
        List<String> ids = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object id : list) {
                if (id != null) {
                    ids.add(id.toString());
                }
            }
        }
        return ids;
    }
}
