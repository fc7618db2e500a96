package com.entity.linkage.blocking;

import com.entity.linkage.core.model.Record;

import java.util.List;
import java.util.Map;

/**
 * Supplies, for every intermediate node, the records connected to it.
 */
@FunctionalInterface
public interface SharedNeighbourSource {

    List<SharedNode> sharedNodes(GraphTraversalBlockingParams params);

    /**
     * An intermediate node and the identifiers of the records linked to it.
     */
    record SharedNode(String nodeId, Map<String, Object> properties, List<String> recordIds) {

        public SharedNode {
            if (nodeId == null || nodeId.isBlank()) {
                throw new IllegalArgumentException("nodeId must not be blank");
            }
            properties = properties != null ? Map.copyOf(properties) : Map.of();
            recordIds = recordIds != null ? List.copyOf(recordIds) : List.of();
        }

        /**
         * The node viewed as a record so that record filters apply to its properties.
         */
        public Record asRecord() {
            return new Record(nodeId, properties);
        }
    }
}
