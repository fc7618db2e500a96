package com.entity.linkage.blocking;

import com.entity.linkage.core.InputSanitizer;
import com.entity.linkage.core.exception.ConfigurationException;
import com.entity.linkage.core.exception.ValidationException;
import com.entity.linkage.core.model.RecordFilter;

import java.util.List;

/**
 * Graph traversal blocking: records connected to the same intermediate node
 * (a phone number, an address, an executive) share a block.
 *
 * @param edgeType              relationship type linking records and intermediate nodes
 * @param intermediateLabel     label of the shared nodes
 * @param direction             direction of the relationship, seen from the record
 * @param minEntitiesPerNode    nodes shared by fewer records emit nothing
 * @param maxEntitiesPerNode    nodes shared by more records are skipped as noise
 * @param filters               filters on the intermediate node's properties
 */
public record GraphTraversalBlockingParams(String edgeType, String intermediateLabel, Direction direction,
                                           int minEntitiesPerNode, int maxEntitiesPerNode,
                                           List<RecordFilter> filters) implements BlockingParams {

    public static final int DEFAULT_MAX_ENTITIES_PER_NODE = 100;

    public enum Direction {
        /** record -> intermediate node */
        OUTGOING,
        /** intermediate node -> record */
        INCOMING,
        ANY
    }

    public GraphTraversalBlockingParams {
        validateName(edgeType, "edgeType");
        validateName(intermediateLabel, "intermediateLabel");
        if (direction == null) {
            throw new ConfigurationException("Graph traversal blocking requires a direction");
        }
        BlockSizes.validate(minEntitiesPerNode, maxEntitiesPerNode);
        filters = filters != null ? List.copyOf(filters) : List.of();
    }

    private static void validateName(String name, String what) {
        try {
            InputSanitizer.validateCollectionName(name);
        } catch (ValidationException e) {
            throw new ConfigurationException("Invalid " + what + ": " + e.getMessage(), e);
        }
    }

    public static GraphTraversalBlockingParams of(String edgeType, String intermediateLabel) {
        return new GraphTraversalBlockingParams(edgeType, intermediateLabel, Direction.OUTGOING,
                ExactBlockingParams.DEFAULT_MIN_BLOCK_SIZE, DEFAULT_MAX_ENTITIES_PER_NODE, List.of());
    }

    public GraphTraversalBlockingParams withFilters(List<RecordFilter> newFilters) {
        return new GraphTraversalBlockingParams(edgeType, intermediateLabel, direction,
                minEntitiesPerNode, maxEntitiesPerNode, newFilters);
    }

    @Override
    public BlockingStrategyType type() {
        return BlockingStrategyType.GRAPH_TRAVERSAL;
    }
}
