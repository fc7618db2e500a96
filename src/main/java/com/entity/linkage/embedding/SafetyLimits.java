package com.entity.linkage.embedding;

import com.entity.linkage.core.exception.ConfigurationException;
import com.entity.linkage.core.exception.SafetyLimitExceededException;

/**
 * Hard caps on embedding runs, with softer warning thresholds below them.
 * Exceeding a hard cap fails the run; inputs are never truncated.
 */
public record SafetyLimits(int maxNodes, int warnNodesThreshold, int maxDimensions,
                           int maxEdgesFetched, int warnEdgesThreshold) {

    public static final String MAX_NODES = "max_nodes";
    public static final String MAX_DIMENSIONS = "max_dimensions";
    public static final String MAX_EDGES_FETCHED = "max_edges_fetched";

    public SafetyLimits {
        if (maxNodes < 1 || maxDimensions < 1 || maxEdgesFetched < 1) {
            throw new ConfigurationException("Safety limits must be >= 1");
        }
        if (warnNodesThreshold > maxNodes || warnEdgesThreshold > maxEdgesFetched) {
            throw new ConfigurationException("Warning thresholds must not exceed their hard limits");
        }
    }

    public static SafetyLimits defaults() {
        return new SafetyLimits(5_000, 1_000, 512, 200_000, 50_000);
    }

    void checkNodes(int nodes) {
        if (nodes > maxNodes) {
            throw new SafetyLimitExceededException(MAX_NODES, maxNodes, nodes);
        }
    }

    void checkDimensions(int dimensions) {
        if (dimensions > maxDimensions) {
            throw new SafetyLimitExceededException(MAX_DIMENSIONS, maxDimensions, dimensions);
        }
    }

    void checkEdges(int edges) {
        if (edges > maxEdgesFetched) {
            throw new SafetyLimitExceededException(MAX_EDGES_FETCHED, maxEdgesFetched, edges);
        }
    }
}
