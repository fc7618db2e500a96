package com.entity.linkage.blocking;

import com.entity.linkage.blocking.GraphTraversalBlockingParams.Direction;
import com.entity.linkage.blocking.SharedNeighbourSource.SharedNode;
import com.entity.linkage.core.exception.ConfigurationException;
import com.entity.linkage.core.model.CandidatePair;
import com.entity.linkage.core.model.RecordFilter;
import com.entity.linkage.metrics.NoOpMetricsService;
import com.entity.linkage.store.InMemoryRecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GraphTraversalBlockingStrategy Tests")
class GraphTraversalBlockingStrategyTest {

    private final List<GraphTraversalBlockingParams> requests = new ArrayList<>();
    private BlockingStrategies strategies;
    private GraphTraversalBlockingParams params;

    @BeforeEach
    void setUp() {
        SharedNeighbourSource source = request -> {
            requests.add(request);
            return List.of(
                    new SharedNode("phone:555", Map.of("type", "mobile"), List.of("r2", "r1", "r1")),
                    new SharedNode("phone:777", Map.of("type", "landline"), List.of("r3", "r4", "r5")),
                    new SharedNode("phone:888", Map.of("type", "mobile"), List.of("r6")),
                    new SharedNode("phone:000", Map.of("type", "mobile"),
                            List.of("r10", "r11", "r12", "r13", "r14")));
        };
        strategies = new BlockingStrategies(new InMemoryRecordStore("companies"), null, source,
                100, NoOpMetricsService.INSTANCE);
        params = new GraphTraversalBlockingParams("HAS_PHONE", "Phone", Direction.OUTGOING, 2, 4, List.of());
    }

    private static Set<String> keys(List<CandidatePair> pairs) {
        return pairs.stream().map(CandidatePair::pairKey).collect(Collectors.toSet());
    }

    @Nested
    @DisplayName("Candidate generation")
    class Candidates {

        @Test
        @DisplayName("records sharing a node are paired once")
        void sharedNodes() {
            BlockingStrategy strategy = strategies.create(params);

            List<CandidatePair> pairs = strategy.generateCandidates();

            assertEquals(Set.of("r1|r2", "r3|r4", "r3|r5", "r4|r5"), keys(pairs));
            assertEquals("graph_traversal", pairs.get(0).strategy());
            assertEquals(List.of(params), requests);
        }

        @Test
        @DisplayName("pairs carry the shared node and its degree")
        void metadata() {
            CandidatePair pair = strategies.create(params).generateCandidates().get(0);

            assertEquals("r1|r2", pair.pairKey());
            assertEquals("phone:555", pair.blockingKey());
            assertEquals("phone:555", pair.metadata().get("shared_node"));
            assertEquals(2, pair.metadata().get("node_degree"));
        }

        @Test
        @DisplayName("nodes above the degree limit are skipped, below it ignored")
        void degreeBounds() {
            BlockingStrategy strategy = strategies.create(params);
            strategy.generateCandidates();

            BlockingStatistics stats = strategy.getStatistics();
            assertEquals(2, stats.blocksFormed());
            assertEquals(1, stats.skippedOversizedBlocks());
            assertEquals(11, stats.recordsScanned());
            assertEquals(2, stats.details().get("unique_shared_nodes"));
            assertEquals(2.5, (double) stats.details().get("avg_node_degree"), 1e-9);
            assertEquals("HAS_PHONE", stats.details().get("edge_type"));
            assertEquals("OUTGOING", stats.details().get("direction"));
        }

        @Test
        @DisplayName("node filters apply to the intermediate node's properties")
        void nodeFilters() {
            BlockingStrategy strategy = strategies.create(
                    params.withFilters(List.of(RecordFilter.equalTo("type", "mobile"))));

            assertEquals(Set.of("r1|r2"), keys(strategy.generateCandidates()));
            assertEquals(1, strategy.getStatistics().details().get("filtered_nodes"));
        }
    }

    @Nested
    @DisplayName("Configuration")
    class Configuration {

        @Test
        @DisplayName("requires a shared neighbour source")
        void missingSource() {
            BlockingStrategies withoutGraph = new BlockingStrategies(new InMemoryRecordStore("companies"));

            assertThrows(ConfigurationException.class, () -> withoutGraph.create(params));
        }

        @Test
        @DisplayName("rejects invalid names and degree bounds")
        void invalidParams() {
            assertThrows(ConfigurationException.class, () -> GraphTraversalBlockingParams.of("HAS PHONE", "Phone"));
            assertThrows(ConfigurationException.class, () -> GraphTraversalBlockingParams.of("HAS_PHONE", null));
            assertThrows(ConfigurationException.class,
                    () -> new GraphTraversalBlockingParams("HAS_PHONE", "Phone", null, 2, 100, List.of()));
            assertThrows(ConfigurationException.class,
                    () -> new GraphTraversalBlockingParams("HAS_PHONE", "Phone", Direction.ANY, 1, 100, List.of()));
            assertThrows(ConfigurationException.class,
                    () -> new GraphTraversalBlockingParams("HAS_PHONE", "Phone", Direction.ANY, 5, 4, List.of()));
        }

        @Test
        @DisplayName("defaults to outgoing edges and a degree limit of 100")
        void defaults() {
            GraphTraversalBlockingParams defaults = GraphTraversalBlockingParams.of("HAS_PHONE", "Phone");

            assertEquals(Direction.OUTGOING, defaults.direction());
            assertEquals(2, defaults.minEntitiesPerNode());
            assertEquals(100, defaults.maxEntitiesPerNode());
            assertEquals(BlockingStrategyType.GRAPH_TRAVERSAL, defaults.type());
        }
    }
}
