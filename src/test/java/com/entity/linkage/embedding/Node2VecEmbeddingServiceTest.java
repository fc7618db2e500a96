package com.entity.linkage.embedding;

import com.entity.linkage.core.exception.ConfigurationException;
import com.entity.linkage.core.exception.SafetyLimitExceededException;
import com.entity.linkage.core.model.MatchEdge;
import com.entity.linkage.core.model.Record;
import com.entity.linkage.edge.EdgeKeys;
import com.entity.linkage.edge.InMemoryEdgeStore;
import com.entity.linkage.metrics.NoOpMetricsService;
import com.entity.linkage.store.InMemoryRecordStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class Node2VecEmbeddingServiceTest {

    // two triangles joined by a bridge
    private static final List<WeightedEdge> GRAPH = List.of(
            new WeightedEdge("a", "b", 1.0),
            new WeightedEdge("b", "c", 1.0),
            new WeightedEdge("a", "c", 1.0),
            new WeightedEdge("c", "d", 0.5),
            new WeightedEdge("d", "e", 1.0),
            new WeightedEdge("e", "f", 1.0),
            new WeightedEdge("d", "f", 1.0));

    private static Node2VecParams params(int dimensions, long seed) {
        return new Node2VecParams(dimensions, 10, 10, 3, seed, 1.0, 1.0, false);
    }

    @Nested
    @DisplayName("embed")
    class Embed {

        @Test
        @DisplayName("the same seed reproduces the same vectors")
        void deterministic() {
            EmbeddingResult first = new Node2VecEmbeddingService(params(4, 7L)).embed(GRAPH);
            EmbeddingResult second = new Node2VecEmbeddingService(params(4, 7L)).embed(GRAPH);

            assertEquals(first.vectors().keySet(), second.vectors().keySet());
            for (String node : first.vectors().keySet()) {
                assertArrayEquals(first.vector(node), second.vector(node), 1e-8);
            }
        }

        @Test
        @DisplayName("a different seed changes the walks")
        void seedMatters() {
            Node2VecEmbeddingService one = new Node2VecEmbeddingService(params(4, 1L));
            Node2VecEmbeddingService two = new Node2VecEmbeddingService(params(4, 2L));
            List<TreeMap<Integer, Double>> adjacency = ring(6);

            List<int[]> walksOne = one.generateWalks(adjacency);
            List<int[]> walksTwo = two.generateWalks(adjacency);

            boolean differs = false;
            for (int i = 0; i < walksOne.size() && !differs; i++) {
                differs = !java.util.Arrays.equals(walksOne.get(i), walksTwo.get(i));
            }
            assertTrue(differs);
        }

        @Test
        @DisplayName("vectors are unit length and cover every node")
        void unitVectors() {
            EmbeddingResult result = new Node2VecEmbeddingService(params(3, 42L)).embed(GRAPH);

            assertEquals(List.of("a", "b", "c", "d", "e", "f"), new ArrayList<>(result.vectors().keySet()));
            for (double[] vector : result.vectors().values()) {
                assertEquals(3, vector.length);
                double norm = 0;
                for (double x : vector) {
                    norm += x * x;
                }
                assertEquals(1.0, Math.sqrt(norm), 1e-9);
            }
        }

        @Test
        @DisplayName("nodes in the same triangle end up closer than nodes across the bridge")
        void structure() {
            EmbeddingResult result = new Node2VecEmbeddingService(params(2, 42L)).embed(GRAPH);

            double within = dot(result.vector("a"), result.vector("b"));
            double across = dot(result.vector("a"), result.vector("f"));
            assertTrue(within > across, "within=" + within + " across=" + across);
        }

        @Test
        @DisplayName("the dimension is clamped to the node count")
        void clampDimensions() {
            EmbeddingResult result = new Node2VecEmbeddingService(params(64, 42L)).embed(GRAPH);

            assertEquals(6, result.metadata().dimensions());
            assertEquals(64, result.metadata().requestedDimensions());
            assertEquals(6, result.vector("a").length);
            assertEquals(6, result.metadata().nodes());
        }

        @Test
        @DisplayName("no edges means no vectors")
        void empty() {
            EmbeddingResult result = new Node2VecEmbeddingService(params(8, 42L)).embed(List.of());

            assertTrue(result.isEmpty());
            assertEquals(0, result.metadata().dimensions());
        }

        @Test
        @DisplayName("walks stop at dead ends of a directed graph")
        void deadEnds() {
            Node2VecParams directed = new Node2VecParams(2, 5, 1, 2, 42L, 1.0, 1.0, true);
            List<TreeMap<Integer, Double>> adjacency = List.of(
                    new TreeMap<>(Map.of(1, 1.0)),
                    new TreeMap<>());

            List<int[]> walks = new Node2VecEmbeddingService(directed).generateWalks(adjacency);

            assertArrayEquals(new int[]{0, 1}, walks.get(0));
            assertArrayEquals(new int[]{1}, walks.get(1));
        }
    }

    @Nested
    @DisplayName("safety limits")
    class Limits {

        @Test
        @DisplayName("too many nodes fails with max_nodes")
        void maxNodes() {
            Node2VecEmbeddingService service = new Node2VecEmbeddingService(params(2, 42L),
                    new SafetyLimits(5, 5, 512, 100, 100), NoOpMetricsService.INSTANCE);

            SafetyLimitExceededException e = assertThrows(SafetyLimitExceededException.class,
                    () -> service.embed(GRAPH));
            assertEquals(SafetyLimits.MAX_NODES, e.getLimitName());
            assertEquals(6, e.getActual());
        }

        @Test
        @DisplayName("too many dimensions fails with max_dimensions")
        void maxDimensions() {
            SafetyLimitExceededException e = assertThrows(SafetyLimitExceededException.class,
                    () -> new Node2VecEmbeddingService(params(600, 42L), SafetyLimits.defaults(), null));
            assertEquals(SafetyLimits.MAX_DIMENSIONS, e.getLimitName());
        }

        @Test
        @DisplayName("too many stored edges fails with max_edges_fetched")
        void maxEdges() {
            InMemoryEdgeStore store = edgeStore();
            Node2VecEmbeddingService service = new Node2VecEmbeddingService(params(2, 42L),
                    new SafetyLimits(100, 10, 512, 2, 1), NoOpMetricsService.INSTANCE);

            SafetyLimitExceededException unbounded = assertThrows(SafetyLimitExceededException.class,
                    () -> service.fetchEdges(store, null, 0.0, 0));
            assertEquals(SafetyLimits.MAX_EDGES_FETCHED, unbounded.getLimitName());

            assertThrows(SafetyLimitExceededException.class, () -> service.fetchEdges(store, null, 0.0, 3));
        }

        @Test
        @DisplayName("warning thresholds cannot exceed hard limits")
        void invalidLimits() {
            assertThrows(ConfigurationException.class, () -> new SafetyLimits(10, 11, 512, 100, 10));
            assertThrows(ConfigurationException.class, () -> params(0, 42L));
        }
    }

    @Nested
    @DisplayName("edge and record stores")
    class Stores {

        @Test
        @DisplayName("edges are read once per key with confidence as weight")
        void fetchEdges() {
            List<WeightedEdge> edges = new Node2VecEmbeddingService(params(2, 42L))
                    .fetchEdges(edgeStore(), "fellegi_sunter", 0.5, 100);

            assertEquals(2, edges.size());
            WeightedEdge ab = edges.stream().filter(e -> e.from().equals("a") || e.to().equals("a"))
                    .findFirst().orElseThrow();
            assertEquals(0.9, ab.weight());
            WeightedEdge cd = edges.stream().filter(e -> e.from().equals("c") || e.to().equals("c"))
                    .findFirst().orElseThrow();
            assertEquals(WeightedEdge.DEFAULT_WEIGHT, cd.weight());
        }

        @Test
        @DisplayName("vectors and their metadata are written onto the records")
        void writeEmbeddings() {
            InMemoryRecordStore records = new InMemoryRecordStore("people")
                    .add(Record.of("a", Map.of("name", "Ann")))
                    .add(Record.of("b", Map.of("name", "Bob")));
            EmbeddingResult result = new EmbeddingResult(
                    Map.of("a", new double[]{1.0, 0.0}, "b", new double[]{0.0, 1.0}, "ghost", new double[]{1, 1}),
                    new EmbeddingMetadata(EmbeddingMetadata.METHOD, 2, 8, 10, 10, 5, 42L, 3));

            int updated = new Node2VecEmbeddingService(params(2, 42L)).writeEmbeddings(records, result, "emb", 2);

            assertEquals(2, updated);
            Record a = records.findById("a").orElseThrow();
            assertEquals(List.of(1.0, 0.0), a.get("emb"));
            @SuppressWarnings("unchecked")
            Map<String, Object> meta = (Map<String, Object>) a.get("emb_meta");
            assertEquals("node2vec_svd", meta.get("method"));
            assertEquals(42L, meta.get("seed"));
            assertEquals("Ann", a.get("name"));
        }

        @Test
        @DisplayName("field names are validated before writing")
        void invalidField() {
            EmbeddingResult result = new EmbeddingResult(Map.of(),
                    new EmbeddingMetadata(EmbeddingMetadata.METHOD, 0, 2, 10, 10, 5, 42L, 0));
            Node2VecEmbeddingService service = new Node2VecEmbeddingService(params(2, 42L));

            assertThrows(RuntimeException.class,
                    () -> service.writeEmbeddings(new InMemoryRecordStore("people"), result, "bad field;", 10));
            assertThrows(IllegalArgumentException.class,
                    () -> service.writeEmbeddings(new InMemoryRecordStore("people"), result, "emb", 0));
        }
    }

    private static InMemoryEdgeStore edgeStore() {
        InMemoryEdgeStore store = new InMemoryEdgeStore("similarTo");
        Instant now = Instant.EPOCH;
        MatchEdge ab = new MatchEdge(EdgeKeys.edgeKey("a", "b"), "a", "b", 6.3, "fellegi_sunter", now,
                Map.of("confidence", 0.9));
        MatchEdge bc = new MatchEdge(EdgeKeys.edgeKey("b", "c"), "b", "c", 2.1, "fellegi_sunter", now,
                Map.of("confidence", 0.2));
        MatchEdge cd = new MatchEdge(EdgeKeys.edgeKey("c", "d"), "c", "d", 2.5, "fellegi_sunter", now, Map.of());
        store.insertEdges(List.of(ab, ab.reversed(), bc, cd), false);
        return store;
    }

    private static List<TreeMap<Integer, Double>> ring(int n) {
        List<TreeMap<Integer, Double>> adjacency = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            TreeMap<Integer, Double> neighbours = new TreeMap<>();
            neighbours.put((i + 1) % n, 1.0);
            neighbours.put((i + n - 1) % n, 1.0);
            adjacency.add(neighbours);
        }
        return adjacency;
    }

    private static double dot(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }
}
