package com.entity.linkage.graph;

import com.entity.linkage.core.model.MatchEdge;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GraphEdgeStore Tests")
class GraphEdgeStoreTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private StubGraphConnection connection;
    private GraphEdgeStore store;

    @BeforeEach
    void setUp() {
        connection = new StubGraphConnection();
        store = new GraphEdgeStore(connection, "Person", "SIMILAR_TO");
    }

    private static MatchEdge edge() {
        return new MatchEdge("k1", "a", "b", 0.875, "fs", NOW, Map.of("confidence", 0.9));
    }

    @Nested
    @DisplayName("Insert")
    class InsertTests {

        @Test
        @DisplayName("Should write edges with epoch timestamps and JSON metadata")
        void shouldInsert() {
            connection.respond(StubGraphConnection.count(1));

            int written = store.insertEdges(List.of(edge()), false);

            assertEquals(1, written);
            assertEquals(1, connection.executedQueries.size());
            assertTrue(connection.lastQuery().contains("MERGE (a)-[e:SIMILAR_TO {key: $key}]->(b)"));
            Map<String, Object> params = connection.lastParams();
            assertEquals(NOW.toEpochMilli(), params.get("timestamp"));
            assertEquals("{\"confidence\":0.9}", params.get("metadata"));
            assertEquals(0.875, params.get("similarity"));
        }

        @Test
        @DisplayName("Should skip existing edges when ignoring conflicts")
        void shouldSkipExisting() {
            connection.respond(StubGraphConnection.count(1));

            int written = store.insertEdges(List.of(edge()), true);

            assertEquals(0, written);
            assertEquals(1, connection.executedQueries.size());
        }

        @Test
        @DisplayName("Should count nothing when endpoints are missing")
        void shouldCountMissingEndpoints() {
            connection.respond(StubGraphConnection.count(0));
            assertEquals(0, store.insertEdges(List.of(edge()), false));
        }
    }

    @Nested
    @DisplayName("Find and clear")
    class FindTests {

        @Test
        @DisplayName("Should map rows back to edges")
        void shouldFindEdges() {
            connection.respond(List.of(Map.of(
                    "key", "k1", "fromId", "a", "toId", "b", "similarity", 0.875,
                    "method", "fs", "timestamp", NOW.toEpochMilli(),
                    "metadata", "{\"confidence\":0.9}")));

            List<MatchEdge> edges = store.findEdges("fs", 0.5, 10);

            assertEquals(1, edges.size());
            MatchEdge found = edges.get(0);
            assertEquals("k1", found.key());
            assertEquals(NOW, found.timestamp());
            assertEquals(0.9, found.metadata().get("confidence"));
            assertTrue(connection.lastQuery().contains("WHERE e.similarity >= $minSimilarity AND e.method = $method"));
            assertEquals(10, connection.lastParams().get("limit"));
        }

        @Test
        @DisplayName("Should omit conditions for an unbounded search")
        void shouldOmitConditions() {
            store.findEdges(null, Double.NEGATIVE_INFINITY, 0);

            assertFalse(connection.lastQuery().contains("WHERE"));
            assertFalse(connection.lastQuery().contains("LIMIT"));
            assertTrue(connection.lastParams().isEmpty());
        }

        @Test
        @DisplayName("Should delete matching edges and report the count")
        void shouldClearEdges() {
            connection.respond(StubGraphConnection.count(3));

            int removed = store.clearEdges("fs", NOW);

            assertEquals(3, removed);
            assertEquals(2, connection.executedQueries.size());
            assertTrue(connection.lastQuery().contains("DELETE e"));
            assertTrue(connection.lastQuery().contains("WHERE e.method = $method AND e.timestamp < $olderThan"));
        }

        @Test
        @DisplayName("Should not delete when nothing matches")
        void shouldSkipEmptyClear() {
            connection.respond(StubGraphConnection.count(0));

            assertEquals(0, store.clearEdges(null, null));
            assertEquals(1, connection.executedQueries.size());
        }
    }
}
