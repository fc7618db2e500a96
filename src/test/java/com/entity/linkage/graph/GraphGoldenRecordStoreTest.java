package com.entity.linkage.graph;

import com.entity.linkage.golden.GoldenRecord;
import com.entity.linkage.golden.ResolvedEdge;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GraphGoldenRecordStore Tests")
class GraphGoldenRecordStoreTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private StubGraphConnection connection;
    private GraphGoldenRecordStore store;

    @BeforeEach
    void setUp() {
        connection = new StubGraphConnection();
        store = new GraphGoldenRecordStore(connection, "Person");
    }

    private static GoldenRecord golden() {
        return new GoldenRecord("g1", List.of("a", "b"), Map.of("name", "Ann"),
                Map.of("name", List.of("a", "b")), "run-1", "wcc", NOW);
    }

    @Test
    @DisplayName("Should count only newly created golden records")
    void shouldUpsert() {
        connection.respond(StubGraphConnection.count(0));

        int created = store.upsertGoldenRecords(List.of(golden()));

        assertEquals(1, created);
        assertTrue(connection.lastQuery().contains("MERGE (g:GoldenRecord {key: $key})"));
        Map<String, Object> params = connection.lastParams();
        assertEquals("{\"name\":\"Ann\"}", params.get("fields"));
        assertEquals("{\"name\":[\"a\",\"b\"]}", params.get("provenance"));
        assertEquals(NOW.toEpochMilli(), params.get("updatedAt"));
    }

    @Test
    @DisplayName("Should not count an existing golden record as created")
    void shouldNotCountExisting() {
        connection.respond(StubGraphConnection.count(1));
        assertEquals(0, store.upsertGoldenRecords(List.of(golden())));
    }

    @Test
    @DisplayName("Should insert resolved edges and skip existing ones")
    void shouldInsertResolvedEdges() {
        ResolvedEdge edge = new ResolvedEdge("r1", "a", "g1", "run-1");
        connection.respond(StubGraphConnection.count(1));
        assertEquals(1, store.insertResolvedEdges(List.of(edge), false));
        assertTrue(connection.lastQuery().contains("MERGE (r)-[e:RESOLVED_TO {key: $key}]->(g)"));

        connection.respond(StubGraphConnection.count(1));
        assertEquals(0, store.insertResolvedEdges(List.of(edge), true));
    }

    @Test
    @DisplayName("Should read a golden record back from its JSON properties")
    void shouldFindGoldenRecord() {
        connection.respond(List.of(Map.of(
                "key", "g1", "memberIds", List.of("a", "b"),
                "fields", "{\"name\":\"Ann\"}", "provenance", "{\"name\":[\"a\"]}",
                "runId", "run-1", "method", "wcc", "updatedAt", NOW.toEpochMilli())));

        Optional<GoldenRecord> found = store.findGoldenRecord("g1");

        assertTrue(found.isPresent());
        assertEquals(List.of("a", "b"), found.get().memberIds());
        assertEquals("Ann", found.get().fields().get("name"));
        assertEquals(List.of("a"), found.get().provenance().get("name"));
        assertEquals(NOW, found.get().updatedAt());
    }

    @Test
    @DisplayName("Should count golden records and resolved edges")
    void shouldCount() {
        connection.respond(StubGraphConnection.count(2)).respond(StubGraphConnection.count(4));

        assertEquals(2, store.countGoldenRecords());
        assertEquals(4, store.countResolvedEdges());
    }
}
