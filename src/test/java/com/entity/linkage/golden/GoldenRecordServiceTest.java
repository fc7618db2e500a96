package com.entity.linkage.golden;

import com.entity.linkage.core.model.Cluster;
import com.entity.linkage.core.model.Record;
import com.entity.linkage.edge.EdgeKeys;
import com.entity.linkage.store.InMemoryRecordStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GoldenRecordServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private final InMemoryRecordStore records = new InMemoryRecordStore("people")
            .add(Record.of("1", Map.of("name", "Jon Smith", "city", "Boston")))
            .add(Record.of("2", Map.of("name", "John Smith", "city", "Boston")))
            .add(Record.of("3", Map.of("name", "John Smith", "city", "")))
            .add(Record.of("4", Map.of("name", "Ann Lee")))
            .add(Record.of("5", Map.of("name", "Anne Lee")));
    private final InMemoryGoldenRecordStore goldenStore = new InMemoryGoldenRecordStore();
    private final GoldenRecordService service =
            new GoldenRecordService(records, goldenStore, new MostFrequentValuePolicy(), CLOCK);

    private final List<Cluster> clusters = List.of(
            new Cluster("cluster_000000", List.of("1", "2", "3")),
            new Cluster("cluster_000001", List.of("4", "5")));

    @Test
    @DisplayName("one golden record per cluster with resolved edges for every member")
    void createsGoldenRecords() {
        GoldenRecordRunResult result = service.run("run-1", clusters, 2, "wcc");

        assertEquals(2, result.clustersProcessed());
        assertEquals(2, result.goldenRecordsCreated());
        assertEquals(5, result.resolvedEdgesInserted());

        GoldenRecord golden = goldenStore.findGoldenRecord(EdgeKeys.goldenKey(List.of("1", "2", "3"))).orElseThrow();
        assertEquals(List.of("1", "2", "3"), golden.memberIds());
        assertEquals("John Smith", golden.fields().get("name"));
        assertEquals(List.of("2", "3"), golden.provenance().get("name"));
        assertEquals("Boston", golden.fields().get("city"));
        assertEquals("run-1", golden.runId());
        assertEquals("wcc", golden.method());
        assertEquals(CLOCK.instant(), golden.updatedAt());
    }

    @Test
    @DisplayName("a second run over the same clusters adds nothing")
    void idempotent() {
        service.run("run-1", clusters, 2, "wcc");
        GoldenRecordRunResult second = service.run("run-2", clusters, 2, "wcc");

        assertEquals(0, second.goldenRecordsCreated());
        assertEquals(2, second.goldenRecordsUpserted());
        assertEquals(0, second.resolvedEdgesInserted());
        assertEquals(2, goldenStore.countGoldenRecords());
        assertEquals(5, goldenStore.countResolvedEdges());
    }

    @Test
    @DisplayName("small clusters and clusters without stored members are skipped")
    void skipsClusters() {
        GoldenRecordRunResult result = service.run("run-1", List.of(
                new Cluster("cluster_000000", List.of("1", "2", "3")),
                new Cluster("cluster_000001", List.of("4", "5")),
                new Cluster("cluster_000002", List.of("x", "y"))), 3, "wcc");

        assertEquals(1, result.clustersProcessed());
        assertEquals(2, result.clustersSkipped());

        GoldenRecordRunResult lenient = service.run("run-2", List.of(
                new Cluster("cluster_000002", List.of("x", "y"))), 2, "wcc");
        assertEquals(0, lenient.clustersProcessed());
        assertEquals(1, lenient.clustersSkipped());
    }

    @Test
    @DisplayName("a blank run id is rejected")
    void blankRunId() {
        assertThrows(IllegalArgumentException.class, () -> service.run(" ", clusters, 2, "wcc"));
    }

    @Nested
    @DisplayName("most frequent value policy")
    class Policy {

        private final MostFrequentValuePolicy policy = new MostFrequentValuePolicy();

        @Test
        @DisplayName("ties go to the longer value, then the smaller one")
        void ties() {
            FieldMergePolicy.MergedFields merged = policy.merge(List.of(
                    Record.of("1", Map.of("name", "Ann Lee", "code", "b")),
                    Record.of("2", Map.of("name", "Anne Lee", "code", "a"))));

            assertEquals("Anne Lee", merged.values().get("name"));
            assertEquals(List.of("2"), merged.provenance().get("name"));
            assertEquals("a", merged.values().get("code"));
        }

        @Test
        @DisplayName("system fields, vectors and blanks are ignored")
        void ignored() {
            FieldMergePolicy.MergedFields merged = policy.merge(List.of(
                    Record.of("1", Map.of("_rev", "x", "embedding", List.of(1.0, 2.0), "note", " ")),
                    Record.of("2", Map.of("age", 41))));

            assertEquals(Map.of("age", 41), merged.values());
        }
    }
}
