package com.entity.linkage.golden;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process golden record collection.
 */
public class InMemoryGoldenRecordStore implements GoldenRecordStore {

    private final Map<String, GoldenRecord> goldenRecords = new ConcurrentHashMap<>();
    private final Map<String, ResolvedEdge> resolvedEdges = new ConcurrentHashMap<>();

    @Override
    public synchronized int upsertGoldenRecords(List<GoldenRecord> records) {
        int created = 0;
        for (GoldenRecord record : records) {
            if (goldenRecords.put(record.key(), record) == null) {
                created++;
            }
        }
        return created;
    }

    @Override
    public synchronized int insertResolvedEdges(List<ResolvedEdge> edges, boolean ignoreOnConflict) {
        int inserted = 0;
        for (ResolvedEdge edge : edges) {
            if (ignoreOnConflict && resolvedEdges.containsKey(edge.key())) {
                continue;
            }
            resolvedEdges.put(edge.key(), edge);
            inserted++;
        }
        return inserted;
    }

    @Override
    public Optional<GoldenRecord> findGoldenRecord(String key) {
        return Optional.ofNullable(goldenRecords.get(key));
    }

    @Override
    public long countGoldenRecords() {
        return goldenRecords.size();
    }

    @Override
    public long countResolvedEdges() {
        return resolvedEdges.size();
    }
}
