package com.entity.linkage.golden;

import java.util.List;
import java.util.Optional;

/**
 * Storage contract for golden records and their resolved-to edges.
 */
public interface GoldenRecordStore {

    /**
     * Inserts or replaces golden records by key.
     *
     * @return number of records that did not exist before
     */
    int upsertGoldenRecords(List<GoldenRecord> records);

    /**
     * Inserts resolved-to edges.
     *
     * @param ignoreOnConflict skip edges whose key already exists
     * @return number of edges inserted
     */
    int insertResolvedEdges(List<ResolvedEdge> edges, boolean ignoreOnConflict);

    Optional<GoldenRecord> findGoldenRecord(String key);

    long countGoldenRecords();

    long countResolvedEdges();
}
