package com.entity.linkage.edge;

import com.entity.linkage.core.model.MatchEdge;

import java.time.Instant;
import java.util.List;

/**
 * Storage contract for similarity edges.
 *
 * <p>An edge is identified by its deterministic key and direction, so a
 * bidirectional pair stores two edges under one key. Writing an edge that
 * already exists either replaces it or, with {@code ignoreOnConflict}, leaves
 * the stored edge untouched.</p>
 */
public interface EdgeStore {

    String getEdgeCollection();

    /**
     * Writes one batch of edges.
     *
     * @return number of edges written
     * @throws com.entity.linkage.core.exception.StorageException if the batch fails
     */
    int insertEdges(List<MatchEdge> edges, boolean ignoreOnConflict);

    /**
     * Deletes edges matching both criteria; a null criterion matches everything.
     *
     * @param method    method tag to delete, or null
     * @param olderThan delete edges created before this instant, or null
     * @return number of edges deleted
     */
    int clearEdges(String method, Instant olderThan);

    /**
     * Reads edges, optionally filtered.
     *
     * @param method        method tag, or null for all
     * @param minSimilarity minimum stored similarity
     * @param limit         maximum edges returned, 0 for no limit
     */
    List<MatchEdge> findEdges(String method, double minSimilarity, int limit);

    long count();
}
