package com.entity.linkage.ann;

import java.util.List;

/**
 * A way of executing vector similarity searches against the record store.
 * The adapter picks one implementation at construction time.
 */
public interface VectorQueryExecutor {

    SearchMethod method();

    /**
     * Whether this executor can run against the current store. Called once,
     * when the adapter is built.
     */
    boolean probe();

    /**
     * Finds records whose vectors reach the threshold against the query vector.
     */
    List<VectorMatch> search(double[] queryVector, SearchRequest request);

    /**
     * Finds all similar pairs, capping each record at {@code request.limit()} neighbours.
     * The blocking field, when set, must be equal on both records.
     */
    List<VectorPair> findAllPairs(SearchRequest request);
}
