package com.entity.linkage.graph;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Connection to the graph database holding records, match edges and golden records.
 * Abstracts the underlying graph database implementation.
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Executes a Cypher query that modifies the graph.
     *
     * @param query  the Cypher query
     * @param params query parameters
     */
    void execute(String query, Map<String, Object> params);

    default void execute(String query) {
        execute(query, Map.of());
    }

    /**
     * Executes a Cypher query and returns its rows as maps keyed by column alias.
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    default List<Map<String, Object>> query(String query) {
        return query(query, Map.of());
    }

    boolean isConnected();

    String getGraphName();

    /**
     * Version string reported by the database engine, when it reports one.
     */
    default Optional<String> getServerVersion() {
        return Optional.empty();
    }

    /**
     * Creates the indexes used by the linkage stores if they don't exist.
     *
     * @param recordLabel node label of the record collection
     */
    void createIndexes(String recordLabel);

    @Override
    void close();
}
