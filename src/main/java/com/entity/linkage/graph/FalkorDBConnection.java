package com.entity.linkage.graph;

import com.entity.linkage.core.InputSanitizer;
import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * FalkorDB-specific implementation using JFalkorDB client.
 *
 * <p>Parameters are substituted into the query text as Cypher literals.
 * Strings are escaped, lists and maps are written as Cypher list and map
 * literals, and map keys must be plain identifiers.</p>
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(String host, int port, String graphName) {
        InputSanitizer.validateCollectionName(graphName);
        this.driver = FalkorDB.driver(host, port);
        this.graphName = graphName;
        this.graph = driver.graph(graphName);
        log.info("graph.connected host={} port={} graph={}", host, port, graphName);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        String processedQuery = processParams(query, params);
        log.debug("Executing: {}", processedQuery);
        graph.query(processedQuery);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        String processedQuery = processParams(query, params);
        log.debug("Querying: {}", processedQuery);

        ResultSet resultSet = graph.query(processedQuery);
        List<Map<String, Object>> results = new ArrayList<>();
        for (Record record : resultSet) {
            Map<String, Object> row = new HashMap<>();
            for (String key : record.keys()) {
                row.put(key, record.getValue(key));
            }
            results.add(row);
        }

        log.debug("Query returned {} results", results.size());
        return results;
    }

    @Override
    public boolean isConnected() {
        try {
            graph.query("RETURN 1");
            return true;
        } catch (Exception e) {
            log.warn("Connection check failed", e);
            return false;
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    /**
     * Asks the engine for its version through {@code dbms.components()}.
     * Engines without the procedure report no version.
     */
    @Override
    public Optional<String> getServerVersion() {
        try {
            ResultSet resultSet = graph.query("CALL dbms.components() YIELD versions RETURN versions[0] AS version");
            Iterator<Record> it = resultSet.iterator();
            if (it.hasNext()) {
                Object version = it.next().getValue("version");
                return Optional.ofNullable(version).map(Object::toString);
            }
        } catch (Exception e) {
            log.debug("graph.version.unavailable graph={} reason={}", graphName, e.getMessage());
        }
        return Optional.empty();
    }

    @Override
    public void createIndexes(String recordLabel) {
        InputSanitizer.validateCollectionName(recordLabel);
        log.info("Creating linkage indexes for label {}...", recordLabel);

        safeExecute("CREATE INDEX FOR (r:" + recordLabel + ") ON (r.id)");
        safeExecute("CREATE INDEX FOR (g:" + GraphGoldenRecordStore.GOLDEN_LABEL + ") ON (g.key)");
        safeExecute("CREATE INDEX FOR (g:" + GraphGoldenRecordStore.GOLDEN_LABEL + ") ON (g.runId)");

        log.info("Index creation complete");
    }

    private void safeExecute(String query) {
        try {
            graph.query(query);
        } catch (Exception e) {
            // Index might already exist
            log.debug("Index creation query result: {} - {}", query, e.getMessage());
        }
    }

    /**
     * Substitutes $param placeholders with literal values, longest names first
     * so that {@code $id} never clobbers {@code $ids}.
     */
    static String processParams(String query, Map<String, Object> params) {
        List<String> names = new ArrayList<>(params.keySet());
        names.sort((a, b) -> Integer.compare(b.length(), a.length()));
        String result = query;
        for (String name : names) {
            result = result.replace("$" + name, formatValue(params.get(name)));
        }
        return result;
    }

    static String formatValue(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String s) {
            return quote(s);
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof double[] doubles) {
            StringBuilder sb = new StringBuilder("[");
            for (int i = 0; i < doubles.length; i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(doubles[i]);
            }
            return sb.append(']').toString();
        }
        if (value instanceof Collection<?> collection) {
            StringBuilder sb = new StringBuilder("[");
            boolean first = true;
            for (Object element : collection) {
                if (!first) {
                    sb.append(", ");
                }
                sb.append(formatValue(element));
                first = false;
            }
            return sb.append(']').toString();
        }
        if (value instanceof Map<?, ?> map) {
            StringBuilder sb = new StringBuilder("{");
            boolean first = true;
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = String.valueOf(entry.getKey());
                InputSanitizer.validateFieldName(key);
                if (!first) {
                    sb.append(", ");
                }
                sb.append(key).append(": ").append(formatValue(entry.getValue()));
                first = false;
            }
            return sb.append('}').toString();
        }
        return quote(value.toString());
    }

    private static String quote(String s) {
        return "'" + s.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    @Override
    public void close() {
        if (driver != null) {
            try {
                driver.close();
            } catch (Exception e) {
                log.warn("Error closing FalkorDB connection", e);
            }
        }
        log.info("FalkorDB connection closed");
    }
}
