package com.compliance.retention.graph;

import java.util.List;
import java.util.Map;

/**
 * Connection to the graph database backing the graph store adapters.
 * Record categories, legal holds, manifests, reports and audit entries are all
 * stored as labelled nodes reachable through this interface.
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Executes a Cypher statement that modifies the graph.
     *
     * @param query  the Cypher statement, with {@code $name} placeholders
     * @param params placeholder values
     */
    void execute(String query, Map<String, Object> params);

    default void execute(String query) {
        execute(query, Map.of());
    }

    /**
     * Executes a Cypher query and returns its rows.
     *
     * @param query  the Cypher query, with {@code $name} placeholders
     * @param params placeholder values
     * @return result rows keyed by column alias
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    default List<Map<String, Object>> query(String query) {
        return query(query, Map.of());
    }

    boolean isConnected();

    String getGraphName();

    @Override
    void close();
}
