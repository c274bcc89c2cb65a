package com.social.connection.graph;

import java.util.List;
import java.util.Map;

/**
 * Connection to the graph database backing the persistent stores.
 * Queries are Cypher with {@code $name} parameters.
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Runs a write statement.
     *
     * @param query  Cypher statement
     * @param params statement parameters
     */
    void execute(String query, Map<String, Object> params);

    default void execute(String query) {
        execute(query, Map.of());
    }

    /**
     * Runs a read query.
     *
     * @param query  Cypher query
     * @param params query parameters
     * @return one map per result row, keyed by the returned column names
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    default List<Map<String, Object>> query(String query) {
        return query(query, Map.of());
    }

    boolean isConnected();

    String getGraphName();

    /**
     * Creates the indexes used by the connection, stats and taxonomy stores.
     * Safe to call repeatedly.
     */
    void createIndexes();

    @Override
    void close();
}
