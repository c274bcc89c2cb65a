package com.social.connection.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link GraphConnection} backed by FalkorDB through the JFalkorDB client.
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);

    private static final List<String> INDEXES = List.of(
            "CREATE INDEX FOR (c:Connection) ON (c.id)",
            "CREATE INDEX FOR (c:Connection) ON (c.initiatorId)",
            "CREATE INDEX FOR (c:Connection) ON (c.recipientId)",
            "CREATE INDEX FOR (c:Connection) ON (c.status)",
            "CREATE INDEX FOR (u:User) ON (u.id)",
            "CREATE INDEX FOR (s:UserStats) ON (s.userId)",
            "CREATE INDEX FOR (r:SubRelation) ON (r.nameKey)",
            "CREATE INDEX FOR (rc:RelationCategory) ON (rc.nameKey)"
    );

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(String host, int port, String graphName) {
        this.driver = FalkorDB.driver(host, port);
        this.graphName = graphName;
        this.graph = driver.graph(graphName);
        log.info("FalkorDB connection opened host={} port={} graph={}", host, port, graphName);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        log.debug("Executing: {} params={}", query, params.keySet());
        graph.query(query, params);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        log.debug("Querying: {} params={}", query, params.keySet());
        ResultSet resultSet = graph.query(query, params);
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Record record : resultSet) {
            Map<String, Object> row = new HashMap<>();
            for (String key : record.keys()) {
                row.put(key, record.getValue(key));
            }
            rows.add(row);
        }
        return rows;
    }

    @Override
    public boolean isConnected() {
        try {
            graph.query("RETURN 1");
            return true;
        } catch (Exception e) {
            log.warn("FalkorDB ping failed for graph {}", graphName, e);
            return false;
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public void createIndexes() {
        for (String statement : INDEXES) {
            try {
                graph.query(statement);
            } catch (Exception e) {
                // FalkorDB rejects an index that already exists
                log.debug("Index statement skipped: {} - {}", statement, e.getMessage());
            }
        }
        log.info("Indexes ensured for graph {}", graphName);
    }

    @Override
    public void close() {
        try {
            driver.close();
        } catch (Exception e) {
            log.warn("Error closing FalkorDB driver for graph {}", graphName, e);
        }
        log.info("FalkorDB connection closed for graph {}", graphName);
    }
}
