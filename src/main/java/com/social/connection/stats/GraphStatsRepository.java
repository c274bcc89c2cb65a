package com.social.connection.stats;

import com.social.connection.graph.GraphConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Graph-backed implementation of {@link StatsRepository}.
 * Stats live on {@code (:UserStats {userId})} nodes; each write is one
 * {@code MERGE ... SET} statement so concurrent deltas do not overwrite each other.
 */
public class GraphStatsRepository implements StatsRepository {
    private static final Logger log = LoggerFactory.getLogger(GraphStatsRepository.class);

    private static final String RETURN_STATS = """
            RETURN s.userId as userId, s.sentCount as sentCount, s.receivedCount as receivedCount,
                   s.acceptedCount as acceptedCount, s.rejectedCount as rejectedCount,
                   s.innerCount as innerCount, s.outerCount as outerCount,
                   s.universalCount as universalCount
            """;

    private static final String MERGE_STATS = """
            MERGE (s:UserStats {userId: $userId})
            ON CREATE SET s.sentCount = 0, s.receivedCount = 0, s.acceptedCount = 0,
                          s.rejectedCount = 0, s.innerCount = 0, s.outerCount = 0,
                          s.universalCount = 0
            """;

    private final GraphConnection connection;

    public GraphStatsRepository(GraphConnection connection) {
        this.connection = connection;
    }

    @Override
    public Optional<UserStats> find(String userId) {
        List<Map<String, Object>> rows = connection.query(
                "MATCH (s:UserStats {userId: $userId})\n" + RETURN_STATS,
                Map.of("userId", userId));
        return rows.isEmpty() ? Optional.empty() : Optional.of(mapToStats(rows.get(0)));
    }

    @Override
    public UserStats applyDelta(String userId, StatsDelta delta) {
        String query = MERGE_STATS + """
                SET s.acceptedCount = s.acceptedCount + $accepted,
                    s.rejectedCount = s.rejectedCount + $rejected,
                    s.innerCount = s.innerCount + $inner,
                    s.outerCount = s.outerCount + $outer,
                    s.universalCount = s.universalCount + $universal
                """ + RETURN_STATS;
        List<Map<String, Object>> rows = connection.query(query, Map.of(
                "userId", userId,
                "accepted", delta.accepted(),
                "rejected", delta.rejected(),
                "inner", delta.inner(),
                "outer", delta.outer(),
                "universal", delta.universal()
        ));
        log.debug("Applied stats delta {} to {}", delta, userId);
        return rows.isEmpty() ? UserStats.empty(userId).plus(delta) : mapToStats(rows.get(0));
    }

    @Override
    public UserStats overwriteSentReceived(String userId, long sent, long received) {
        String query = MERGE_STATS + """
                SET s.sentCount = $sent, s.receivedCount = $received
                """ + RETURN_STATS;
        List<Map<String, Object>> rows = connection.query(query, Map.of(
                "userId", userId,
                "sent", sent,
                "received", received
        ));
        log.debug("Refreshed sent/received for {}: sent={} received={}", userId, sent, received);
        return rows.isEmpty() ? UserStats.empty(userId).withSentReceived(sent, received) : mapToStats(rows.get(0));
    }

    private UserStats mapToStats(Map<String, Object> row) {
        return new UserStats(
                (String) row.get("userId"),
                asLong(row.get("sentCount")),
                asLong(row.get("receivedCount")),
                asLong(row.get("acceptedCount")),
                asLong(row.get("rejectedCount")),
                asLong(row.get("innerCount")),
                asLong(row.get("outerCount")),
                asLong(row.get("universalCount")));
    }

    private static long asLong(Object value) {
        return value instanceof Number n ? n.longValue() : 0L;
    }
}
