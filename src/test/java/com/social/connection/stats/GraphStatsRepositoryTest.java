package com.social.connection.stats;

import com.social.connection.core.model.BucketType;
import com.social.connection.graph.StubGraphConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GraphStatsRepository Tests")
class GraphStatsRepositoryTest {

    private StubGraphConnection graph;
    private GraphStatsRepository repository;

    @BeforeEach
    void setUp() {
        graph = new StubGraphConnection();
        repository = new GraphStatsRepository(graph);
    }

    private static Map<String, Object> row(long accepted, long inner) {
        Map<String, Object> row = new HashMap<>();
        row.put("userId", "bob");
        row.put("sentCount", 2L);
        row.put("receivedCount", 1L);
        row.put("acceptedCount", accepted);
        row.put("rejectedCount", 0L);
        row.put("innerCount", inner);
        row.put("outerCount", 0L);
        row.put("universalCount", 0L);
        return row;
    }

    @Test
    @DisplayName("Delta is one MERGE with additive SET")
    void applyDelta() {
        graph.queryResults = List.of(row(1, 1));

        UserStats stats = repository.applyDelta("bob", StatsDelta.accepted().plus(StatsDelta.bucket(BucketType.INNER, 1)));

        assertEquals(1, graph.executedQueries.size());
        assertTrue(graph.lastQuery().contains("MERGE (s:UserStats {userId: $userId})"));
        assertTrue(graph.lastQuery().contains("s.acceptedCount = s.acceptedCount + $accepted"));
        assertEquals(1, graph.lastParams().get("accepted"));
        assertEquals(1, stats.acceptedCount());
        assertEquals(2, stats.sentCount());
    }

    @Test
    @DisplayName("Overwrite sets sent and received")
    void overwrite() {
        repository.overwriteSentReceived("bob", 4, 3);

        assertTrue(graph.lastQuery().contains("SET s.sentCount = $sent, s.receivedCount = $received"));
        assertEquals(4L, graph.lastParams().get("sent"));
    }

    @Test
    @DisplayName("Missing record is empty")
    void findMissing() {
        assertTrue(repository.find("bob").isEmpty());
    }

    @Test
    @DisplayName("Without a returned row the delta is applied to zeros")
    void fallback() {
        UserStats stats = repository.applyDelta("bob", StatsDelta.rejected());

        assertEquals(1, stats.rejectedCount());
        assertEquals(0, stats.acceptedCount());
    }
}
