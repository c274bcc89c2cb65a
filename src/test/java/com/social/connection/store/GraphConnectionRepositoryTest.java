package com.social.connection.store;

import com.social.connection.core.model.BucketType;
import com.social.connection.core.model.Connection;
import com.social.connection.core.model.ConnectionStatus;
import com.social.connection.core.model.ConnectionVariant;
import com.social.connection.core.model.Directionality;
import com.social.connection.core.model.ParticipantAssignment;
import com.social.connection.core.model.ParticipantState;
import com.social.connection.graph.StubGraphConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GraphConnectionRepository Tests")
class GraphConnectionRepositoryTest {

    private StubGraphConnection graph;
    private GraphConnectionRepository<ParticipantAssignment> repository;

    @BeforeEach
    void setUp() {
        graph = new StubGraphConnection();
        repository = new GraphConnectionRepository<>(graph, ParticipantAssignment.class, ConnectionVariant.PARTICIPANT);
    }

    private static Connection<ParticipantAssignment> mentorship() {
        return Connection.<ParticipantAssignment>builder()
                .id("c-1")
                .initiatorId("alice")
                .recipientId("bob")
                .status(ConnectionStatus.ACCEPTED)
                .assignment(ParticipantAssignment.of("Mentor", Directionality.BIDIRECTIONAL,
                        "alice", new ParticipantState("Mentor", BucketType.UNIVERSAL, 2),
                        "bob", ParticipantState.initial("Mentee", null)))
                .createdAt(Instant.parse("2024-01-15T10:30:00Z"))
                .build();
    }

    @Test
    @DisplayName("Save merges endpoints and writes the assignment as JSON")
    void save() {
        repository.save(mentorship());

        String query = graph.lastQuery();
        assertTrue(query.contains("MERGE (c:Connection {id: $id})"));
        assertTrue(query.contains("MERGE (i)-[:INITIATED]->(c)"));
        Map<String, Object> params = graph.lastParams();
        assertEquals("PARTICIPANT", params.get("variant"));
        assertEquals("ACCEPTED", params.get("status"));
        assertEquals(1_705_314_600_000_000L, params.get("createdAt"));
        assertTrue(((String) params.get("assignment")).contains("\"Mentee\""));
    }

    @Test
    @DisplayName("A saved row reads back as an equal connection and assignment")
    void readBack() {
        repository.save(mentorship());
        Map<String, Object> saved = graph.lastParams();
        Map<String, Object> row = new HashMap<>(saved);
        graph.queryResults = List.of(row);

        Connection<ParticipantAssignment> loaded = repository.findById("c-1").orElseThrow();

        assertEquals(mentorship().getAssignment(), loaded.getAssignment());
        assertEquals(ConnectionStatus.ACCEPTED, loaded.getStatus());
        assertEquals(2, loaded.getAssignment().modificationCountOf("alice"));
        assertNull(loaded.getAssignment().bucketFor("bob"));
        assertEquals(Instant.parse("2024-01-15T10:30:00Z"), loaded.getCreatedAt());
        assertEquals("PARTICIPANT", graph.lastParams().get("variant"));
    }

    @Test
    @DisplayName("Timestamps order numerically whatever their fraction digits")
    void timestampsOrderNumerically() {
        Instant whole = Instant.parse("2024-01-15T10:30:00Z");
        Instant half = Instant.parse("2024-01-15T10:30:00.5Z");
        Instant millis = Instant.parse("2024-01-15T10:30:00.120Z");
        Instant micros = Instant.parse("2024-01-15T10:30:00.120500Z");

        assertTrue(GraphConnectionRepository.toEpochMicros(whole) < GraphConnectionRepository.toEpochMicros(millis));
        assertTrue(GraphConnectionRepository.toEpochMicros(millis) < GraphConnectionRepository.toEpochMicros(micros));
        assertTrue(GraphConnectionRepository.toEpochMicros(micros) < GraphConnectionRepository.toEpochMicros(half));
        assertEquals(micros, GraphConnectionRepository.toInstant(GraphConnectionRepository.toEpochMicros(micros)));
    }

    @Test
    @DisplayName("ISO text timestamps from older nodes still read back")
    void legacyTextTimestamp() {
        repository.save(mentorship());
        Map<String, Object> row = new HashMap<>(graph.lastParams());
        row.put("createdAt", "2024-01-15T10:30:00Z");
        graph.queryResults = List.of(row);

        assertEquals(Instant.parse("2024-01-15T10:30:00Z"), repository.findById("c-1").orElseThrow().getCreatedAt());
        assertNull(GraphConnectionRepository.toInstant(null));
    }

    @Test
    @DisplayName("Listings sort by the numeric creation time")
    void listingOrder() {
        repository.findByParticipant("alice");
        assertTrue(graph.lastQuery().contains("ORDER BY c.createdAt DESC"));
    }

    @Test
    @DisplayName("Delete reports the deleted count")
    void delete() {
        graph.queryResults = List.of(Map.of("cnt", 1L));
        assertTrue(repository.delete("c-1"));
        assertTrue(graph.lastQuery().contains("DETACH DELETE c"));

        graph.queryResults = List.of(Map.of("cnt", 0L));
        assertFalse(repository.delete("c-1"));
    }

    @Test
    @DisplayName("Pair query matches both directions")
    void between() {
        repository.findBetween("alice", "bob");

        assertTrue(graph.lastQuery().contains("OR (c.initiatorId = $userB AND c.recipientId = $userA)"));
        assertEquals("alice", graph.lastParams().get("userA"));
    }

    @Test
    @DisplayName("Counts read the cnt column and default to zero")
    void counts() {
        graph.queryResults = List.of(Map.of("cnt", 3L));
        assertEquals(3, repository.countByRecipientAndStatus("bob", ConnectionStatus.RECEIVED));
        assertEquals("RECEIVED", graph.lastParams().get("status"));

        graph.queryResults = List.of();
        assertEquals(0, repository.countInitiatedBy("alice"));
    }
}
