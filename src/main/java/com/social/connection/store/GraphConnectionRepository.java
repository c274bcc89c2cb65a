package com.social.connection.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.social.connection.core.model.BucketAssignment;
import com.social.connection.core.model.Connection;
import com.social.connection.core.model.ConnectionStatus;
import com.social.connection.core.model.ConnectionVariant;
import com.social.connection.graph.GraphConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * FalkorDB-backed implementation of {@link ConnectionRepository}.
 *
 * <p>Each connection is a {@code :Connection} node linked to its endpoints:
 * {@code (:User)-[:INITIATED]->(:Connection)-[:RECEIVED_BY]->(:User)}.
 * The assignment is stored as a JSON string property. Nodes carry a {@code variant}
 * property so both variants can share one graph. Timestamps are stored as epoch
 * microseconds so {@code ORDER BY} compares them numerically.</p>
 */
public class GraphConnectionRepository<A extends BucketAssignment> implements ConnectionRepository<A> {
    private static final Logger log = LoggerFactory.getLogger(GraphConnectionRepository.class);

    private static final String RETURN_CONNECTION = """
            RETURN c.id as id, c.initiatorId as initiatorId, c.recipientId as recipientId,
                   c.status as status, c.assignment as assignment,
                   c.createdAt as createdAt, c.updatedAt as updatedAt
            """;

    private final GraphConnection connection;
    private final Class<A> assignmentType;
    private final ConnectionVariant variant;
    private final ObjectMapper objectMapper;

    public GraphConnectionRepository(GraphConnection connection, Class<A> assignmentType,
                                     ConnectionVariant variant) {
        this(connection, assignmentType, variant, new ObjectMapper());
    }

    public GraphConnectionRepository(GraphConnection connection, Class<A> assignmentType,
                                     ConnectionVariant variant, ObjectMapper objectMapper) {
        this.connection = connection;
        this.assignmentType = assignmentType;
        this.variant = variant;
        this.objectMapper = objectMapper;
    }

    @Override
    public Connection<A> save(Connection<A> conn) {
        String query = """
                MERGE (i:User {id: $initiatorId})
                MERGE (r:User {id: $recipientId})
                MERGE (c:Connection {id: $id})
                SET c.variant = $variant,
                    c.initiatorId = $initiatorId,
                    c.recipientId = $recipientId,
                    c.status = $status,
                    c.assignment = $assignment,
                    c.createdAt = $createdAt,
                    c.updatedAt = $updatedAt
                MERGE (i)-[:INITIATED]->(c)
                MERGE (c)-[:RECEIVED_BY]->(r)
                """;
        Map<String, Object> params = new HashMap<>();
        params.put("id", conn.getId());
        params.put("variant", variant.name());
        params.put("initiatorId", conn.getInitiatorId());
        params.put("recipientId", conn.getRecipientId());
        params.put("status", conn.getStatus().name());
        params.put("assignment", serializeAssignment(conn.getAssignment()));
        params.put("createdAt", toEpochMicros(conn.getCreatedAt()));
        params.put("updatedAt", toEpochMicros(conn.getUpdatedAt()));
        connection.execute(query, params);
        log.debug("Saved {} connection {} status={}", variant, conn.getId(), conn.getStatus());
        return conn;
    }

    @Override
    public Optional<Connection<A>> findById(String connectionId) {
        String query = "MATCH (c:Connection {id: $id, variant: $variant})\n" + RETURN_CONNECTION;
        List<Connection<A>> results = mapResults(connection.query(query, Map.of(
                "id", connectionId,
                "variant", variant.name())));
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public boolean delete(String connectionId) {
        String query = """
                MATCH (c:Connection {id: $id, variant: $variant})
                DETACH DELETE c
                RETURN count(c) as cnt
                """;
        List<Map<String, Object>> rows = connection.query(query, Map.of(
                "id", connectionId,
                "variant", variant.name()));
        boolean deleted = !rows.isEmpty() && ((Number) rows.get(0).get("cnt")).longValue() > 0;
        log.debug("Deleted {} connection {}: {}", variant, connectionId, deleted);
        return deleted;
    }

    @Override
    public List<Connection<A>> findByParticipant(String userId) {
        String query = """
                MATCH (c:Connection {variant: $variant})
                WHERE c.initiatorId = $userId OR c.recipientId = $userId
                """ + RETURN_CONNECTION + "ORDER BY c.createdAt DESC";
        return mapResults(connection.query(query, Map.of(
                "variant", variant.name(),
                "userId", userId)));
    }

    @Override
    public List<Connection<A>> findBetween(String userA, String userB) {
        String query = """
                MATCH (c:Connection {variant: $variant})
                WHERE (c.initiatorId = $userA AND c.recipientId = $userB)
                   OR (c.initiatorId = $userB AND c.recipientId = $userA)
                """ + RETURN_CONNECTION + "ORDER BY c.createdAt DESC";
        return mapResults(connection.query(query, Map.of(
                "variant", variant.name(),
                "userA", userA,
                "userB", userB)));
    }

    @Override
    public long countInitiatedBy(String userId) {
        String query = """
                MATCH (c:Connection {variant: $variant, initiatorId: $userId})
                RETURN count(c) as cnt
                """;
        return count(connection.query(query, Map.of(
                "variant", variant.name(),
                "userId", userId)));
    }

    @Override
    public long countByRecipientAndStatus(String userId, ConnectionStatus status) {
        String query = """
                MATCH (c:Connection {variant: $variant, recipientId: $userId, status: $status})
                RETURN count(c) as cnt
                """;
        return count(connection.query(query, Map.of(
                "variant", variant.name(),
                "userId", userId,
                "status", status.name())));
    }

    private long count(List<Map<String, Object>> rows) {
        if (rows.isEmpty()) {
            return 0;
        }
        return ((Number) rows.get(0).get("cnt")).longValue();
    }

    private List<Connection<A>> mapResults(List<Map<String, Object>> rows) {
        return rows.stream().map(this::mapToConnection).toList();
    }

    private Connection<A> mapToConnection(Map<String, Object> row) {
        return Connection.<A>builder()
                .id((String) row.get("id"))
                .initiatorId((String) row.get("initiatorId"))
                .recipientId((String) row.get("recipientId"))
                .status(ConnectionStatus.valueOf((String) row.get("status")))
                .assignment(deserializeAssignment((String) row.get("assignment")))
                .createdAt(toInstant(row.get("createdAt")))
                .updatedAt(toInstant(row.get("updatedAt")))
                .build();
    }

    static long toEpochMicros(Instant instant) {
        return ChronoUnit.MICROS.between(Instant.EPOCH, instant);
    }

    /**
     * Reads a stored timestamp. Nodes written before timestamps became numeric hold ISO-8601 text.
     */
    static Instant toInstant(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number micros) {
            return Instant.EPOCH.plus(micros.longValue(), ChronoUnit.MICROS);
        }
        return Instant.parse(value.toString());
    }

    private String serializeAssignment(A assignment) {
        try {
            return objectMapper.writeValueAsString(assignment);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize assignment of type " + assignmentType.getSimpleName(), e);
        }
    }

    private A deserializeAssignment(String json) {
        try {
            return objectMapper.readValue(json, assignmentType);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize assignment of type " + assignmentType.getSimpleName(), e);
        }
    }
}
