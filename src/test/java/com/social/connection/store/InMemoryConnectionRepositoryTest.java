package com.social.connection.store;

import com.social.connection.core.model.BucketType;
import com.social.connection.core.model.Connection;
import com.social.connection.core.model.ConnectionStatus;
import com.social.connection.core.model.SharedAssignment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryConnectionRepository Tests")
class InMemoryConnectionRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-01-15T10:00:00Z");

    private InMemoryConnectionRepository<SharedAssignment> repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryConnectionRepository<>();
    }

    private Connection<SharedAssignment> save(String id, String from, String to, ConnectionStatus status, int minute) {
        return repository.save(Connection.<SharedAssignment>builder()
                .id(id)
                .initiatorId(from)
                .recipientId(to)
                .status(status)
                .assignment(new SharedAssignment(BucketType.INNER, "Friend", "friend"))
                .createdAt(T0.plusSeconds(60L * minute))
                .build());
    }

    @Test
    @DisplayName("Save replaces the connection with the same id")
    void saveReplaces() {
        Connection<SharedAssignment> c = save("c-1", "alice", "bob", ConnectionStatus.RECEIVED, 0);

        repository.save(c.withStatus(ConnectionStatus.ACCEPTED));

        assertEquals(1, repository.size());
        assertEquals(ConnectionStatus.ACCEPTED, repository.findById("c-1").orElseThrow().getStatus());
    }

    @Test
    @DisplayName("Participant and pair queries return newest first")
    void queries() {
        save("c-1", "alice", "bob", ConnectionStatus.REJECTED, 0);
        save("c-2", "bob", "alice", ConnectionStatus.RECEIVED, 1);
        save("c-3", "carol", "alice", ConnectionStatus.ACCEPTED, 2);

        assertEquals(List.of("c-3", "c-2", "c-1"),
                repository.findByParticipant("alice").stream().map(Connection::getId).toList());
        assertEquals(List.of("c-2", "c-1"),
                repository.findBetween("alice", "bob").stream().map(Connection::getId).toList());
        assertTrue(repository.findBetween("bob", "carol").isEmpty());
    }

    @Test
    @DisplayName("Counts use initiator and recipient status")
    void counts() {
        save("c-1", "alice", "bob", ConnectionStatus.RECEIVED, 0);
        save("c-2", "alice", "carol", ConnectionStatus.ACCEPTED, 1);
        save("c-3", "carol", "bob", ConnectionStatus.RECEIVED, 2);

        assertEquals(2, repository.countInitiatedBy("alice"));
        assertEquals(2, repository.countByRecipientAndStatus("bob", ConnectionStatus.RECEIVED));
        assertEquals(0, repository.countByRecipientAndStatus("carol", ConnectionStatus.RECEIVED));
    }

    @Test
    @DisplayName("Delete reports whether something was removed")
    void delete() {
        save("c-1", "alice", "bob", ConnectionStatus.RECEIVED, 0);

        assertTrue(repository.delete("c-1"));
        assertFalse(repository.delete("c-1"));
        assertTrue(repository.findById("c-1").isEmpty());
    }
}
