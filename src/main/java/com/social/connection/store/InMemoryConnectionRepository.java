package com.social.connection.store;

import com.social.connection.core.model.BucketAssignment;
import com.social.connection.core.model.Connection;
import com.social.connection.core.model.ConnectionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link ConnectionRepository}.
 * Thread-safe via ConcurrentHashMap; each save or delete is atomic.
 */
public class InMemoryConnectionRepository<A extends BucketAssignment> implements ConnectionRepository<A> {
    private static final Logger log = LoggerFactory.getLogger(InMemoryConnectionRepository.class);

    private static final Comparator<Connection<?>> NEWEST_FIRST =
            Comparator.comparing((Connection<?> c) -> c.getCreatedAt()).reversed()
                    .thenComparing(Connection::getId);

    private final Map<String, Connection<A>> connections = new ConcurrentHashMap<>();

    @Override
    public Connection<A> save(Connection<A> connection) {
        connections.put(connection.getId(), connection);
        log.debug("Saved connection {} status={}", connection.getId(), connection.getStatus());
        return connection;
    }

    @Override
    public Optional<Connection<A>> findById(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    @Override
    public boolean delete(String connectionId) {
        boolean removed = connections.remove(connectionId) != null;
        log.debug("Deleted connection {}: {}", connectionId, removed);
        return removed;
    }

    @Override
    public List<Connection<A>> findByParticipant(String userId) {
        return connections.values().stream()
                .filter(c -> c.isParticipant(userId))
                .sorted(NEWEST_FIRST)
                .toList();
    }

    @Override
    public List<Connection<A>> findBetween(String userA, String userB) {
        return connections.values().stream()
                .filter(c -> c.connects(userA, userB))
                .sorted(NEWEST_FIRST)
                .toList();
    }

    @Override
    public long countInitiatedBy(String userId) {
        return connections.values().stream()
                .filter(c -> c.getInitiatorId().equals(userId))
                .count();
    }

    @Override
    public long countByRecipientAndStatus(String userId, ConnectionStatus status) {
        return connections.values().stream()
                .filter(c -> c.getRecipientId().equals(userId) && c.getStatus() == status)
                .count();
    }

    public int size() {
        return connections.size();
    }
}
