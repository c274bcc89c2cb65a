package com.social.connection.store;

import com.social.connection.core.model.BucketAssignment;
import com.social.connection.core.model.Connection;
import com.social.connection.core.model.ConnectionStatus;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for one connection variant. A connection and its assignment are
 * stored and deleted together.
 *
 * @param <A> the assignment variant this repository holds
 */
public interface ConnectionRepository<A extends BucketAssignment> {

    /**
     * Inserts or replaces the connection with the same id.
     */
    Connection<A> save(Connection<A> connection);

    Optional<Connection<A>> findById(String connectionId);

    /**
     * Removes the connection and its assignment.
     *
     * @return true if something was deleted
     */
    boolean delete(String connectionId);

    /**
     * Connections where the user is initiator or recipient, newest first.
     */
    List<Connection<A>> findByParticipant(String userId);

    /**
     * Connections joining the two users in either direction, newest first.
     */
    List<Connection<A>> findBetween(String userA, String userB);

    /**
     * Number of connections the user initiated, any status.
     */
    long countInitiatedBy(String userId);

    long countByRecipientAndStatus(String userId, ConnectionStatus status);
}
