package com.social.connection.engine;

import com.social.connection.core.model.BucketAssignment;
import com.social.connection.core.model.Connection;
import com.social.connection.core.model.ConnectionStatus;
import com.social.connection.core.model.ConnectionVariant;
import com.social.connection.stats.StatsDelta;

import java.util.Map;

/**
 * Variant-specific part of the connection lifecycle. {@link ConnectionEngine} owns
 * loading, authorization and persistence; the strategy decides how a connection is
 * classified and what each change does to user stats.
 *
 * @param <A> assignment type
 * @param <C> create request type
 * @param <R> relabel request type
 */
public interface AssignmentStrategy<A extends BucketAssignment, C, R> {

    ConnectionVariant variant();

    /**
     * Builds the assignment of a new connection.
     */
    A initialAssignment(String initiatorId, String recipientId, C request);

    /**
     * Counter changes per user for moving {@code connection} to {@code target}.
     */
    Map<String, StatsDelta> transitionDeltas(Connection<A> connection, ConnectionStatus target);

    /**
     * Applies a relabel by {@code actorId}, an endpoint of an accepted connection.
     */
    RelabelOutcome<A> relabel(Connection<A> connection, String actorId, R request);
}
