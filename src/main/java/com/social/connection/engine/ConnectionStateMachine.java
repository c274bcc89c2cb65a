package com.social.connection.engine;

import com.social.connection.core.ConnectionException;
import com.social.connection.core.ConnectionMessages;
import com.social.connection.core.model.Connection;
import com.social.connection.core.model.ConnectionStatus;

/**
 * Request lifecycle: {@code RECEIVED -> ACCEPTED | REJECTED | CANCELLED}.
 *
 * <p>Only the initiator may cancel; only the recipient may accept or reject. The three
 * target states are final, and an accepted connection answers every further
 * transition with a conflict.</p>
 */
public class ConnectionStateMachine {

    /**
     * Checks that {@code actorId} may move {@code connection} to {@code target}.
     *
     * @throws ConnectionException INVALID_REQUEST for a target of RECEIVED,
     *                             UNAUTHORIZED for a non-endpoint or the wrong endpoint,
     *                             CONFLICT when the connection is no longer pending
     */
    public void validate(Connection<?> connection, String actorId, ConnectionStatus target) {
        if (target == null || target == ConnectionStatus.RECEIVED) {
            throw ConnectionException.invalid("Target status must be Accepted, Rejected or Cancelled");
        }
        if (!connection.isParticipant(actorId)) {
            throw ConnectionException.unauthorized(ConnectionMessages.NOT_AUTHORIZED);
        }
        if (connection.getStatus() == ConnectionStatus.ACCEPTED) {
            throw ConnectionException.conflict(ConnectionMessages.ALREADY_ACCEPTED);
        }
        if (!connection.getStatus().isPending()) {
            throw ConnectionException.conflict(ConnectionMessages.NOT_PENDING);
        }
        if (!isAllowedActor(connection, actorId, target)) {
            throw ConnectionException.unauthorized(ConnectionMessages.NOT_AUTHORIZED);
        }
    }

    /**
     * Checks that {@code actorId} may relabel {@code connection}: it must be accepted
     * and the actor must be one of its endpoints.
     */
    public void validateRelabel(Connection<?> connection, String actorId) {
        if (connection.getStatus() != ConnectionStatus.ACCEPTED) {
            throw ConnectionException.conflict(ConnectionMessages.NOT_ACCEPTED);
        }
        if (!connection.isParticipant(actorId)) {
            throw ConnectionException.unauthorized(ConnectionMessages.NOT_AUTHORIZED);
        }
    }

    private boolean isAllowedActor(Connection<?> connection, String actorId, ConnectionStatus target) {
        return switch (target) {
            case CANCELLED -> connection.getInitiatorId().equals(actorId);
            case ACCEPTED, REJECTED -> connection.getRecipientId().equals(actorId);
            case RECEIVED -> false;
        };
    }
}
