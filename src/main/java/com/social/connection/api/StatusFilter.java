package com.social.connection.api;

import com.social.connection.core.model.Connection;
import com.social.connection.core.model.ConnectionStatus;

/**
 * Status filter for connection listings, seen from the listing user.
 */
public enum StatusFilter {
    /** Pending requests addressed to the user. */
    RECEIVED,
    /** Pending requests the user sent. */
    SENT,
    ACCEPTED,
    REJECTED,
    CANCELLED;

    public boolean matches(Connection<?> connection, String userId) {
        return switch (this) {
            case RECEIVED -> connection.getStatus().isPending() && connection.getRecipientId().equals(userId);
            case SENT -> connection.getStatus().isPending() && connection.getInitiatorId().equals(userId);
            case ACCEPTED -> connection.getStatus() == ConnectionStatus.ACCEPTED;
            case REJECTED -> connection.getStatus() == ConnectionStatus.REJECTED;
            case CANCELLED -> connection.getStatus() == ConnectionStatus.CANCELLED;
        };
    }
}
