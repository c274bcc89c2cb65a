package com.social.connection.core.model;

import java.util.Locale;

/**
 * Lifecycle status of a connection.
 * Every connection starts as {@link #RECEIVED}; the other three states are reached
 * through a single transition.
 */
public enum ConnectionStatus {
    RECEIVED("Received"),
    ACCEPTED("Accepted"),
    REJECTED("Rejected"),
    CANCELLED("Cancelled");

    private final String label;

    ConnectionStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isPending() {
        return this == RECEIVED;
    }

    /**
     * Parses a status label, ignoring case ("Accepted", "ACCEPTED" and "accepted" are equal).
     *
     * @throws IllegalArgumentException if the label names no status
     */
    public static ConnectionStatus fromLabel(String label) {
        if (label == null) {
            throw new IllegalArgumentException("Connection status is required");
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        for (ConnectionStatus status : values()) {
            if (status.name().equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown connection status: " + label);
    }
}
