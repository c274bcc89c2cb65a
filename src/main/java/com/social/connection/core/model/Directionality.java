package com.social.connection.core.model;

import java.util.Locale;

/**
 * How a sub-relation label reaches the other participant.
 * A bidirectional label is mirrored through its canonical reverse label
 * (mentor / mentee); a unidirectional label is copied as-is (friend / friend).
 */
public enum Directionality {
    UNIDIRECTIONAL("Unidirectional"),
    BIDIRECTIONAL("Bidirectional");

    private final String label;

    Directionality(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Directionality fromLabel(String label) {
        if (label == null) {
            throw new IllegalArgumentException("Directionality is required");
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        for (Directionality directionality : values()) {
            if (directionality.name().equals(normalized)) {
                return directionality;
            }
        }
        throw new IllegalArgumentException("Unknown directionality: " + label);
    }
}
