package com.social.connection.core.model;

import java.util.Locale;

/**
 * Visibility tier ("circle") of a connection.
 */
public enum BucketType {
    INNER("Inner"),
    OUTER("Outer"),
    UNIVERSAL("Universal");

    private final String label;

    BucketType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Parses a bucket label. Blank input means "no bucket" and yields {@code null}.
     * The legacy spelling {@code Universe} is read as {@link #UNIVERSAL}, and the
     * display forms "Inner Circle" / "Outer Circle" are accepted as well.
     *
     * @throws IllegalArgumentException if the label names no bucket
     */
    public static BucketType parse(String label) {
        if (label == null || label.isBlank()) {
            return null;
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        if (normalized.endsWith(" circle")) {
            normalized = normalized.substring(0, normalized.length() - " circle".length());
        }
        return switch (normalized) {
            case "inner" -> INNER;
            case "outer" -> OUTER;
            case "universal", "universe" -> UNIVERSAL;
            default -> throw new IllegalArgumentException("Unknown bucket type: " + label);
        };
    }
}
