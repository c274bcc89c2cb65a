package com.social.connection.api;

import com.social.connection.core.ConnectionException;

/**
 * Input checks applied at the {@link ConnectionService} boundary.
 * Failures raise {@link ConnectionException} with kind INVALID_REQUEST.
 */
public final class RequestValidator {

    public static final int MAX_ID_LENGTH = 128;

    public static final int MAX_LABEL_LENGTH = 200;

    private RequestValidator() {
    }

    /**
     * Rejects null, blank, overly long or control-character ids.
     */
    public static String requireId(String field, String value) {
        requireText(field, value, MAX_ID_LENGTH);
        return value.trim();
    }

    /**
     * Rejects null, blank, overly long or control-character labels.
     */
    public static String requireLabel(String field, String value) {
        requireText(field, value, MAX_LABEL_LENGTH);
        return value.trim();
    }

    /**
     * Like {@link #requireLabel} but lets {@code null} and blank through as {@code null}.
     */
    public static String optionalLabel(String field, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return requireLabel(field, value);
    }

    public static <T> T requireValue(String field, T value) {
        if (value == null) {
            throw ConnectionException.invalid(field + " is required");
        }
        return value;
    }

    private static void requireText(String field, String value, int maxLength) {
        if (value == null || value.isBlank()) {
            throw ConnectionException.invalid(field + " must not be null or blank");
        }
        if (value.length() > maxLength) {
            throw ConnectionException.invalid(field + " exceeds maximum length of " + maxLength
                    + " characters (was " + value.length() + ")");
        }
        if (containsControlCharacters(value)) {
            throw ConnectionException.invalid(field + " must not contain control characters");
        }
    }

    private static boolean containsControlCharacters(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < 0x20 || c == 0x7F) {
                return true;
            }
        }
        return false;
    }
}
