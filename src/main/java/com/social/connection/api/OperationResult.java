package com.social.connection.api;

import com.social.connection.core.ErrorKind;

import java.util.Objects;

/**
 * Outcome of a {@link ConnectionService} operation.
 *
 * @param success   whether the operation succeeded
 * @param value     result value on success; may be {@code null} for operations without one
 * @param errorKind failure category, {@code null} on success
 * @param message   user-facing message
 * @param <T>       result type
 */
public record OperationResult<T>(boolean success, T value, ErrorKind errorKind, String message) {

    public OperationResult {
        if (success && errorKind != null) {
            throw new IllegalArgumentException("A successful result has no error kind");
        }
        if (!success) {
            Objects.requireNonNull(errorKind, "errorKind is required for a failure");
        }
    }

    public static <T> OperationResult<T> ok(T value, String message) {
        return new OperationResult<>(true, value, null, message);
    }

    public static <T> OperationResult<T> ok(T value) {
        return new OperationResult<>(true, value, null, null);
    }

    public static <T> OperationResult<T> failure(ErrorKind kind, String message) {
        return new OperationResult<>(false, null, kind, message);
    }

    public boolean isFailure() {
        return !success;
    }
}
