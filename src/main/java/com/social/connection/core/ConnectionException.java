package com.social.connection.core;

import java.util.Objects;

/**
 * Runtime exception raised inside the engine. Carries an {@link ErrorKind} so the
 * operation boundary can turn it into a structured result without parsing the message.
 */
public class ConnectionException extends RuntimeException {

    private final ErrorKind kind;

    public ConnectionException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind is required");
    }

    public ConnectionException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind is required");
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static ConnectionException notFound(String message) {
        return new ConnectionException(ErrorKind.NOT_FOUND, message);
    }

    public static ConnectionException unauthorized(String message) {
        return new ConnectionException(ErrorKind.UNAUTHORIZED, message);
    }

    public static ConnectionException conflict(String message) {
        return new ConnectionException(ErrorKind.CONFLICT, message);
    }

    public static ConnectionException limitExceeded(String message) {
        return new ConnectionException(ErrorKind.LIMIT_EXCEEDED, message);
    }

    public static ConnectionException invalid(String message) {
        return new ConnectionException(ErrorKind.INVALID_REQUEST, message);
    }

    public static ConnectionException unavailable(String message) {
        return new ConnectionException(ErrorKind.UNAVAILABLE, message);
    }
}
