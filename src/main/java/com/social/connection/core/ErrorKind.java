package com.social.connection.core;

/**
 * Machine-readable failure category returned at the operation boundary.
 */
public enum ErrorKind {
    /** Connection, user or sub-relation rule does not exist. */
    NOT_FOUND,
    /** Actor is not a legitimate party to the action. */
    UNAUTHORIZED,
    /** Duplicate pending/accepted connection, or transition on a finished connection. */
    CONFLICT,
    /** Relabel throttle exhausted. */
    LIMIT_EXCEEDED,
    /** Missing or ill-formed input. */
    INVALID_REQUEST,
    /** Operation switched off by configuration. */
    UNAVAILABLE,
    /** Unexpected storage or collaborator failure. */
    INTERNAL
}
