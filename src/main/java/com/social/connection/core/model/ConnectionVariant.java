package com.social.connection.core.model;

/**
 * Storage variant of a connection.
 */
public enum ConnectionVariant {
    /** One bucket assignment shared by both endpoints. */
    SHARED,
    /** Per-participant sub-relation and bucket. */
    PARTICIPANT
}
