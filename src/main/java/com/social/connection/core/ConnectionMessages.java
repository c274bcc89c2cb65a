package com.social.connection.core;

/**
 * User-facing messages returned with operation results.
 */
public final class ConnectionMessages {

    public static final String CONNECTION_CREATED = "Connection request sent successfully.";
    public static final String CONNECTION_UPDATED = "Connection updated successfully.";
    public static final String CONNECTION_DELETED = "Connection deleted successfully.";
    public static final String CONNECTION_RELABELLED = "You have updated the connection successfully.";
    public static final String ALREADY_SENT = "Connection already sent.";
    public static final String ALREADY_CONNECTED = "Connection already exists.";
    public static final String ALREADY_ACCEPTED = "You have already accepted the connection.";
    public static final String NOT_PENDING = "Connection is no longer pending.";
    public static final String NOT_ACCEPTED = "Connection has not been accepted yet.";
    public static final String NOT_AUTHORIZED = "You are not authorized to update this connection.";
    public static final String MODIFICATION_LIMIT = "You have reached the maximum modification count for this relation.";
    public static final String V2_DISABLED = "This feature is not yet available.";
    public static final String CONNECTION_NOT_FOUND = "Connection not found: ";
    public static final String SUB_RELATION_NOT_FOUND = "Sub-relation not found: ";
    public static final String SELF_CONNECTION = "You cannot connect with yourself.";
    public static final String INTERNAL_ERROR = "Unexpected error while processing the connection.";

    private ConnectionMessages() {
    }
}
