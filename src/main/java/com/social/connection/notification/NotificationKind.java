package com.social.connection.notification;

/**
 * Connection events that produce a push notification.
 */
public enum NotificationKind {
    CONNECTION_REQUEST("connection_request"),
    CONNECTION_ACCEPTED("connection_accepted"),
    CONNECTION_REJECTED("connection_rejected");

    private final String type;

    NotificationKind(String type) {
        this.type = type;
    }

    /**
     * Value of the {@code type} field in the notification data.
     */
    public String type() {
        return type;
    }
}
