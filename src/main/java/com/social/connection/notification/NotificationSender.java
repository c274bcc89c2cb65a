package com.social.connection.notification;

/**
 * Fire-and-forget delivery of push notifications. Implementations must not block
 * on delivery and must not report delivery failures to the caller.
 */
public interface NotificationSender {

    /**
     * @param kind     the connection event
     * @param targetId user the notification is for
     * @param payload  rendered notification
     */
    void send(NotificationKind kind, String targetId, NotificationPayload payload);
}
