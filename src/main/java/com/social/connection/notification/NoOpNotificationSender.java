package com.social.connection.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sender used when notifications are switched off. Drops every notification.
 */
public class NoOpNotificationSender implements NotificationSender {
    private static final Logger log = LoggerFactory.getLogger(NoOpNotificationSender.class);

    @Override
    public void send(NotificationKind kind, String targetId, NotificationPayload payload) {
        log.trace("Dropped {} notification for {}", kind, targetId);
    }
}
