package com.social.connection.notification;

import com.social.connection.core.model.Connection;
import com.social.connection.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Renders connection events into notifications and hands them to the sender.
 *
 * <p>Every method is best-effort: a missing profile or device token skips the
 * notification, and any failure is logged and counted but never thrown.</p>
 */
public class ConnectionNotifier {
    private static final Logger log = LoggerFactory.getLogger(ConnectionNotifier.class);

    private final IdentityDirectory directory;
    private final NotificationSender sender;
    private final MetricsService metrics;

    public ConnectionNotifier(IdentityDirectory directory, NotificationSender sender, MetricsService metrics) {
        this.directory = directory;
        this.sender = sender;
        this.metrics = metrics;
    }

    /**
     * Tells the recipient that the initiator sent a request.
     */
    public void requestSent(Connection<?> connection) {
        notify(NotificationKind.CONNECTION_REQUEST, connection,
                connection.getInitiatorId(), connection.getRecipientId(),
                "New connection request from %s", "Someone wants to connect with you!");
    }

    /**
     * Tells the initiator that the recipient accepted.
     */
    public void accepted(Connection<?> connection) {
        notify(NotificationKind.CONNECTION_ACCEPTED, connection,
                connection.getRecipientId(), connection.getInitiatorId(),
                "%s accepted your connection request", "You are now connected!");
    }

    /**
     * Tells the initiator that the recipient declined.
     */
    public void rejected(Connection<?> connection) {
        notify(NotificationKind.CONNECTION_REJECTED, connection,
                connection.getRecipientId(), connection.getInitiatorId(),
                "%s declined your connection request", "Your connection request was not accepted");
    }

    private void notify(NotificationKind kind, Connection<?> connection, String actorId, String targetId,
                        String titleTemplate, String body) {
        try {
            Optional<UserProfile> target = directory.find(targetId);
            if (target.isEmpty() || !target.get().hasDeviceToken()) {
                log.debug("Skipping {} notification for {}: no device token", kind, targetId);
                return;
            }
            String actorName = directory.find(actorId).map(UserProfile::nameOrId).orElse(actorId);
            NotificationPayload payload = NotificationPayload.of(kind,
                    String.format(titleTemplate, actorName), body,
                    target.get().deviceToken(), connection.getId());
            sender.send(kind, targetId, payload);
            log.debug("notification.dispatched kind={} connectionId={} targetId={}",
                    kind, connection.getId(), targetId);
        } catch (Exception e) {
            metrics.incrementNotificationFailed();
            log.warn("Failed to send {} notification for connection {}: {}",
                    kind, connection.getId(), e.getMessage());
        }
    }
}
