package com.social.connection.notification;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Body posted to the notification service.
 *
 * @param title       headline shown to the user
 * @param body        secondary text
 * @param token       target device token
 * @param priority    delivery priority, always "high" for connection events
 * @param clickAction in-app route opened on tap
 * @param data        machine-readable fields: connection_id and type
 */
public record NotificationPayload(String title,
                                  String body,
                                  String token,
                                  String priority,
                                  @JsonProperty("click_action") String clickAction,
                                  Map<String, String> data) {

    public NotificationPayload {
        data = data != null ? Map.copyOf(data) : Map.of();
    }

    public static NotificationPayload of(NotificationKind kind, String title, String body,
                                         String deviceToken, String connectionId) {
        return new NotificationPayload(title, body, deviceToken, "high",
                "/connection/" + connectionId,
                Map.of("connection_id", connectionId, "type", kind.type()));
    }
}
