package com.social.connection.notification;

import java.util.Objects;

/**
 * What the notifier needs to know about a user.
 *
 * @param userId      user id
 * @param displayName name shown in notification titles
 * @param deviceToken push token, {@code null} when the user has no registered device
 */
public record UserProfile(String userId, String displayName, String deviceToken) {

    public UserProfile {
        Objects.requireNonNull(userId, "userId is required");
    }

    public boolean hasDeviceToken() {
        return deviceToken != null && !deviceToken.isBlank();
    }

    public String nameOrId() {
        return displayName != null && !displayName.isBlank() ? displayName : userId;
    }
}
