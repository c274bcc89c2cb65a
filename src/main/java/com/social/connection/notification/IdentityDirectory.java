package com.social.connection.notification;

import java.util.Optional;

/**
 * Read-only view of user records, used to address and format notifications.
 */
public interface IdentityDirectory {

    Optional<UserProfile> find(String userId);
}
