package com.social.connection.notification;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed {@link IdentityDirectory} for tests and embedded use.
 */
public class InMemoryIdentityDirectory implements IdentityDirectory {

    private final Map<String, UserProfile> profiles = new ConcurrentHashMap<>();

    public InMemoryIdentityDirectory register(UserProfile profile) {
        profiles.put(profile.userId(), profile);
        return this;
    }

    @Override
    public Optional<UserProfile> find(String userId) {
        return Optional.ofNullable(profiles.get(userId));
    }
}
