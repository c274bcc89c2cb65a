package com.social.connection.cache;

import java.time.Duration;

/**
 * Sizing of the taxonomy lookup cache. A disabled config makes the graph builder
 * skip the caching decorator entirely, so its size and ttl are never read.
 *
 * @param maxSize    cached rule lookups kept before eviction
 * @param ttlSeconds seconds a lookup stays cached after it is loaded
 * @param enabled    false to query the taxonomy store directly
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CacheConfig {
        if (enabled && maxSize <= 0) {
            throw new IllegalArgumentException("Cache maxSize must be positive, got " + maxSize);
        }
        if (enabled && ttlSeconds <= 0) {
            throw new IllegalArgumentException("Cache ttlSeconds must be positive, got " + ttlSeconds);
        }
    }

    public Duration ttl() {
        return Duration.ofSeconds(ttlSeconds);
    }

    /**
     * 1,000 lookups for ten minutes. The taxonomy holds about a hundred rules and
     * only changes when it is re-seeded.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(1_000, 600, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(0, 0, false);
    }
}
