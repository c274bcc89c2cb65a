package com.social.connection.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CacheConfigTest {

    @Test
    @DisplayName("Defaults cache a thousand lookups for ten minutes")
    void defaults() {
        CacheConfig config = CacheConfig.defaults();
        assertTrue(config.enabled());
        assertEquals(1_000, config.maxSize());
        assertEquals(Duration.ofMinutes(10), config.ttl());
    }

    @Test
    @DisplayName("Disabled config skips size validation")
    void disabledSkipsValidation() {
        CacheConfig config = CacheConfig.disabled();
        assertFalse(config.enabled());
        assertDoesNotThrow(() -> new CacheConfig(0, -1, false));
    }

    @Test
    @DisplayName("Enabled config rejects non-positive size or ttl")
    void enabledRejectsBadValues() {
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, 60, true));
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, 0, true));
    }
}
