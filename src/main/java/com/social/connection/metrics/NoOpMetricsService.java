package com.social.connection.metrics;

import com.social.connection.core.model.ConnectionStatus;
import com.social.connection.core.model.ConnectionVariant;

import java.time.Duration;

/**
 * Metrics service that discards everything.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void incrementConnectionCreated(ConnectionVariant variant) {
    }

    @Override
    public void incrementTransition(ConnectionVariant variant, ConnectionStatus target) {
    }

    @Override
    public void incrementRelabel(ConnectionVariant variant) {
    }

    @Override
    public void incrementThrottleRejected() {
    }

    @Override
    public void incrementNotificationFailed() {
    }

    @Override
    public void recordOperationDuration(String operation, String outcome, Duration duration) {
    }
}
