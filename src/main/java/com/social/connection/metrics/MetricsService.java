package com.social.connection.metrics;

import com.social.connection.core.model.ConnectionStatus;
import com.social.connection.core.model.ConnectionVariant;

import java.time.Duration;

/**
 * Interface for recording connection engine metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without a meter registry.
 */
public interface MetricsService {

    void incrementConnectionCreated(ConnectionVariant variant);

    void incrementTransition(ConnectionVariant variant, ConnectionStatus target);

    void incrementRelabel(ConnectionVariant variant);

    void incrementThrottleRejected();

    void incrementNotificationFailed();

    /**
     * @param operation operation name, e.g. "createConnection"
     * @param outcome   "success" or the lower-cased error kind
     */
    void recordOperationDuration(String operation, String outcome, Duration duration);
}
