package com.social.connection.metrics;

import com.social.connection.core.model.ConnectionStatus;
import com.social.connection.core.model.ConnectionVariant;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code connection.created} Counter (tag: variant)</li>
 *   <li>{@code connection.transition} Counter (tags: variant, status)</li>
 *   <li>{@code connection.relabel} Counter (tag: variant)</li>
 *   <li>{@code connection.throttle.rejected} Counter</li>
 *   <li>{@code connection.notification.failed} Counter</li>
 *   <li>{@code connection.operation.duration} Timer (tags: operation, outcome)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter throttleRejectedCounter;
    private final Counter notificationFailedCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.throttleRejectedCounter = Counter.builder("connection.throttle.rejected")
                .description("Relabels rejected by the modification limit")
                .register(registry);
        this.notificationFailedCounter = Counter.builder("connection.notification.failed")
                .description("Notifications that could not be dispatched")
                .register(registry);
    }

    @Override
    public void incrementConnectionCreated(ConnectionVariant variant) {
        counterCache.computeIfAbsent("created:" + variant.name(), k ->
                Counter.builder("connection.created")
                        .description("Number of connection requests created")
                        .tag("variant", variant.name())
                        .register(registry))
                .increment();
    }

    @Override
    public void incrementTransition(ConnectionVariant variant, ConnectionStatus target) {
        counterCache.computeIfAbsent("transition:" + variant.name() + ":" + target.name(), k ->
                Counter.builder("connection.transition")
                        .description("Number of status transitions")
                        .tag("variant", variant.name())
                        .tag("status", target.name())
                        .register(registry))
                .increment();
    }

    @Override
    public void incrementRelabel(ConnectionVariant variant) {
        counterCache.computeIfAbsent("relabel:" + variant.name(), k ->
                Counter.builder("connection.relabel")
                        .description("Number of successful relabels")
                        .tag("variant", variant.name())
                        .register(registry))
                .increment();
    }

    @Override
    public void incrementThrottleRejected() {
        throttleRejectedCounter.increment();
    }

    @Override
    public void incrementNotificationFailed() {
        notificationFailedCounter.increment();
    }

    @Override
    public void recordOperationDuration(String operation, String outcome, Duration duration) {
        String key = operation + ":" + outcome;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("connection.operation.duration")
                        .description("Duration of connection operations")
                        .tag("operation", operation)
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }
}
