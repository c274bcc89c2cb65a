package com.social.connection.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable wrapper around the SLF4J MDC. Keys added through this context are
 * removed on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forOperation(correlationId, "relabelConnection", connectionId, actorId)) {
 *     log.info("connection.relabelled connectionId={}", connectionId);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for one boundary operation. Null ids are left out.
     */
    public static LogContext forOperation(String correlationId, String operation,
                                          String connectionId, String actorId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("operation", operation);
        ctx.put("connectionId", connectionId);
        ctx.put("actorId", actorId);
        return ctx;
    }

    /**
     * Context for taxonomy seeding.
     */
    public static LogContext forSeed(String correlationId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("operation", "seed");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (value == null) {
            return;
        }
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
