package com.social.connection.engine;

import com.social.connection.core.ConnectionException;
import com.social.connection.core.ConnectionMessages;
import com.social.connection.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Caps how often one participant may change its sub-relation on one connection.
 * A limit of 5 lets counts 0 through 4 through, so the sixth attempt fails.
 */
public class ModificationThrottle {
    private static final Logger log = LoggerFactory.getLogger(ModificationThrottle.class);

    private final int maxModifications;
    private final MetricsService metrics;

    public ModificationThrottle(int maxModifications, MetricsService metrics) {
        if (maxModifications < 0) {
            throw new IllegalArgumentException("maxModifications must be >= 0");
        }
        this.maxModifications = maxModifications;
        this.metrics = metrics;
    }

    public boolean allows(int currentCount) {
        return currentCount < maxModifications;
    }

    /**
     * @throws ConnectionException LIMIT_EXCEEDED once the participant has used up its relabels
     */
    public void check(String connectionId, String participantId, int currentCount) {
        if (!allows(currentCount)) {
            metrics.incrementThrottleRejected();
            log.info("connection.throttled connectionId={} participantId={} count={} max={}",
                    connectionId, participantId, currentCount, maxModifications);
            throw ConnectionException.limitExceeded(ConnectionMessages.MODIFICATION_LIMIT);
        }
    }

    public int getMaxModifications() {
        return maxModifications;
    }
}
