package com.social.connection.stats;

import com.social.connection.core.model.ConnectionStatus;
import com.social.connection.store.ConnectionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Maintains {@link UserStats}.
 *
 * <p>Sent and received counts are recomputed from every registered connection
 * repository, so both variants contribute. Accepted, rejected and bucket counts move
 * only through {@link #apply(String, StatsDelta)}.</p>
 */
public class StatsAggregator {
    private static final Logger log = LoggerFactory.getLogger(StatsAggregator.class);

    private final StatsRepository repository;
    private final List<ConnectionRepository<?>> sources;

    public StatsAggregator(StatsRepository repository, List<ConnectionRepository<?>> sources) {
        this.repository = Objects.requireNonNull(repository, "repository is required");
        this.sources = List.copyOf(sources);
    }

    /**
     * Recomputes and overwrites the user's sent and received counts.
     * Calling it twice in a row yields the same values.
     */
    public UserStats refreshSentReceived(String userId) {
        long sent = 0;
        long received = 0;
        for (ConnectionRepository<?> source : sources) {
            sent += source.countInitiatedBy(userId);
            received += source.countByRecipientAndStatus(userId, ConnectionStatus.RECEIVED);
        }
        UserStats stats = repository.overwriteSentReceived(userId, sent, received);
        log.debug("stats.refreshed userId={} sent={} received={}", userId, sent, received);
        return stats;
    }

    /**
     * Applies a delta to one user's incremental counters. Empty deltas are skipped.
     */
    public UserStats apply(String userId, StatsDelta delta) {
        if (delta.isEmpty()) {
            return stats(userId);
        }
        UserStats stats = repository.applyDelta(userId, delta);
        log.debug("stats.delta userId={} delta={}", userId, delta);
        return stats;
    }

    /**
     * Stored snapshot, or all zeros when the user has none yet.
     */
    public UserStats stats(String userId) {
        return repository.find(userId).orElseGet(() -> UserStats.empty(userId));
    }
}
