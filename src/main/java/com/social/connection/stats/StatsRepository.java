package com.social.connection.stats;

import java.util.Optional;

/**
 * Storage for {@link UserStats}. Records are created lazily on first write.
 */
public interface StatsRepository {

    Optional<UserStats> find(String userId);

    /**
     * Adds the delta to the user's incremental counters as one atomic write.
     *
     * @return the stats after the update
     */
    UserStats applyDelta(String userId, StatsDelta delta);

    /**
     * Replaces the user's sent and received counters.
     *
     * @return the stats after the update
     */
    UserStats overwriteSentReceived(String userId, long sent, long received);
}
