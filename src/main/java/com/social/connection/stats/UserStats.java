package com.social.connection.stats;

import com.social.connection.core.model.BucketType;

import java.util.Objects;

/**
 * Per-user connection counters.
 *
 * <p>{@code sentCount} and {@code receivedCount} are recomputed from stored connections;
 * the other counters are maintained through {@link StatsDelta}s.</p>
 */
public record UserStats(String userId,
                        long sentCount,
                        long receivedCount,
                        long acceptedCount,
                        long rejectedCount,
                        long innerCount,
                        long outerCount,
                        long universalCount) {

    public UserStats {
        Objects.requireNonNull(userId, "userId is required");
    }

    public static UserStats empty(String userId) {
        return new UserStats(userId, 0, 0, 0, 0, 0, 0, 0);
    }

    public long bucketCount(BucketType bucket) {
        return switch (bucket) {
            case INNER -> innerCount;
            case OUTER -> outerCount;
            case UNIVERSAL -> universalCount;
        };
    }

    public UserStats withSentReceived(long sent, long received) {
        return new UserStats(userId, sent, received, acceptedCount, rejectedCount,
                innerCount, outerCount, universalCount);
    }

    /**
     * Returns a copy with the delta added to the incremental counters.
     */
    public UserStats plus(StatsDelta delta) {
        return new UserStats(userId, sentCount, receivedCount,
                acceptedCount + delta.accepted(),
                rejectedCount + delta.rejected(),
                innerCount + delta.inner(),
                outerCount + delta.outer(),
                universalCount + delta.universal());
    }
}
