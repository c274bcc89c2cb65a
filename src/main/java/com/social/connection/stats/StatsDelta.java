package com.social.connection.stats;

import com.social.connection.core.model.BucketType;

/**
 * Change to the incremental counters of one user, applied atomically.
 */
public record StatsDelta(int accepted, int rejected, int inner, int outer, int universal) {

    public static final StatsDelta NONE = new StatsDelta(0, 0, 0, 0, 0);

    public static StatsDelta accepted() {
        return new StatsDelta(1, 0, 0, 0, 0);
    }

    public static StatsDelta rejected() {
        return new StatsDelta(0, 1, 0, 0, 0);
    }

    /**
     * Adds {@code amount} to the counter of {@code bucket}; a null bucket yields {@link #NONE}.
     */
    public static StatsDelta bucket(BucketType bucket, int amount) {
        if (bucket == null) {
            return NONE;
        }
        return switch (bucket) {
            case INNER -> new StatsDelta(0, 0, amount, 0, 0);
            case OUTER -> new StatsDelta(0, 0, 0, amount, 0);
            case UNIVERSAL -> new StatsDelta(0, 0, 0, 0, amount);
        };
    }

    /**
     * Moves one unit from the old bucket to the new one. Equal buckets cancel out.
     */
    public static StatsDelta move(BucketType from, BucketType to) {
        return bucket(from, -1).plus(bucket(to, 1));
    }

    public StatsDelta plus(StatsDelta other) {
        return new StatsDelta(accepted + other.accepted,
                rejected + other.rejected,
                inner + other.inner,
                outer + other.outer,
                universal + other.universal);
    }

    public boolean isEmpty() {
        return accepted == 0 && rejected == 0 && inner == 0 && outer == 0 && universal == 0;
    }
}
