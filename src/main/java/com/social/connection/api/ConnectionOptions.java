package com.social.connection.api;

/**
 * Options for the connection engine.
 */
public class ConnectionOptions {

    private static final int DEFAULT_MAX_MODIFICATIONS = 5;

    private final boolean v2Enabled;
    private final int maxModifications;
    private final boolean notificationsEnabled;
    private final boolean refreshStatsOnCreate;

    private ConnectionOptions(Builder builder) {
        this.v2Enabled = builder.v2Enabled;
        this.maxModifications = builder.maxModifications;
        this.notificationsEnabled = builder.notificationsEnabled;
        this.refreshStatsOnCreate = builder.refreshStatsOnCreate;
    }

    /**
     * Whether participant-variant connections can be created.
     */
    public boolean isV2Enabled() {
        return v2Enabled;
    }

    /**
     * Successful sub-relation changes allowed per participant per connection.
     */
    public int getMaxModifications() {
        return maxModifications;
    }

    public boolean isNotificationsEnabled() {
        return notificationsEnabled;
    }

    /**
     * Whether sent/received counts of both endpoints are recomputed after a create.
     */
    public boolean isRefreshStatsOnCreate() {
        return refreshStatsOnCreate;
    }

    public static ConnectionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .v2Enabled(v2Enabled)
                .maxModifications(maxModifications)
                .notificationsEnabled(notificationsEnabled)
                .refreshStatsOnCreate(refreshStatsOnCreate);
    }

    @Override
    public String toString() {
        return "ConnectionOptions{" +
                "v2Enabled=" + v2Enabled +
                ", maxModifications=" + maxModifications +
                ", notificationsEnabled=" + notificationsEnabled +
                ", refreshStatsOnCreate=" + refreshStatsOnCreate +
                '}';
    }

    public static class Builder {
        private boolean v2Enabled = true;
        private int maxModifications = DEFAULT_MAX_MODIFICATIONS;
        private boolean notificationsEnabled = true;
        private boolean refreshStatsOnCreate = true;

        public Builder v2Enabled(boolean v2Enabled) {
            this.v2Enabled = v2Enabled;
            return this;
        }

        public Builder maxModifications(int maxModifications) {
            if (maxModifications < 0) {
                throw new IllegalArgumentException("maxModifications must be >= 0");
            }
            this.maxModifications = maxModifications;
            return this;
        }

        public Builder notificationsEnabled(boolean notificationsEnabled) {
            this.notificationsEnabled = notificationsEnabled;
            return this;
        }

        public Builder refreshStatsOnCreate(boolean refreshStatsOnCreate) {
            this.refreshStatsOnCreate = refreshStatsOnCreate;
            return this;
        }

        public ConnectionOptions build() {
            return new ConnectionOptions(this);
        }
    }
}
