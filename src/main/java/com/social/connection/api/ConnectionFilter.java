package com.social.connection.api;

import com.social.connection.core.model.BucketType;
import com.social.connection.core.model.Connection;

/**
 * Listing filter. A null field matches everything.
 *
 * @param status status seen from the listing user
 * @param bucket bucket the listing user sees the connection in
 */
public record ConnectionFilter(StatusFilter status, BucketType bucket) {

    public static ConnectionFilter all() {
        return new ConnectionFilter(null, null);
    }

    public static ConnectionFilter of(StatusFilter status) {
        return new ConnectionFilter(status, null);
    }

    public ConnectionFilter withBucket(BucketType bucketType) {
        return new ConnectionFilter(status, bucketType);
    }

    public boolean matches(Connection<?> connection, String userId) {
        if (status != null && !status.matches(connection, userId)) {
            return false;
        }
        return bucket == null || bucket == connection.getAssignment().bucketFor(userId);
    }
}
