package com.social.connection.api;

import com.social.connection.core.model.BucketAssignment;
import com.social.connection.core.model.Connection;

/**
 * The user on the other end of a connection, seen from the listed user.
 *
 * @param userId     the counterpart's id
 * @param connection the connection linking the two
 */
public record ConnectedUser<A extends BucketAssignment>(String userId, Connection<A> connection) {

    static <A extends BucketAssignment> ConnectedUser<A> of(Connection<A> connection, String ownerId) {
        return new ConnectedUser<>(connection.counterpartOf(ownerId), connection);
    }
}
