package com.social.connection.core.model;

/**
 * Classification data owned by a connection.
 * Implementations are immutable; a change produces a new assignment.
 */
public interface BucketAssignment {

    ConnectionVariant variant();

    /**
     * Bucket the given endpoint sees the connection in, or {@code null} if unset.
     */
    BucketType bucketFor(String participantId);

    /**
     * Sub-relation label the given endpoint holds, or {@code null} if unset.
     */
    String subRelationFor(String participantId);
}
