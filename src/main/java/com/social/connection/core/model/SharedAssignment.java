package com.social.connection.core.model;

/**
 * Single classification shared by both endpoints of a connection.
 *
 * @param bucketType       the shared bucket, may be {@code null}
 * @param relationLabel    the category label, e.g. "Friend"
 * @param subRelationLabel the sub-relation label, e.g. "friend"
 */
public record SharedAssignment(BucketType bucketType, String relationLabel, String subRelationLabel)
        implements BucketAssignment {

    @Override
    public ConnectionVariant variant() {
        return ConnectionVariant.SHARED;
    }

    @Override
    public BucketType bucketFor(String participantId) {
        return bucketType;
    }

    @Override
    public String subRelationFor(String participantId) {
        return subRelationLabel;
    }

    public SharedAssignment withBucketType(BucketType newBucketType) {
        return new SharedAssignment(newBucketType, relationLabel, subRelationLabel);
    }

    public SharedAssignment withSubRelationLabel(String newSubRelationLabel) {
        return new SharedAssignment(bucketType, relationLabel, newSubRelationLabel);
    }
}
