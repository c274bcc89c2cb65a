package com.social.connection.core.model;

/**
 * One participant's view of a connection.
 *
 * @param subRelation       the label this participant holds
 * @param bucketType        the bucket this participant files the connection under
 * @param modificationCount how many times this participant has relabelled; never decreases
 */
public record ParticipantState(String subRelation, BucketType bucketType, int modificationCount) {

    public ParticipantState {
        if (modificationCount < 0) {
            throw new IllegalArgumentException("modificationCount must be >= 0");
        }
    }

    public static ParticipantState initial(String subRelation, BucketType bucketType) {
        return new ParticipantState(subRelation, bucketType, 0);
    }

    public ParticipantState withSubRelation(String newSubRelation) {
        return new ParticipantState(newSubRelation, bucketType, modificationCount);
    }

    public ParticipantState withBucketType(BucketType newBucketType) {
        return new ParticipantState(subRelation, newBucketType, modificationCount);
    }

    /**
     * Relabel charged to this participant: new label, optional new bucket, count + 1.
     */
    public ParticipantState relabelled(String newSubRelation, BucketType newBucketType) {
        return new ParticipantState(newSubRelation,
                newBucketType != null ? newBucketType : bucketType,
                modificationCount + 1);
    }
}
