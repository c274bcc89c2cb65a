package com.social.connection.engine;

import com.social.connection.core.model.BucketType;

/**
 * Change requested by one participant. With only a bucket, the change is local and
 * free; with a sub-relation, it propagates to the other participant and counts
 * against the actor's modification limit.
 */
public record ParticipantRelabelRequest(String subRelationName, BucketType bucketType) {

    public boolean hasSubRelation() {
        return subRelationName != null && !subRelationName.isBlank();
    }

    public boolean isEmpty() {
        return !hasSubRelation() && bucketType == null;
    }
}
