package com.social.connection.engine;

import com.social.connection.core.model.BucketType;

/**
 * Change to a shared-variant connection. A null field keeps its current value.
 */
public record SharedRelabelRequest(BucketType bucketType, String subRelationLabel) {

    public boolean isEmpty() {
        return bucketType == null && (subRelationLabel == null || subRelationLabel.isBlank());
    }
}
