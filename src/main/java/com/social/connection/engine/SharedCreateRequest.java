package com.social.connection.engine;

import com.social.connection.core.model.BucketType;

/**
 * Classification chosen by the initiator of a shared-variant connection.
 *
 * @param bucketType       bucket both endpoints see
 * @param relationLabel    category label, e.g. "Friend"
 * @param subRelationLabel sub-relation label, e.g. "friend"
 */
public record SharedCreateRequest(BucketType bucketType, String relationLabel, String subRelationLabel) {
}
