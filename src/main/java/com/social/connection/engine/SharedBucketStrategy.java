package com.social.connection.engine;

import com.social.connection.core.ConnectionException;
import com.social.connection.core.model.BucketType;
import com.social.connection.core.model.Connection;
import com.social.connection.core.model.ConnectionStatus;
import com.social.connection.core.model.ConnectionVariant;
import com.social.connection.core.model.SharedAssignment;
import com.social.connection.stats.StatsDelta;

import java.util.HashMap;
import java.util.Map;

/**
 * Shared variant: one bucket and label for both endpoints, taken from the request
 * as given. Acceptance and bucket moves update stats on both endpoints.
 */
public class SharedBucketStrategy
        implements AssignmentStrategy<SharedAssignment, SharedCreateRequest, SharedRelabelRequest> {

    @Override
    public ConnectionVariant variant() {
        return ConnectionVariant.SHARED;
    }

    @Override
    public SharedAssignment initialAssignment(String initiatorId, String recipientId, SharedCreateRequest request) {
        return new SharedAssignment(request.bucketType(), request.relationLabel(), request.subRelationLabel());
    }

    @Override
    public Map<String, StatsDelta> transitionDeltas(Connection<SharedAssignment> connection,
                                                    ConnectionStatus target) {
        Map<String, StatsDelta> deltas = new HashMap<>();
        BucketType bucket = connection.getAssignment().bucketType();
        switch (target) {
            case ACCEPTED -> {
                deltas.merge(connection.getRecipientId(), StatsDelta.accepted(), StatsDelta::plus);
                deltas.merge(connection.getRecipientId(), StatsDelta.bucket(bucket, 1), StatsDelta::plus);
                deltas.merge(connection.getInitiatorId(), StatsDelta.bucket(bucket, 1), StatsDelta::plus);
            }
            case REJECTED -> deltas.put(connection.getRecipientId(), StatsDelta.rejected());
            default -> {
                // cancellation leaves counters alone
            }
        }
        return deltas;
    }

    @Override
    public RelabelOutcome<SharedAssignment> relabel(Connection<SharedAssignment> connection, String actorId,
                                                    SharedRelabelRequest request) {
        if (request.isEmpty()) {
            throw ConnectionException.invalid("Either a bucket type or a sub-relation label is required");
        }
        SharedAssignment current = connection.getAssignment();
        BucketType oldBucket = current.bucketType();
        BucketType newBucket = request.bucketType() != null ? request.bucketType() : oldBucket;
        String newLabel = request.subRelationLabel() != null && !request.subRelationLabel().isBlank()
                ? request.subRelationLabel()
                : current.subRelationLabel();

        SharedAssignment updated = current.withBucketType(newBucket).withSubRelationLabel(newLabel);
        if (oldBucket == newBucket) {
            return RelabelOutcome.withoutStats(updated);
        }
        StatsDelta move = StatsDelta.move(oldBucket, newBucket);
        return new RelabelOutcome<>(updated, Map.of(
                connection.getInitiatorId(), move,
                connection.getRecipientId(), move));
    }
}
