package com.social.connection.engine;

import com.social.connection.classification.ClassificationEngine;
import com.social.connection.core.ConnectionException;
import com.social.connection.core.model.Connection;
import com.social.connection.core.model.ConnectionStatus;
import com.social.connection.core.model.ConnectionVariant;
import com.social.connection.core.model.ParticipantAssignment;
import com.social.connection.core.model.ParticipantState;
import com.social.connection.stats.StatsDelta;

import java.util.Map;

/**
 * Participant variant: each endpoint holds its own sub-relation and bucket.
 * Labels come from the taxonomy; stats counters are not touched.
 */
public class ParticipantBucketStrategy
        implements AssignmentStrategy<ParticipantAssignment, ParticipantCreateRequest, ParticipantRelabelRequest> {

    private final ClassificationEngine classification;
    private final ModificationThrottle throttle;

    public ParticipantBucketStrategy(ClassificationEngine classification, ModificationThrottle throttle) {
        this.classification = classification;
        this.throttle = throttle;
    }

    @Override
    public ConnectionVariant variant() {
        return ConnectionVariant.PARTICIPANT;
    }

    @Override
    public ParticipantAssignment initialAssignment(String initiatorId, String recipientId,
                                                   ParticipantCreateRequest request) {
        return classification.classify(initiatorId, recipientId, request.subRelationName());
    }

    @Override
    public Map<String, StatsDelta> transitionDeltas(Connection<ParticipantAssignment> connection,
                                                    ConnectionStatus target) {
        return Map.of();
    }

    @Override
    public RelabelOutcome<ParticipantAssignment> relabel(Connection<ParticipantAssignment> connection,
                                                         String actorId, ParticipantRelabelRequest request) {
        if (request.isEmpty()) {
            throw ConnectionException.invalid("Either a sub-relation or a bucket type is required");
        }
        ParticipantAssignment assignment = connection.getAssignment();
        String otherId = connection.counterpartOf(actorId);

        if (!request.hasSubRelation()) {
            ParticipantState actor = assignment.stateOf(actorId);
            return RelabelOutcome.withoutStats(assignment.with(actorId, actor.withBucketType(request.bucketType())));
        }

        throttle.check(connection.getId(), actorId, assignment.modificationCountOf(actorId));
        return RelabelOutcome.withoutStats(classification.relabel(assignment, actorId, otherId,
                request.subRelationName(), request.bucketType()));
    }
}
