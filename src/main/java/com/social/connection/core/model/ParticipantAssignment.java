package com.social.connection.core.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Asymmetric classification: each endpoint holds its own sub-relation and bucket.
 *
 * @param initialSubRelation     the label the initiator asked for at creation
 * @param initialDirectionality  directionality of that label's rule at creation
 * @param participants           endpoint id to state; always exactly the two endpoints
 */
public record ParticipantAssignment(String initialSubRelation,
                                    Directionality initialDirectionality,
                                    Map<String, ParticipantState> participants)
        implements BucketAssignment {

    public ParticipantAssignment {
        Objects.requireNonNull(participants, "participants is required");
        participants = Map.copyOf(participants);
    }

    public static ParticipantAssignment of(String initialSubRelation, Directionality directionality,
                                           String initiatorId, ParticipantState initiatorState,
                                           String recipientId, ParticipantState recipientState) {
        Map<String, ParticipantState> states = new LinkedHashMap<>();
        states.put(initiatorId, initiatorState);
        states.put(recipientId, recipientState);
        return new ParticipantAssignment(initialSubRelation, directionality, states);
    }

    @Override
    public ConnectionVariant variant() {
        return ConnectionVariant.PARTICIPANT;
    }

    @Override
    public BucketType bucketFor(String participantId) {
        ParticipantState state = participants.get(participantId);
        return state != null ? state.bucketType() : null;
    }

    @Override
    public String subRelationFor(String participantId) {
        ParticipantState state = participants.get(participantId);
        return state != null ? state.subRelation() : null;
    }

    /**
     * Returns the state of the given participant.
     *
     * @throws IllegalArgumentException if the id is not an endpoint of this connection
     */
    public ParticipantState stateOf(String participantId) {
        ParticipantState state = participants.get(participantId);
        if (state == null) {
            throw new IllegalArgumentException("Not a participant: " + participantId);
        }
        return state;
    }

    public int modificationCountOf(String participantId) {
        ParticipantState state = participants.get(participantId);
        return state != null ? state.modificationCount() : 0;
    }

    /**
     * Returns a copy with the given participant's state replaced.
     */
    public ParticipantAssignment with(String participantId, ParticipantState state) {
        stateOf(participantId);
        Map<String, ParticipantState> updated = new LinkedHashMap<>(participants);
        updated.put(participantId, state);
        return new ParticipantAssignment(initialSubRelation, initialDirectionality, updated);
    }
}
