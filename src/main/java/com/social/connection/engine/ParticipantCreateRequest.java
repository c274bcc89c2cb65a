package com.social.connection.engine;

/**
 * Sub-relation chosen by the initiator of a participant-variant connection.
 */
public record ParticipantCreateRequest(String subRelationName) {
}
