package com.social.connection.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A typed social edge between an initiator and a recipient.
 *
 * Connections are immutable snapshots. State changes produce a new instance through
 * {@link #withStatus(ConnectionStatus)} or {@link #withAssignment(BucketAssignment)},
 * which the engine then saves.
 *
 * @param <A> the bucket assignment variant
 */
public final class Connection<A extends BucketAssignment> {

    private final String id;
    private final String initiatorId;
    private final String recipientId;
    private final ConnectionStatus status;
    private final A assignment;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Connection(Builder<A> builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.initiatorId = Objects.requireNonNull(builder.initiatorId, "initiatorId is required");
        this.recipientId = Objects.requireNonNull(builder.recipientId, "recipientId is required");
        this.status = builder.status != null ? builder.status : ConnectionStatus.RECEIVED;
        this.assignment = Objects.requireNonNull(builder.assignment, "assignment is required");
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : createdAt;
    }

    public String getId() {
        return id;
    }

    public String getInitiatorId() {
        return initiatorId;
    }

    public String getRecipientId() {
        return recipientId;
    }

    public ConnectionStatus getStatus() {
        return status;
    }

    public A getAssignment() {
        return assignment;
    }

    public ConnectionVariant getVariant() {
        return assignment.variant();
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public boolean isParticipant(String userId) {
        return initiatorId.equals(userId) || recipientId.equals(userId);
    }

    /**
     * Returns true when this connection joins the two users, in either direction.
     */
    public boolean connects(String userA, String userB) {
        return (initiatorId.equals(userA) && recipientId.equals(userB))
                || (initiatorId.equals(userB) && recipientId.equals(userA));
    }

    /**
     * Returns the endpoint that is not {@code userId}.
     *
     * @throws IllegalArgumentException if {@code userId} is not an endpoint
     */
    public String counterpartOf(String userId) {
        if (initiatorId.equals(userId)) {
            return recipientId;
        }
        if (recipientId.equals(userId)) {
            return initiatorId;
        }
        throw new IllegalArgumentException("User " + userId + " is not a participant of connection " + id);
    }

    public Connection<A> withStatus(ConnectionStatus newStatus) {
        return toBuilder().status(newStatus).updatedAt(Instant.now()).build();
    }

    public Connection<A> withAssignment(A newAssignment) {
        return toBuilder().assignment(newAssignment).updatedAt(Instant.now()).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Connection<?> that = (Connection<?>) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Connection{" +
                "id='" + id + '\'' +
                ", initiatorId='" + initiatorId + '\'' +
                ", recipientId='" + recipientId + '\'' +
                ", status=" + status +
                ", variant=" + getVariant() +
                '}';
    }

    public static <A extends BucketAssignment> Builder<A> builder() {
        return new Builder<>();
    }

    public Builder<A> toBuilder() {
        return new Builder<A>()
                .id(id)
                .initiatorId(initiatorId)
                .recipientId(recipientId)
                .status(status)
                .assignment(assignment)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static class Builder<A extends BucketAssignment> {
        private String id;
        private String initiatorId;
        private String recipientId;
        private ConnectionStatus status;
        private A assignment;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder<A> id(String id) {
            this.id = id;
            return this;
        }

        public Builder<A> initiatorId(String initiatorId) {
            this.initiatorId = initiatorId;
            return this;
        }

        public Builder<A> recipientId(String recipientId) {
            this.recipientId = recipientId;
            return this;
        }

        public Builder<A> status(ConnectionStatus status) {
            this.status = status;
            return this;
        }

        public Builder<A> assignment(A assignment) {
            this.assignment = assignment;
            return this;
        }

        public Builder<A> createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder<A> updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Connection<A> build() {
            return new Connection<>(this);
        }
    }
}
