package com.social.connection.api;

import com.social.connection.core.ConnectionException;
import com.social.connection.core.ConnectionMessages;
import com.social.connection.core.ErrorKind;
import com.social.connection.core.model.BucketAssignment;
import com.social.connection.core.model.BucketType;
import com.social.connection.core.model.Connection;
import com.social.connection.core.model.ConnectionStatus;
import com.social.connection.core.model.ParticipantAssignment;
import com.social.connection.core.model.RelationCategory;
import com.social.connection.core.model.SharedAssignment;
import com.social.connection.core.model.SubRelationRule;
import com.social.connection.engine.ConnectionEngine;
import com.social.connection.engine.ParticipantCreateRequest;
import com.social.connection.engine.ParticipantRelabelRequest;
import com.social.connection.engine.SharedCreateRequest;
import com.social.connection.engine.SharedRelabelRequest;
import com.social.connection.logging.LogContext;
import com.social.connection.metrics.MetricsService;
import com.social.connection.stats.StatsAggregator;
import com.social.connection.stats.UserStats;
import com.social.connection.taxonomy.TaxonomyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Operation surface of the connection engine.
 *
 * <p>Every method is a boundary: it never throws, and reports failures through
 * {@link OperationResult#errorKind()}. Methods acting for a user take the already
 * authenticated {@code actorId} first.</p>
 *
 * <p>"Shared" methods work on connections with one bucket for both endpoints;
 * the {@code V2} methods work on connections where each endpoint holds its own
 * sub-relation and bucket.</p>
 */
public class ConnectionService {
    private static final Logger log = LoggerFactory.getLogger(ConnectionService.class);

    private final ConnectionEngine<SharedAssignment, SharedCreateRequest, SharedRelabelRequest> sharedEngine;
    private final ConnectionEngine<ParticipantAssignment, ParticipantCreateRequest, ParticipantRelabelRequest> participantEngine;
    private final StatsAggregator stats;
    private final TaxonomyStore taxonomy;
    private final ConnectionOptions options;
    private final MetricsService metrics;

    public ConnectionService(
            ConnectionEngine<SharedAssignment, SharedCreateRequest, SharedRelabelRequest> sharedEngine,
            ConnectionEngine<ParticipantAssignment, ParticipantCreateRequest, ParticipantRelabelRequest> participantEngine,
            StatsAggregator stats,
            TaxonomyStore taxonomy,
            ConnectionOptions options,
            MetricsService metrics) {
        this.sharedEngine = sharedEngine;
        this.participantEngine = participantEngine;
        this.stats = stats;
        this.taxonomy = taxonomy;
        this.options = options;
        this.metrics = metrics;
    }

    // ========== Shared connections ==========

    public OperationResult<Connection<SharedAssignment>> createConnection(String actorId, String receiverId,
                                                                          BucketType bucketType,
                                                                          String relationLabel,
                                                                          String subRelationLabel) {
        return execute("createConnection", actorId, null, () -> {
            SharedCreateRequest request = new SharedCreateRequest(
                    RequestValidator.requireValue("bucketType", bucketType),
                    RequestValidator.requireLabel("relationLabel", relationLabel),
                    RequestValidator.requireLabel("subRelationLabel", subRelationLabel));
            Connection<SharedAssignment> created = sharedEngine.create(
                    RequestValidator.requireId("actorId", actorId),
                    RequestValidator.requireId("receiverId", receiverId),
                    request);
            return OperationResult.ok(created, ConnectionMessages.CONNECTION_CREATED);
        });
    }

    public OperationResult<Connection<SharedAssignment>> updateConnectionStatus(String actorId, String connectionId,
                                                                                ConnectionStatus newStatus) {
        return execute("updateConnectionStatus", actorId, connectionId, () -> {
            Connection<SharedAssignment> updated = sharedEngine.updateStatus(
                    RequestValidator.requireId("connectionId", connectionId),
                    RequestValidator.requireId("actorId", actorId),
                    RequestValidator.requireValue("newStatus", newStatus));
            return OperationResult.ok(updated, ConnectionMessages.CONNECTION_UPDATED);
        });
    }

    /**
     * Hard-deletes a shared connection. No status or ownership check is made.
     */
    public OperationResult<Void> deleteConnection(String actorId, String connectionId) {
        return execute("deleteConnection", actorId, connectionId, () -> {
            RequestValidator.requireId("actorId", actorId);
            sharedEngine.delete(RequestValidator.requireId("connectionId", connectionId));
            return OperationResult.ok(null, ConnectionMessages.CONNECTION_DELETED);
        });
    }

    /**
     * Changes the shared bucket and/or sub-relation label of an accepted connection.
     * A null argument keeps the current value; at least one must be given.
     */
    public OperationResult<Void> relabelConnection(String actorId, String connectionId,
                                                   BucketType bucketType, String subRelationLabel) {
        return execute("relabelConnection", actorId, connectionId, () -> {
            sharedEngine.relabel(
                    RequestValidator.requireId("connectionId", connectionId),
                    RequestValidator.requireId("actorId", actorId),
                    new SharedRelabelRequest(bucketType,
                            RequestValidator.optionalLabel("subRelationLabel", subRelationLabel)));
            return OperationResult.ok(null, ConnectionMessages.CONNECTION_RELABELLED);
        });
    }

    public OperationResult<Connection<SharedAssignment>> getConnection(String actorId, String connectionId) {
        return execute("getConnection", actorId, connectionId,
                () -> OperationResult.ok(visibleTo(sharedEngine, actorId, connectionId)));
    }

    public OperationResult<Page<Connection<SharedAssignment>>> listConnections(String actorId,
                                                                               ConnectionFilter filter,
                                                                               PageRequest page) {
        return execute("listConnections", actorId, null,
                () -> OperationResult.ok(list(sharedEngine, RequestValidator.requireId("actorId", actorId),
                        filter, page)));
    }

    /**
     * Lists another user's shared connections. Status and bucket filters apply from
     * that user's side, so SENT means requests {@code userId} sent.
     */
    public OperationResult<Page<Connection<SharedAssignment>>> listConnectionsOf(String actorId, String userId,
                                                                                 ConnectionFilter filter,
                                                                                 PageRequest page) {
        return execute("listConnectionsOf", actorId, null, () -> {
            RequestValidator.requireId("actorId", actorId);
            return OperationResult.ok(list(sharedEngine, RequestValidator.requireId("userId", userId), filter, page));
        });
    }

    /**
     * Users connected to {@code userId} through shared connections, one entry per
     * matching connection. Pass the actor's own id to list the actor's network.
     */
    public OperationResult<Page<ConnectedUser<SharedAssignment>>> connectedUsers(String actorId, String userId,
                                                                                 ConnectionFilter filter,
                                                                                 PageRequest page) {
        return execute("connectedUsers", actorId, null, () -> {
            RequestValidator.requireId("actorId", actorId);
            return OperationResult.ok(counterparts(sharedEngine, RequestValidator.requireId("userId", userId),
                    filter, page));
        });
    }

    // ========== Participant connections (V2) ==========

    /**
     * Creates a participant-variant request. The created connection is not returned;
     * callers read it back through {@link #connectionsBetween(String, String)}.
     */
    public OperationResult<Void> createConnectionV2(String actorId, String receiverId, String subRelationName) {
        return execute("createConnectionV2", actorId, null, () -> {
            if (!options.isV2Enabled()) {
                throw ConnectionException.unavailable(ConnectionMessages.V2_DISABLED);
            }
            participantEngine.create(
                    RequestValidator.requireId("actorId", actorId),
                    RequestValidator.requireId("receiverId", receiverId),
                    new ParticipantCreateRequest(RequestValidator.requireLabel("subRelationName", subRelationName)));
            return OperationResult.ok(null, ConnectionMessages.CONNECTION_CREATED);
        });
    }

    public OperationResult<Void> updateConnectionV2Status(String actorId, String connectionId,
                                                          ConnectionStatus newStatus) {
        return execute("updateConnectionV2Status", actorId, connectionId, () -> {
            participantEngine.updateStatus(
                    RequestValidator.requireId("connectionId", connectionId),
                    RequestValidator.requireId("actorId", actorId),
                    RequestValidator.requireValue("newStatus", newStatus));
            return OperationResult.ok(null, ConnectionMessages.CONNECTION_UPDATED);
        });
    }

    /**
     * Changes the actor's own view of an accepted connection. A sub-relation change
     * propagates to the other participant and counts against the actor's limit; a
     * bucket-only change is local and free.
     */
    public OperationResult<Void> relabelConnectionV2(String actorId, String connectionId,
                                                     String subRelationName, BucketType bucketType) {
        return execute("relabelConnectionV2", actorId, connectionId, () -> {
            participantEngine.relabel(
                    RequestValidator.requireId("connectionId", connectionId),
                    RequestValidator.requireId("actorId", actorId),
                    new ParticipantRelabelRequest(
                            RequestValidator.optionalLabel("subRelationName", subRelationName), bucketType));
            return OperationResult.ok(null, ConnectionMessages.CONNECTION_RELABELLED);
        });
    }

    public OperationResult<Void> deleteConnectionV2(String actorId, String connectionId) {
        return execute("deleteConnectionV2", actorId, connectionId, () -> {
            RequestValidator.requireId("actorId", actorId);
            participantEngine.delete(RequestValidator.requireId("connectionId", connectionId));
            return OperationResult.ok(null, ConnectionMessages.CONNECTION_DELETED);
        });
    }

    public OperationResult<Connection<ParticipantAssignment>> getConnectionV2(String actorId, String connectionId) {
        return execute("getConnectionV2", actorId, connectionId,
                () -> OperationResult.ok(visibleTo(participantEngine, actorId, connectionId)));
    }

    /**
     * Lists participant connections; a bucket filter matches the actor's own bucket.
     */
    public OperationResult<Page<Connection<ParticipantAssignment>>> listConnectionsV2(String actorId,
                                                                                      ConnectionFilter filter,
                                                                                      PageRequest page) {
        return execute("listConnectionsV2", actorId, null,
                () -> OperationResult.ok(list(participantEngine, RequestValidator.requireId("actorId", actorId),
                        filter, page)));
    }

    /**
     * Lists another user's participant connections; a bucket filter matches the bucket
     * {@code userId} filed the connection under, not the actor's.
     */
    public OperationResult<Page<Connection<ParticipantAssignment>>> listConnectionsOfV2(String actorId,
                                                                                        String userId,
                                                                                        ConnectionFilter filter,
                                                                                        PageRequest page) {
        return execute("listConnectionsOfV2", actorId, null, () -> {
            RequestValidator.requireId("actorId", actorId);
            return OperationResult.ok(list(participantEngine, RequestValidator.requireId("userId", userId),
                    filter, page));
        });
    }

    public OperationResult<Page<ConnectedUser<ParticipantAssignment>>> connectedUsersV2(String actorId,
                                                                                        String userId,
                                                                                        ConnectionFilter filter,
                                                                                        PageRequest page) {
        return execute("connectedUsersV2", actorId, null, () -> {
            RequestValidator.requireId("actorId", actorId);
            return OperationResult.ok(counterparts(participantEngine, RequestValidator.requireId("userId", userId),
                    filter, page));
        });
    }

    /**
     * Participant connections between the actor and another user, newest first.
     */
    public OperationResult<List<Connection<ParticipantAssignment>>> connectionsBetween(String actorId,
                                                                                       String otherUserId) {
        return execute("connectionsBetween", actorId, null, () -> OperationResult.ok(
                participantEngine.connectionsBetween(
                        RequestValidator.requireId("actorId", actorId),
                        RequestValidator.requireId("otherUserId", otherUserId))));
    }

    /**
     * Accepted participant connections of the actor grouped by the actor's own bucket.
     * Buckets without connections are left out; connections without a bucket are skipped.
     */
    public OperationResult<Map<BucketType, List<Connection<ParticipantAssignment>>>> groupByBucket(String actorId) {
        return execute("groupByBucket", actorId, null, () -> {
            String actor = RequestValidator.requireId("actorId", actorId);
            Map<BucketType, List<Connection<ParticipantAssignment>>> grouped = new EnumMap<>(BucketType.class);
            for (Connection<ParticipantAssignment> connection : participantEngine.connectionsOf(actor)) {
                BucketType bucket = connection.getAssignment().bucketFor(actor);
                if (connection.getStatus() == ConnectionStatus.ACCEPTED && bucket != null) {
                    grouped.computeIfAbsent(bucket, b -> new ArrayList<>()).add(connection);
                }
            }
            Map<BucketType, List<Connection<ParticipantAssignment>>> result = new LinkedHashMap<>();
            grouped.forEach((bucket, connections) -> result.put(bucket, List.copyOf(connections)));
            return OperationResult.ok(result);
        });
    }

    // ========== Stats ==========

    public OperationResult<UserStats> getStats(String actorId) {
        return execute("getStats", actorId, null,
                () -> OperationResult.ok(stats.stats(RequestValidator.requireId("actorId", actorId))));
    }

    /**
     * Recomputes the actor's sent and received counts from stored connections.
     */
    public OperationResult<UserStats> refreshStats(String actorId) {
        return execute("refreshStats", actorId, null,
                () -> OperationResult.ok(stats.refreshSentReceived(RequestValidator.requireId("actorId", actorId))));
    }

    // ========== Taxonomy ==========

    public OperationResult<List<RelationCategory>> relationCategories() {
        return execute("relationCategories", null, null, () -> OperationResult.ok(taxonomy.categories()));
    }

    public OperationResult<List<SubRelationRule>> subRelations(String categoryName) {
        return execute("subRelations", null, null, () -> OperationResult.ok(
                taxonomy.rulesOf(RequestValidator.requireLabel("categoryName", categoryName))));
    }

    // ========== Internals ==========

    private <A extends BucketAssignment> Connection<A> visibleTo(
            ConnectionEngine<A, ?, ?> engine, String actorId, String connectionId) {
        String actor = RequestValidator.requireId("actorId", actorId);
        Connection<A> connection = engine.require(RequestValidator.requireId("connectionId", connectionId));
        if (!connection.isParticipant(actor)) {
            throw ConnectionException.unauthorized(ConnectionMessages.NOT_AUTHORIZED);
        }
        return connection;
    }

    private <A extends BucketAssignment> Page<Connection<A>> list(
            ConnectionEngine<A, ?, ?> engine, String ownerId, ConnectionFilter filter, PageRequest page) {
        return Page.of(matching(engine, ownerId, filter), page != null ? page : PageRequest.first(20));
    }

    private <A extends BucketAssignment> Page<ConnectedUser<A>> counterparts(
            ConnectionEngine<A, ?, ?> engine, String ownerId, ConnectionFilter filter, PageRequest page) {
        List<ConnectedUser<A>> users = matching(engine, ownerId, filter).stream()
                .map(c -> ConnectedUser.of(c, ownerId))
                .toList();
        return Page.of(users, page != null ? page : PageRequest.first(20));
    }

    private <A extends BucketAssignment> List<Connection<A>> matching(
            ConnectionEngine<A, ?, ?> engine, String ownerId, ConnectionFilter filter) {
        ConnectionFilter effective = filter != null ? filter : ConnectionFilter.all();
        return engine.connectionsOf(ownerId).stream()
                .filter(c -> effective.matches(c, ownerId))
                .toList();
    }

    private <T> OperationResult<T> execute(String operation, String actorId, String connectionId,
                                           Supplier<OperationResult<T>> action) {
        long start = System.nanoTime();
        String outcome = "success";
        try (LogContext ctx = LogContext.forOperation(LogContext.generateCorrelationId(),
                operation, connectionId, actorId)) {
            try {
                return action.get();
            } catch (ConnectionException e) {
                outcome = e.getKind().name().toLowerCase(Locale.ROOT);
                log.info("connection.operation.failed operation={} kind={} message={}",
                        operation, e.getKind(), e.getMessage());
                return OperationResult.failure(e.getKind(), e.getMessage());
            } catch (Exception e) {
                outcome = "internal";
                log.error("connection.operation.error operation={}: {}", operation, e.getMessage(), e);
                return OperationResult.failure(ErrorKind.INTERNAL, ConnectionMessages.INTERNAL_ERROR);
            }
        } finally {
            metrics.recordOperationDuration(operation, outcome, Duration.ofNanos(System.nanoTime() - start));
        }
    }
}
