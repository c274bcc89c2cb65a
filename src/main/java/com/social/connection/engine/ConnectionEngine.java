package com.social.connection.engine;

import com.social.connection.core.ConnectionException;
import com.social.connection.core.ConnectionMessages;
import com.social.connection.core.model.BucketAssignment;
import com.social.connection.core.model.Connection;
import com.social.connection.core.model.ConnectionStatus;
import com.social.connection.core.model.ConnectionVariant;
import com.social.connection.metrics.MetricsService;
import com.social.connection.notification.ConnectionNotifier;
import com.social.connection.stats.StatsAggregator;
import com.social.connection.stats.StatsDelta;
import com.social.connection.store.ConnectionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Connection lifecycle for one variant.
 *
 * <ul>
 *   <li>create: duplicate check, classification through the strategy, save as RECEIVED</li>
 *   <li>updateStatus: state machine check, save, stats deltas, notification</li>
 *   <li>relabel: accepted-and-endpoint check, strategy relabel, save, stats deltas</li>
 *   <li>delete: unconditional removal</li>
 * </ul>
 *
 * <p>Steps are not wrapped in a transaction. A failure after the save leaves the
 * saved connection in place; stats and notifications are best-effort where noted.</p>
 *
 * @param <A> assignment type
 * @param <C> create request type
 * @param <R> relabel request type
 */
public class ConnectionEngine<A extends BucketAssignment, C, R> {
    private static final Logger log = LoggerFactory.getLogger(ConnectionEngine.class);

    private final AssignmentStrategy<A, C, R> strategy;
    private final ConnectionRepository<A> repository;
    private final ConnectionStateMachine stateMachine;
    private final StatsAggregator stats;
    private final ConnectionNotifier notifier;
    private final MetricsService metrics;
    private final boolean refreshStatsOnCreate;

    /**
     * @param notifier may be {@code null} to disable notifications
     */
    public ConnectionEngine(AssignmentStrategy<A, C, R> strategy,
                            ConnectionRepository<A> repository,
                            ConnectionStateMachine stateMachine,
                            StatsAggregator stats,
                            ConnectionNotifier notifier,
                            MetricsService metrics,
                            boolean refreshStatsOnCreate) {
        this.strategy = Objects.requireNonNull(strategy, "strategy is required");
        this.repository = Objects.requireNonNull(repository, "repository is required");
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine is required");
        this.stats = Objects.requireNonNull(stats, "stats is required");
        this.notifier = notifier;
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.refreshStatsOnCreate = refreshStatsOnCreate;
    }

    public ConnectionVariant variant() {
        return strategy.variant();
    }

    /**
     * Creates a connection request from {@code initiatorId} to {@code recipientId}.
     *
     * @throws ConnectionException CONFLICT if a pending or accepted connection already covers the pair,
     *                             INVALID_REQUEST for a self-connection,
     *                             or whatever the strategy raises while classifying
     */
    public Connection<A> create(String initiatorId, String recipientId, C request) {
        if (initiatorId.equals(recipientId)) {
            throw ConnectionException.invalid(ConnectionMessages.SELF_CONNECTION);
        }
        // either direction blocks: a pending request or an accepted connection already covers the pair
        for (Connection<A> existing : repository.findBetween(initiatorId, recipientId)) {
            if (existing.getStatus() == ConnectionStatus.RECEIVED) {
                throw ConnectionException.conflict(ConnectionMessages.ALREADY_SENT);
            }
            if (existing.getStatus() == ConnectionStatus.ACCEPTED) {
                throw ConnectionException.conflict(ConnectionMessages.ALREADY_CONNECTED);
            }
        }

        A assignment = strategy.initialAssignment(initiatorId, recipientId, request);
        Connection<A> connection = repository.save(Connection.<A>builder()
                .initiatorId(initiatorId)
                .recipientId(recipientId)
                .status(ConnectionStatus.RECEIVED)
                .assignment(assignment)
                .build());

        metrics.incrementConnectionCreated(variant());
        log.info("connection.created connectionId={} variant={} initiatorId={} recipientId={}",
                connection.getId(), variant(), initiatorId, recipientId);

        if (refreshStatsOnCreate) {
            refreshQuietly(recipientId);
            refreshQuietly(initiatorId);
        }
        if (notifier != null) {
            notifier.requestSent(connection);
        }
        return connection;
    }

    /**
     * Moves a pending connection to {@code target} on behalf of {@code actorId}.
     *
     * @throws ConnectionException NOT_FOUND, UNAUTHORIZED, CONFLICT or INVALID_REQUEST
     *                             as decided by {@link ConnectionStateMachine}
     */
    public Connection<A> updateStatus(String connectionId, String actorId, ConnectionStatus target) {
        Connection<A> current = require(connectionId);
        stateMachine.validate(current, actorId, target);

        Connection<A> updated = repository.save(current.withStatus(target));
        metrics.incrementTransition(variant(), target);
        log.info("connection.transitioned connectionId={} from={} to={} actorId={}",
                connectionId, current.getStatus(), target, actorId);

        applyDeltas(strategy.transitionDeltas(current, target));

        if (notifier != null) {
            if (target == ConnectionStatus.ACCEPTED) {
                notifier.accepted(updated);
            } else if (target == ConnectionStatus.REJECTED) {
                notifier.rejected(updated);
            }
        }
        return updated;
    }

    /**
     * Changes the classification of an accepted connection.
     *
     * @throws ConnectionException NOT_FOUND if the connection is missing, CONFLICT if it is
     *                             not accepted, UNAUTHORIZED if the actor is not an endpoint,
     *                             or whatever the strategy raises
     */
    public Connection<A> relabel(String connectionId, String actorId, R request) {
        Connection<A> current = require(connectionId);
        stateMachine.validateRelabel(current, actorId);

        RelabelOutcome<A> outcome = strategy.relabel(current, actorId, request);
        Connection<A> updated = repository.save(current.withAssignment(outcome.assignment()));
        metrics.incrementRelabel(variant());
        log.info("connection.relabelled connectionId={} variant={} actorId={}",
                connectionId, variant(), actorId);

        applyDeltas(outcome.deltas());
        return updated;
    }

    /**
     * Removes the connection and its assignment. No status or actor check.
     *
     * @throws ConnectionException NOT_FOUND if the connection does not exist
     */
    public void delete(String connectionId) {
        if (!repository.delete(connectionId)) {
            throw ConnectionException.notFound(ConnectionMessages.CONNECTION_NOT_FOUND + connectionId);
        }
        log.info("connection.deleted connectionId={} variant={}", connectionId, variant());
    }

    public Optional<Connection<A>> find(String connectionId) {
        return repository.findById(connectionId);
    }

    /**
     * @throws ConnectionException NOT_FOUND if the connection does not exist
     */
    public Connection<A> require(String connectionId) {
        return repository.findById(connectionId)
                .orElseThrow(() -> ConnectionException.notFound(
                        ConnectionMessages.CONNECTION_NOT_FOUND + connectionId));
    }

    /**
     * Connections of the user, newest first.
     */
    public List<Connection<A>> connectionsOf(String userId) {
        return repository.findByParticipant(userId);
    }

    public List<Connection<A>> connectionsBetween(String userA, String userB) {
        return repository.findBetween(userA, userB);
    }

    private void applyDeltas(Map<String, StatsDelta> deltas) {
        deltas.forEach(stats::apply);
    }

    private void refreshQuietly(String userId) {
        try {
            stats.refreshSentReceived(userId);
        } catch (Exception e) {
            log.warn("Failed to refresh sent/received counts for {}: {}", userId, e.getMessage());
        }
    }
}
