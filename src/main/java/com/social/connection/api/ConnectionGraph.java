package com.social.connection.api;

import com.social.connection.cache.CacheConfig;
import com.social.connection.classification.ClassificationEngine;
import com.social.connection.core.model.ConnectionVariant;
import com.social.connection.core.model.ParticipantAssignment;
import com.social.connection.core.model.SharedAssignment;
import com.social.connection.engine.ConnectionEngine;
import com.social.connection.engine.ConnectionStateMachine;
import com.social.connection.engine.ModificationThrottle;
import com.social.connection.engine.ParticipantBucketStrategy;
import com.social.connection.engine.ParticipantCreateRequest;
import com.social.connection.engine.ParticipantRelabelRequest;
import com.social.connection.engine.SharedBucketStrategy;
import com.social.connection.engine.SharedCreateRequest;
import com.social.connection.engine.SharedRelabelRequest;
import com.social.connection.graph.FalkorDBConnection;
import com.social.connection.graph.GraphConnection;
import com.social.connection.logging.LogContext;
import com.social.connection.metrics.MetricsService;
import com.social.connection.metrics.NoOpMetricsService;
import com.social.connection.notification.ConnectionNotifier;
import com.social.connection.notification.IdentityDirectory;
import com.social.connection.notification.NoOpNotificationSender;
import com.social.connection.notification.NotificationSender;
import com.social.connection.stats.GraphStatsRepository;
import com.social.connection.stats.InMemoryStatsRepository;
import com.social.connection.stats.StatsAggregator;
import com.social.connection.stats.StatsRepository;
import com.social.connection.store.ConnectionRepository;
import com.social.connection.store.GraphConnectionRepository;
import com.social.connection.store.InMemoryConnectionRepository;
import com.social.connection.taxonomy.CachingTaxonomyStore;
import com.social.connection.taxonomy.GraphTaxonomyStore;
import com.social.connection.taxonomy.InMemoryTaxonomyStore;
import com.social.connection.taxonomy.TaxonomyLoader;
import com.social.connection.taxonomy.TaxonomyStore;
import com.social.connection.taxonomy.TaxonomyVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Entry point that wires the connection engine.
 *
 * <p>Without a graph connection every store is in memory. With one, taxonomy,
 * connections and stats are kept in FalkorDB.</p>
 *
 * <pre>
 * try (ConnectionGraph graph = ConnectionGraph.builder()
 *         .falkorDB("localhost", 6379, "connections")
 *         .seedDefaultTaxonomy(true)
 *         .build()) {
 *     ConnectionService service = graph.service();
 *     service.createConnectionV2(actorId, receiverId, "mentor");
 * }
 * </pre>
 */
public class ConnectionGraph implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ConnectionGraph.class);

    private final GraphConnection connection;
    private final boolean ownsConnection;
    private final TaxonomyStore taxonomy;
    private final StatsAggregator stats;
    private final ConnectionService service;
    private final ConnectionOptions options;

    private ConnectionGraph(Builder builder) {
        this.connection = builder.connection;
        this.ownsConnection = builder.ownsConnection;
        this.options = builder.options;
        MetricsService metrics = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();

        // Stores
        TaxonomyStore baseTaxonomy;
        ConnectionRepository<SharedAssignment> sharedRepository;
        ConnectionRepository<ParticipantAssignment> participantRepository;
        StatsRepository statsRepository;
        if (connection != null) {
            if (builder.createIndexes) {
                connection.createIndexes();
            }
            baseTaxonomy = new GraphTaxonomyStore(connection);
            sharedRepository = new GraphConnectionRepository<>(connection, SharedAssignment.class,
                    ConnectionVariant.SHARED);
            participantRepository = new GraphConnectionRepository<>(connection, ParticipantAssignment.class,
                    ConnectionVariant.PARTICIPANT);
            statsRepository = new GraphStatsRepository(connection);
        } else {
            baseTaxonomy = new InMemoryTaxonomyStore();
            sharedRepository = new InMemoryConnectionRepository<>();
            participantRepository = new InMemoryConnectionRepository<>();
            statsRepository = new InMemoryStatsRepository();
        }
        if (builder.taxonomyStore != null) {
            baseTaxonomy = builder.taxonomyStore;
        }
        this.taxonomy = builder.cacheConfig.enabled()
                ? new CachingTaxonomyStore(baseTaxonomy, builder.cacheConfig)
                : baseTaxonomy;

        if (builder.seedDefaultTaxonomy) {
            try (LogContext ctx = LogContext.forSeed(LogContext.generateCorrelationId())
                    .with("backend", connection != null ? connection.getGraphName() : "memory")) {
                new TaxonomyLoader().seedDefaults(taxonomy);
                new TaxonomyVerifier().verify(taxonomy);
            }
        }

        this.stats = new StatsAggregator(statsRepository, List.of(sharedRepository, participantRepository));

        // Notifications
        ConnectionNotifier notifier = null;
        if (options.isNotificationsEnabled()) {
            IdentityDirectory directory = builder.identityDirectory != null
                    ? builder.identityDirectory : userId -> Optional.empty();
            NotificationSender sender = builder.notificationSender != null
                    ? builder.notificationSender : new NoOpNotificationSender();
            notifier = new ConnectionNotifier(directory, sender, metrics);
        }

        // Engines
        ConnectionStateMachine stateMachine = new ConnectionStateMachine();
        ClassificationEngine classification = new ClassificationEngine(taxonomy);
        ModificationThrottle throttle = new ModificationThrottle(options.getMaxModifications(), metrics);

        ConnectionEngine<SharedAssignment, SharedCreateRequest, SharedRelabelRequest> sharedEngine =
                new ConnectionEngine<>(new SharedBucketStrategy(), sharedRepository,
                        stateMachine, stats, notifier, metrics, options.isRefreshStatsOnCreate());
        ConnectionEngine<ParticipantAssignment, ParticipantCreateRequest, ParticipantRelabelRequest> participantEngine =
                new ConnectionEngine<>(new ParticipantBucketStrategy(classification, throttle),
                        participantRepository, stateMachine, stats, notifier, metrics, options.isRefreshStatsOnCreate());

        this.service = new ConnectionService(sharedEngine, participantEngine, stats, taxonomy, options, metrics);
        log.info("Connection graph initialized backend={} options={}",
                connection != null ? "falkordb:" + connection.getGraphName() : "memory", options);
    }

    public ConnectionService service() {
        return service;
    }

    public TaxonomyStore taxonomy() {
        return taxonomy;
    }

    public StatsAggregator stats() {
        return stats;
    }

    public ConnectionOptions options() {
        return options;
    }

    @Override
    public void close() {
        if (ownsConnection && connection != null) {
            connection.close();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private GraphConnection connection;
        private boolean ownsConnection = false;
        private boolean createIndexes = true;
        private TaxonomyStore taxonomyStore;
        private boolean seedDefaultTaxonomy = false;
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private IdentityDirectory identityDirectory;
        private NotificationSender notificationSender;
        private MetricsService metricsService;
        private ConnectionOptions options = ConnectionOptions.defaults();

        /**
         * Uses an existing graph connection. The caller keeps ownership.
         */
        public Builder graphConnection(GraphConnection connection) {
            this.connection = connection;
            this.ownsConnection = false;
            return this;
        }

        /**
         * Opens a FalkorDB connection that is closed together with this graph.
         */
        public Builder falkorDB(String host, int port, String graphName) {
            this.connection = new FalkorDBConnection(host, port, graphName);
            this.ownsConnection = true;
            return this;
        }

        public Builder createIndexes(boolean createIndexes) {
            this.createIndexes = createIndexes;
            return this;
        }

        /**
         * Overrides the taxonomy store chosen by the backend.
         */
        public Builder taxonomyStore(TaxonomyStore taxonomyStore) {
            this.taxonomyStore = taxonomyStore;
            return this;
        }

        /**
         * Seeds the bundled taxonomy on build. Seeding is idempotent.
         */
        public Builder seedDefaultTaxonomy(boolean seedDefaultTaxonomy) {
            this.seedDefaultTaxonomy = seedDefaultTaxonomy;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder identityDirectory(IdentityDirectory identityDirectory) {
            this.identityDirectory = identityDirectory;
            return this;
        }

        public Builder notificationSender(NotificationSender notificationSender) {
            this.notificationSender = notificationSender;
            return this;
        }

        /**
         * Defaults to {@link NoOpMetricsService}.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder options(ConnectionOptions options) {
            this.options = options;
            return this;
        }

        public ConnectionGraph build() {
            return new ConnectionGraph(this);
        }
    }
}
