package com.social.connection.cdi;

import com.social.connection.api.ConnectionGraph;
import com.social.connection.api.ConnectionOptions;
import com.social.connection.api.ConnectionService;
import com.social.connection.cache.CacheConfig;
import com.social.connection.metrics.MetricsService;
import com.social.connection.metrics.MicrometerMetricsService;
import com.social.connection.metrics.NoOpMetricsService;
import com.social.connection.notification.HttpNotificationSender;
import com.social.connection.notification.IdentityDirectory;
import com.social.connection.notification.NoOpNotificationSender;
import com.social.connection.notification.NotificationSender;
import com.social.connection.taxonomy.TaxonomyStore;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * CDI producer that wires the connection engine from MicroProfile Config properties.
 *
 * <pre>
 * connection-graph:
 *   storage: falkordb
 *   falkordb:
 *     host: localhost
 *     port: 6379
 *     graph-name: connections
 *   v2-enabled: true
 *   max-modifications: 5
 *   notification:
 *     base-url: http://notifications:8080
 * </pre>
 *
 * <p>A {@link MeterRegistry} bean, when present, switches metrics to Micrometer. An
 * {@link IdentityDirectory} bean, when present, enables notification addressing.</p>
 */
@ApplicationScoped
public class ConnectionGraphProducer {

    private static final Logger log = LoggerFactory.getLogger(ConnectionGraphProducer.class);

    // ── Storage ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "connection-graph.storage", defaultValue = "memory")
    String storage;

    @Inject
    @ConfigProperty(name = "connection-graph.falkordb.host", defaultValue = "localhost")
    String falkordbHost;

    @Inject
    @ConfigProperty(name = "connection-graph.falkordb.port", defaultValue = "6379")
    int falkordbPort;

    @Inject
    @ConfigProperty(name = "connection-graph.falkordb.graph-name", defaultValue = "connections")
    String falkordbGraphName;

    // ── Engine ────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "connection-graph.v2-enabled", defaultValue = "true")
    boolean v2Enabled;

    @Inject
    @ConfigProperty(name = "connection-graph.max-modifications", defaultValue = "5")
    int maxModifications;

    @Inject
    @ConfigProperty(name = "connection-graph.refresh-stats-on-create", defaultValue = "true")
    boolean refreshStatsOnCreate;

    @Inject
    @ConfigProperty(name = "connection-graph.taxonomy.seed-defaults", defaultValue = "true")
    boolean seedDefaultTaxonomy;

    // ── Notifications ─────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "connection-graph.notification.enabled", defaultValue = "true")
    boolean notificationsEnabled;

    @Inject
    @ConfigProperty(name = "connection-graph.notification.base-url")
    Optional<String> notificationBaseUrl;

    @Inject
    @ConfigProperty(name = "connection-graph.notification.timeout-seconds", defaultValue = "10")
    int notificationTimeoutSeconds;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "connection-graph.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "connection-graph.cache.max-size", defaultValue = "1000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "connection-graph.cache.ttl-seconds", defaultValue = "600")
    int cacheTtlSeconds;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    @Inject
    Instance<IdentityDirectory> identityDirectory;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public ConnectionGraph connectionGraph() {
        ConnectionOptions options = ConnectionOptions.builder()
                .v2Enabled(v2Enabled)
                .maxModifications(maxModifications)
                .notificationsEnabled(notificationsEnabled)
                .refreshStatsOnCreate(refreshStatsOnCreate)
                .build();

        ConnectionGraph.Builder builder = ConnectionGraph.builder()
                .options(options)
                .seedDefaultTaxonomy(seedDefaultTaxonomy)
                .cacheConfig(cacheEnabled
                        ? new CacheConfig(cacheMaxSize, cacheTtlSeconds, true)
                        : CacheConfig.disabled())
                .metricsService(createMetricsService())
                .notificationSender(createNotificationSender());

        if (identityDirectory != null && identityDirectory.isResolvable()) {
            builder.identityDirectory(identityDirectory.get());
        }

        if ("falkordb".equalsIgnoreCase(storage)) {
            log.info("Producing ConnectionGraph: falkordb={}:{}/{}", falkordbHost, falkordbPort, falkordbGraphName);
            builder.falkorDB(falkordbHost, falkordbPort, falkordbGraphName);
        } else {
            if (!"memory".equalsIgnoreCase(storage)) {
                log.warn("Unknown storage '{}', falling back to in-memory stores", storage);
            }
            log.info("Producing ConnectionGraph: in-memory stores");
        }
        return builder.build();
    }

    public void closeConnectionGraph(@Disposes ConnectionGraph graph) {
        log.info("Closing ConnectionGraph");
        graph.close();
    }

    @Produces
    @ApplicationScoped
    public ConnectionService connectionService(ConnectionGraph graph) {
        return graph.service();
    }

    @Produces
    @ApplicationScoped
    public TaxonomyStore taxonomyStore(ConnectionGraph graph) {
        return graph.taxonomy();
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    private MetricsService createMetricsService() {
        if (meterRegistry != null && meterRegistry.isResolvable()) {
            log.info("Recording connection metrics with Micrometer");
            return new MicrometerMetricsService(meterRegistry.get());
        }
        return new NoOpMetricsService();
    }

    private NotificationSender createNotificationSender() {
        if (!notificationsEnabled || notificationBaseUrl.isEmpty() || notificationBaseUrl.get().isBlank()) {
            log.info("Push notifications disabled");
            return new NoOpNotificationSender();
        }
        log.info("Push notifications enabled: baseUrl={}", notificationBaseUrl.get());
        return HttpNotificationSender.builder()
                .baseUrl(notificationBaseUrl.get())
                .timeout(Duration.ofSeconds(notificationTimeoutSeconds))
                .build();
    }
}
