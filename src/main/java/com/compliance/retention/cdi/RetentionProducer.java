package com.compliance.retention.cdi;

import com.compliance.retention.graph.FalkorDBConnection;
import com.compliance.retention.graph.GraphConnection;
import com.compliance.retention.lock.GraphRetentionLock;
import com.compliance.retention.lock.LocalRetentionLock;
import com.compliance.retention.lock.LockConfig;
import com.compliance.retention.lock.RetentionLock;
import com.compliance.retention.metrics.MicrometerRetentionMetrics;
import com.compliance.retention.metrics.NoOpRetentionMetrics;
import com.compliance.retention.metrics.RetentionMetrics;
import com.compliance.retention.pipeline.PipelineOptions;
import com.compliance.retention.pipeline.RetentionPipeline;
import com.compliance.retention.policy.RetentionConfigLoader;
import com.compliance.retention.policy.RetentionConfiguration;
import com.compliance.retention.tracing.NoOpTracingService;
import com.compliance.retention.tracing.OpenTelemetryTracingService;
import com.compliance.retention.tracing.TracingService;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * CDI producer that wires the retention pipeline from MicroProfile Config properties.
 *
 * <pre>
 * retention.falkordb.host=localhost
 * retention.falkordb.port=6379
 * retention.falkordb.graph-name=retention
 * retention.policies.location=/etc/retention/policies.json
 * </pre>
 *
 * <p>Without {@code retention.policies.location} the bundled default policy table is used.
 * A {@link MeterRegistry} bean, when present, receives the pipeline metrics.</p>
 */
@ApplicationScoped
public class RetentionProducer {

    private static final Logger log = LoggerFactory.getLogger(RetentionProducer.class);

    // ── FalkorDB ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "retention.falkordb.host", defaultValue = "localhost")
    String falkordbHost;

    @Inject
    @ConfigProperty(name = "retention.falkordb.port", defaultValue = "6379")
    int falkordbPort;

    @Inject
    @ConfigProperty(name = "retention.falkordb.graph-name", defaultValue = "retention")
    String falkordbGraphName;

    // ── Pipeline ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "retention.pipeline.max-concurrency", defaultValue = "4")
    int maxConcurrency;

    @Inject
    @ConfigProperty(name = "retention.pipeline.category-timeout-seconds", defaultValue = "300")
    long categoryTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "retention.pipeline.delete-batch-size", defaultValue = "1000")
    int deleteBatchSize;

    // ── Policies ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "retention.policies.location")
    Optional<String> policiesLocation;

    // ── Locking ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "retention.lock.type", defaultValue = "local")
    String lockType;

    @Inject
    @ConfigProperty(name = "retention.lock.timeout-ms", defaultValue = "5000")
    long lockTimeoutMs;

    @Inject
    @ConfigProperty(name = "retention.lock.ttl-seconds", defaultValue = "21600")
    int lockTtlSeconds;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    @Inject
    Instance<Tracer> tracer;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public RetentionConfiguration retentionConfiguration() {
        RetentionConfigLoader loader = new RetentionConfigLoader();
        return policiesLocation
                .map(location -> loader.load(Path.of(location)))
                .orElseGet(loader::loadDefault);
    }

    @Produces
    @ApplicationScoped
    public GraphConnection graphConnection() {
        log.info("retention.producer.connection falkordb={}:{}/{}", falkordbHost, falkordbPort, falkordbGraphName);
        return new FalkorDBConnection(falkordbHost, falkordbPort, falkordbGraphName);
    }

    public void closeConnection(@Disposes GraphConnection connection) {
        connection.close();
    }

    @Produces
    @ApplicationScoped
    public RetentionPipeline retentionPipeline(GraphConnection connection, RetentionConfiguration configuration) {
        PipelineOptions options = PipelineOptions.builder()
                .maxConcurrency(maxConcurrency)
                .categoryTimeout(Duration.ofSeconds(categoryTimeoutSeconds))
                .deleteBatchSize(deleteBatchSize)
                .build();

        log.info("retention.producer.pipeline policies={} lock={} maxConcurrency={}",
                configuration.policies().size(), lockType, maxConcurrency);
        return RetentionPipeline.builder()
                .graphConnection(connection)
                .configuration(configuration)
                .options(options)
                .retentionLock(createLock(connection))
                .metrics(createMetrics())
                .tracingService(createTracing())
                .build();
    }

    public void closePipeline(@Disposes RetentionPipeline pipeline) {
        log.info("retention.producer.closing");
        pipeline.close();
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    private RetentionLock createLock(GraphConnection connection) {
        LockConfig defaults = LockConfig.defaults();
        LockConfig config = new LockConfig(lockTimeoutMs, defaults.maxRetries(), defaults.retryDelayMs(), lockTtlSeconds);
        if ("graph".equalsIgnoreCase(lockType)) {
            return new GraphRetentionLock(connection, config, Clock.systemUTC());
        }
        if (!"local".equalsIgnoreCase(lockType)) {
            log.warn("retention.producer.lock.unknown type={} fallback=local", lockType);
        }
        return new LocalRetentionLock(config);
    }

    private RetentionMetrics createMetrics() {
        if (meterRegistry != null && meterRegistry.isResolvable()) {
            return new MicrometerRetentionMetrics(meterRegistry.get());
        }
        return new NoOpRetentionMetrics();
    }

    private TracingService createTracing() {
        if (tracer != null && tracer.isResolvable()) {
            return new OpenTelemetryTracingService(tracer.get());
        }
        return new NoOpTracingService();
    }
}
