package com.compliance.retention.pipeline;

import com.compliance.retention.RetentionAbortedException;
import com.compliance.retention.anonymize.AnonymizationOutcome;
import com.compliance.retention.anonymize.Anonymizer;
import com.compliance.retention.audit.AuditAction;
import com.compliance.retention.audit.AuditRepository;
import com.compliance.retention.audit.AuditService;
import com.compliance.retention.audit.GraphAuditRepository;
import com.compliance.retention.audit.InMemoryAuditRepository;
import com.compliance.retention.deletion.DeletionExecutor;
import com.compliance.retention.deletion.DeletionResult;
import com.compliance.retention.graph.FalkorDBConnection;
import com.compliance.retention.graph.GraphConnection;
import com.compliance.retention.hold.GraphLegalHoldStore;
import com.compliance.retention.hold.HoldFilter;
import com.compliance.retention.hold.HoldFilterResult;
import com.compliance.retention.hold.InMemoryLegalHoldStore;
import com.compliance.retention.hold.LegalHoldStore;
import com.compliance.retention.lock.LocalRetentionLock;
import com.compliance.retention.lock.LockAcquisitionException;
import com.compliance.retention.lock.RetentionLock;
import com.compliance.retention.logging.LogContext;
import com.compliance.retention.manifest.DeletionManifest;
import com.compliance.retention.manifest.GraphManifestRepository;
import com.compliance.retention.manifest.InMemoryManifestRepository;
import com.compliance.retention.manifest.ManifestBuilder;
import com.compliance.retention.manifest.ManifestRepository;
import com.compliance.retention.metrics.NoOpRetentionMetrics;
import com.compliance.retention.metrics.RetentionMetrics;
import com.compliance.retention.policy.RetentionConfiguration;
import com.compliance.retention.report.ComplianceNotifier;
import com.compliance.retention.report.ComplianceReport;
import com.compliance.retention.report.ComplianceReporter;
import com.compliance.retention.report.GraphReportRepository;
import com.compliance.retention.report.InMemoryReportRepository;
import com.compliance.retention.report.LoggingComplianceNotifier;
import com.compliance.retention.report.NotificationPayload;
import com.compliance.retention.report.ReportRepository;
import com.compliance.retention.scan.ExpirationRecord;
import com.compliance.retention.scan.ExpirationScanner;
import com.compliance.retention.store.GraphRecordStore;
import com.compliance.retention.store.RecordStore;
import com.compliance.retention.tracing.NoOpTracingService;
import com.compliance.retention.tracing.RetentionSpan;
import com.compliance.retention.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Entry point of the retention pipeline.
 *
 * <p>A cycle runs scan, hold filter, anonymization, manifest, deletion, report
 * and notification strictly in that order, every stage seeing the same reference
 * time. Only one cycle runs at a time.</p>
 *
 * <p>Usage:</p>
 * <pre>
 * try (RetentionPipeline pipeline = RetentionPipeline.builder()
 *         .falkorDB("localhost", 6379, "retention")
 *         .build()) {
 *     ComplianceReport report = pipeline.runCycle(RetentionConfiguration.defaults());
 * }
 * </pre>
 *
 * <p>A cycle that cannot read legal holds or store its manifest throws a
 * {@link RetentionAbortedException} before deleting anything. Every other
 * failure is confined to its category and shows up as a
 * {@link com.compliance.retention.report.ComplianceStatus#NEEDS_ATTENTION} report.</p>
 */
public class RetentionPipeline implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RetentionPipeline.class);

    private final GraphConnection connection;
    private final boolean ownsConnection;
    private final RetentionConfiguration defaultConfiguration;
    private final Clock clock;
    private final RetentionLock lock;
    private final CategoryTaskRunner runner;
    private final AuditService auditService;
    private final RetentionMetrics metrics;
    private final TracingService tracingService;
    private final ComplianceNotifier notifier;
    private final ManifestRepository manifestRepository;
    private final ReportRepository reportRepository;

    private final ExpirationScanner scanner;
    private final HoldFilter holdFilter;
    private final Anonymizer anonymizer;
    private final ManifestBuilder manifestBuilder;
    private final DeletionExecutor deletionExecutor;
    private final ComplianceReporter reporter;

    private RetentionPipeline(Builder builder) {
        this.connection = builder.connection;
        this.ownsConnection = builder.ownsConnection;
        this.defaultConfiguration = builder.configuration;
        this.clock = builder.clock;
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpRetentionMetrics();
        this.tracingService = builder.tracingService != null ? builder.tracingService : new NoOpTracingService();
        this.notifier = builder.notifier != null ? builder.notifier : new LoggingComplianceNotifier();
        this.lock = builder.lock != null ? builder.lock : new LocalRetentionLock();
        this.runner = new CategoryTaskRunner(builder.options, tracingService);

        boolean graph = connection != null;
        RecordStore recordStore = builder.recordStore != null
                ? builder.recordStore : new GraphRecordStore(connection, builder.options.deleteBatchSize());
        LegalHoldStore holdStore = builder.holdStore != null
                ? builder.holdStore : graph ? new GraphLegalHoldStore(connection) : new InMemoryLegalHoldStore();
        this.manifestRepository = builder.manifestRepository != null
                ? builder.manifestRepository
                : graph ? new GraphManifestRepository(connection) : new InMemoryManifestRepository();
        this.reportRepository = builder.reportRepository != null
                ? builder.reportRepository
                : graph ? new GraphReportRepository(connection) : new InMemoryReportRepository();

        if (builder.auditService != null) {
            this.auditService = builder.auditService;
        } else {
            AuditRepository auditRepository = builder.auditRepository != null
                    ? builder.auditRepository
                    : graph ? new GraphAuditRepository(connection) : new InMemoryAuditRepository();
            this.auditService = new AuditService(auditRepository, clock);
        }

        this.scanner = new ExpirationScanner(recordStore, runner, auditService, metrics);
        this.holdFilter = new HoldFilter(holdStore, auditService, metrics);
        this.anonymizer = new Anonymizer(recordStore, runner, auditService, metrics);
        this.manifestBuilder = new ManifestBuilder(manifestRepository, lock, auditService);
        this.deletionExecutor = new DeletionExecutor(recordStore, manifestRepository, lock, runner,
                auditService, metrics, clock);
        this.reporter = new ComplianceReporter(reportRepository, auditService);

        log.info("retention.pipeline.initialized store={} maxConcurrency={} categoryTimeout={}",
                recordStore.getClass().getSimpleName(), builder.options.maxConcurrency(),
                builder.options.categoryTimeout());
    }

    /**
     * Runs a cycle with the configured policies at the current time.
     */
    public ComplianceReport runCycle() {
        return runCycle(defaultConfiguration);
    }

    /**
     * Runs a cycle at the current time of the configured clock.
     */
    public ComplianceReport runCycle(RetentionConfiguration configuration) {
        return runCycle(configuration, clock.instant());
    }

    /**
     * Runs a full retention cycle.
     *
     * @param configuration policies and anonymization profiles for this cycle
     * @param now           reference time for every age computation of the cycle
     * @return the compliance report; stored unless report storage failed
     * @throws RetentionAbortedException if holds or the manifest could not be handled;
     *                                   nothing was deleted
     * @throws LockAcquisitionException  if another cycle holds the run lock
     */
    public ComplianceReport runCycle(RetentionConfiguration configuration, Instant now) {
        String runId = LogContext.generateRunId();
        long startNanos = System.nanoTime();

        try (LogContext ctx = LogContext.forRun(runId);
             RetentionSpan span = tracingService.startRun(runId)) {
            lockRun(runId);
            try {
                ComplianceReport report = execute(configuration, now, runId);
                span.runFinished(report.status().name(), report.totalDeleted());
                span.succeeded();
                metrics.recordRunDuration(report.status().name(), Duration.ofNanos(System.nanoTime() - startNanos));
                return report;
            } catch (RetentionAbortedException e) {
                span.failed(e);
                metrics.incrementRunAborted(e.reason());
                metrics.recordRunDuration("ABORTED", Duration.ofNanos(System.nanoTime() - startNanos));
                auditService.record(AuditAction.RUN_ABORTED, runId, Map.of(
                        "reason", e.reason(),
                        "error", String.valueOf(e.getMessage())
                ));
                log.error("retention.run.aborted reason={} error={}", e.reason(), e.getMessage(), e);
                throw e;
            } finally {
                lock.unlock(RetentionLock.RUN_KEY);
            }
        }
    }

    private ComplianceReport execute(RetentionConfiguration configuration, Instant now, String runId) {
        log.info("retention.run.starting now={} policies={} profiles={}",
                now, configuration.policies().size(), configuration.profiles().size());
        auditService.record(AuditAction.RUN_STARTED, runId, Map.of(
                "now", now.toString(),
                "categories", configuration.policies().categories().stream().toList()
        ));

        Map<String, ExpirationRecord> expired = stage(PipelineStage.SCAN, runId,
                () -> scanner.scan(configuration.policies(), now, runId));
        HoldFilterResult filtered = stage(PipelineStage.HOLD_FILTER, runId,
                () -> holdFilter.apply(expired, now, runId));
        Map<String, AnonymizationOutcome> anonymization = stage(PipelineStage.ANONYMIZE, runId,
                () -> anonymizer.anonymize(filtered.eligible(), configuration.profiles(), now, runId));
        DeletionManifest manifest = stage(PipelineStage.MANIFEST, runId,
                () -> manifestBuilder.create(filtered.eligible(), anonymization, now, runId));
        DeletionResult deletion = stage(PipelineStage.DELETE, runId,
                () -> deletionExecutor.execute(manifest, now, runId));
        ComplianceReport report = stage(PipelineStage.REPORT, runId,
                () -> reporter.report(deletion.manifest(), deletion.outcomes(), filtered.holdsByCategory(), now, runId));
        stage(PipelineStage.NOTIFY, runId, () -> notify(report));

        log.info("retention.run.completed status={} manifestId={} deleted={} failed={}",
                report.status(), report.manifestId(), report.totalDeleted(), report.failedCount());
        return report;
    }

    private <T> T stage(PipelineStage stage, String runId, Supplier<T> work) {
        try (RetentionSpan span = tracingService.startStage(runId, stage.label())) {
            try {
                T result = work.get();
                span.succeeded();
                return result;
            } catch (RuntimeException e) {
                span.failed(e);
                throw e;
            }
        }
    }

    private NotificationPayload notify(ComplianceReport report) {
        NotificationPayload payload = NotificationPayload.from(report);
        try {
            notifier.send(payload);
        } catch (RuntimeException e) {
            log.error("retention.notification.failed subject=\"{}\" error={}", payload.subject(), e.getMessage(), e);
        }
        return payload;
    }

    private void lockRun(String runId) {
        try {
            lock.tryLock(RetentionLock.RUN_KEY);
        } catch (LockAcquisitionException e) {
            metrics.incrementRunAborted("run-locked");
            log.warn("retention.run.rejected reason=run-locked error={}", e.getMessage());
            throw e;
        }
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public TracingService getTracingService() {
        return tracingService;
    }

    public ManifestRepository getManifestRepository() {
        return manifestRepository;
    }

    public ReportRepository getReportRepository() {
        return reportRepository;
    }

    @Override
    public void close() {
        runner.close();
        if (ownsConnection && connection != null) {
            try {
                connection.close();
            } catch (RuntimeException e) {
                log.warn("retention.pipeline.close.failed error={}", e.getMessage(), e);
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private GraphConnection connection;
        private boolean ownsConnection = false;
        private RecordStore recordStore;
        private LegalHoldStore holdStore;
        private ManifestRepository manifestRepository;
        private ReportRepository reportRepository;
        private AuditRepository auditRepository;
        private AuditService auditService;
        private RetentionLock lock;
        private RetentionMetrics metrics;
        private TracingService tracingService;
        private ComplianceNotifier notifier;
        private PipelineOptions options = PipelineOptions.defaults();
        private RetentionConfiguration configuration = RetentionConfiguration.defaults();
        private Clock clock = Clock.systemUTC();

        /**
         * Backs every store not set explicitly with the given graph.
         */
        public Builder graphConnection(GraphConnection connection) {
            this.connection = connection;
            this.ownsConnection = false;
            return this;
        }

        /**
         * Opens a FalkorDB connection owned, and closed, by the pipeline.
         */
        public Builder falkorDB(String host, int port, String graphName) {
            this.connection = new FalkorDBConnection(host, port, graphName);
            this.ownsConnection = true;
            return this;
        }

        public Builder recordStore(RecordStore recordStore) {
            this.recordStore = recordStore;
            return this;
        }

        public Builder legalHoldStore(LegalHoldStore holdStore) {
            this.holdStore = holdStore;
            return this;
        }

        public Builder manifestRepository(ManifestRepository manifestRepository) {
            this.manifestRepository = manifestRepository;
            return this;
        }

        public Builder reportRepository(ReportRepository reportRepository) {
            this.reportRepository = reportRepository;
            return this;
        }

        public Builder auditRepository(AuditRepository auditRepository) {
            this.auditRepository = auditRepository;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder retentionLock(RetentionLock lock) {
            this.lock = lock;
            return this;
        }

        public Builder metrics(RetentionMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder notifier(ComplianceNotifier notifier) {
            this.notifier = notifier;
            return this;
        }

        public Builder options(PipelineOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Sets the configuration used by {@link #runCycle()}.
         */
        public Builder configuration(RetentionConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public RetentionPipeline build() {
            if (connection == null && recordStore == null) {
                throw new IllegalStateException("A RecordStore or a GraphConnection is required");
            }
            if (options == null || configuration == null || clock == null) {
                throw new IllegalStateException("options, configuration and clock must not be null");
            }
            return new RetentionPipeline(this);
        }
    }
}
