package com.compliance.retention.deletion;

import com.compliance.retention.audit.AuditAction;
import com.compliance.retention.audit.AuditEntry;
import com.compliance.retention.audit.AuditService;
import com.compliance.retention.lock.LocalRetentionLock;
import com.compliance.retention.manifest.DeletionManifest;
import com.compliance.retention.manifest.DeletionOutcome;
import com.compliance.retention.manifest.InMemoryManifestRepository;
import com.compliance.retention.manifest.ManifestEntry;
import com.compliance.retention.manifest.ManifestStatus;
import com.compliance.retention.metrics.MicrometerRetentionMetrics;
import com.compliance.retention.pipeline.CategoryTaskRunner;
import com.compliance.retention.store.InMemoryRecordStore;
import com.compliance.retention.store.StoreAccessException;
import com.compliance.retention.store.StoredRecord;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DeletionExecutor Tests")
class DeletionExecutorTest {

    private static final Instant NOW = Instant.parse("2025-06-01T00:00:00Z");
    private static final Instant FINISHED = NOW.plusSeconds(90);

    private InMemoryRecordStore store;
    private InMemoryManifestRepository manifests;
    private CategoryTaskRunner runner;
    private AuditService auditService;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        store = new InMemoryRecordStore();
        manifests = new InMemoryManifestRepository();
        runner = new CategoryTaskRunner(3, Duration.ofSeconds(5));
        auditService = new AuditService();
        registry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        runner.close();
    }

    private DeletionExecutor executor() {
        return new DeletionExecutor(store, manifests, new LocalRetentionLock(), runner, auditService,
                new MicrometerRetentionMetrics(registry), Clock.fixed(FINISHED, ZoneOffset.UTC));
    }

    private void insertAged(String category, int count, long ageDays) {
        for (int i = 0; i < count; i++) {
            store.insert(category, NOW.minus(Duration.ofDays(ageDays)), Map.of("n", i));
        }
    }

    private DeletionManifest stored(ManifestEntry... entries) {
        return manifests.create(DeletionManifest.pending(NOW, List.of(entries)));
    }

    private static ManifestEntry entry(String category, long count, long days) {
        return new ManifestEntry(category, count, Duration.ofDays(days), null, null, false);
    }

    @Nested
    @DisplayName("Verification")
    class Verification {

        @Test
        @DisplayName("Full deletion is verified and finalises the manifest as COMPLETED")
        void fullDeletion() {
            insertAged("session_data", 10, 45);
            insertAged("session_data", 3, 1);
            DeletionManifest manifest = stored(entry("session_data", 10, 30));

            DeletionResult result = executor().execute(manifest, NOW, "run-1");

            assertEquals(DeletionOutcome.verified("session_data", 10, 10, 0), result.outcomes().get("session_data"));
            assertEquals(3, store.count("session_data"));
            DeletionManifest finalised = manifests.findById(manifest.manifestId()).orElseThrow();
            assertEquals(ManifestStatus.COMPLETED, finalised.status());
            assertTrue(result.finalised());
            assertEquals(finalised, result.manifest());
            assertEquals(10L, auditService.getEntriesByAction(AuditAction.CATEGORY_DELETED).get(0)
                    .details().get("reportedDeletions"));
            assertEquals(FINISHED, finalised.completedAt());
            assertEquals(10.0, registry.find("retention.records.deleted")
                    .tag("category", "session_data").counter().count());
        }

        @Test
        @DisplayName("Expected count comes from the recount just before deleting")
        void expectedFromRecount() {
            insertAged("session_data", 12, 45);
            DeletionManifest manifest = stored(entry("session_data", 10, 30));

            DeletionOutcome outcome = executor().execute(manifest, NOW).outcomes().get("session_data");

            assertEquals(12, outcome.expectedDeletions());
            assertEquals(12, outcome.actualDeletions());
            assertEquals(10, manifests.findById(manifest.manifestId()).orElseThrow().totalRecordsToDelete());
        }

        @Test
        @DisplayName("A category already emptied by someone else succeeds without deleting")
        void nothingLeftToDelete() {
            DeletionManifest manifest = stored(entry("temp_files", 4, 7));

            DeletionOutcome outcome = executor().execute(manifest, NOW).outcomes().get("temp_files");

            assertTrue(outcome.success());
            assertEquals(0, outcome.expectedDeletions());
        }

        @Test
        @DisplayName("Records the store refuses to delete make the outcome fail")
        void blockedRecords() {
            store = new InMemoryRecordStore() {
                @Override
                protected boolean isDeletable(String category, StoredRecord record) {
                    return !"blocked".equals(record.field("state"));
                }
            };
            store.insert("audit_logs", NOW.minus(Duration.ofDays(3000)), Map.of("state", "blocked"));
            store.insert("audit_logs", NOW.minus(Duration.ofDays(3000)), Map.of("state", "free"));
            DeletionManifest manifest = stored(entry("audit_logs", 2, 2555));

            DeletionOutcome outcome = executor().execute(manifest, NOW, "run-2").outcomes().get("audit_logs");

            assertFalse(outcome.success());
            assertEquals(1, outcome.actualDeletions());
            assertEquals(1, outcome.remainingRecords());
            assertEquals(ManifestStatus.PARTIAL, manifests.findById(manifest.manifestId()).orElseThrow().status());
            List<AuditEntry> failed = auditService.getEntriesByAction(AuditAction.CATEGORY_DELETION_FAILED);
            assertEquals(1, failed.size());
            assertEquals(1L, failed.get(0).details().get("remainingRecords"));
        }
    }

    @Nested
    @DisplayName("Store reported counts")
    class ReportedCounts {

        @Test
        @DisplayName("A reported count that disagrees with the recount is kept alongside it")
        void mismatchKept() {
            store = new InMemoryRecordStore() {
                @Override
                public long deleteExpired(String category, Instant cutoff) {
                    return super.deleteExpired(category, cutoff) + 5;
                }
            };
            insertAged("temp_files", 4, 10);
            DeletionManifest manifest = stored(entry("temp_files", 4, 7));

            DeletionOutcome outcome = executor().execute(manifest, NOW, "run-6").outcomes().get("temp_files");

            assertTrue(outcome.success());
            assertEquals(4, outcome.actualDeletions());
            assertEquals(9, outcome.reportedDeletions());
            assertTrue(outcome.countMismatch());
            Map<String, Object> details = auditService.getEntriesByAction(AuditAction.CATEGORY_DELETED).get(0).details();
            assertEquals(9L, details.get("reportedDeletions"));
            assertEquals(4L, details.get("actualDeletions"));
        }
    }

    @Nested
    @DisplayName("Failure isolation")
    class Isolation {

        @Test
        @DisplayName("A store error fails its category only")
        void storeErrorIsolated() {
            store = new InMemoryRecordStore() {
                @Override
                public long deleteExpired(String category, Instant cutoff) {
                    if (category.equals("marketing_data")) {
                        throw new StoreAccessException("foreign key violation");
                    }
                    return super.deleteExpired(category, cutoff);
                }
            };
            store.insert("marketing_data", NOW.minus(Duration.ofDays(400)), Map.of());
            store.insert("backup_data", NOW.minus(Duration.ofDays(400)), Map.of());
            DeletionManifest manifest = stored(entry("marketing_data", 1, 365), entry("backup_data", 1, 365));

            Map<String, DeletionOutcome> outcomes = executor().execute(manifest, NOW).outcomes();

            assertEquals(List.of("marketing_data", "backup_data"), List.copyOf(outcomes.keySet()));
            DeletionOutcome failed = outcomes.get("marketing_data");
            assertFalse(failed.success());
            assertEquals(1, failed.expectedDeletions());
            assertEquals(0, failed.actualDeletions());
            assertEquals(1, failed.remainingRecords());
            assertEquals("foreign key violation", failed.error());
            assertTrue(outcomes.get("backup_data").success());
            assertEquals(1.0, registry.find("retention.category.failures")
                    .tag("stage", "delete").tag("category", "marketing_data").counter().count());
        }

        @Test
        @DisplayName("A finalisation failure still returns the outcomes")
        void finaliseFailure() {
            manifests = new InMemoryManifestRepository() {
                @Override
                public synchronized DeletionManifest finalise(String manifestId, Map<String, DeletionOutcome> results,
                                                              Instant completedAt) {
                    throw new StoreAccessException("write timeout");
                }
            };
            insertAged("session_data", 2, 45);
            DeletionManifest manifest = stored(entry("session_data", 2, 30));

            DeletionResult result = executor().execute(manifest, NOW, "run-4");

            assertTrue(result.outcomes().get("session_data").success());
            assertFalse(result.finalised());
            assertTrue(result.manifest().isPending());
            assertTrue(manifests.findById(manifest.manifestId()).orElseThrow().isPending());
            assertTrue(auditService.getEntriesByAction(AuditAction.MANIFEST_FINALIZED).isEmpty());
            List<AuditEntry> failed = auditService.getEntriesByAction(AuditAction.MANIFEST_FINALIZE_FAILED);
            assertEquals(1, failed.size());
            assertEquals("write timeout", failed.get(0).details().get("error"));
        }

        @Test
        @DisplayName("A deletion that finishes after its timeout is recorded from a recount")
        void timedOutDeletionRecounted() {
            runner.close();
            runner = new CategoryTaskRunner(1, Duration.ofMillis(300));
            store = new InMemoryRecordStore() {
                @Override
                public long deleteExpired(String category, Instant cutoff) {
                    long deleted = super.deleteExpired(category, cutoff);
                    try {
                        Thread.sleep(2000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return deleted;
                }
            };
            insertAged("session_data", 3, 45);
            DeletionManifest manifest = stored(entry("session_data", 3, 30));

            DeletionOutcome outcome = executor().execute(manifest, NOW, "run-5").outcomes().get("session_data");

            assertFalse(outcome.success());
            assertEquals(3, outcome.expectedDeletions());
            assertEquals(3, outcome.actualDeletions());
            assertEquals(0, outcome.remainingRecords());
            assertEquals(DeletionOutcome.NOT_REPORTED, outcome.reportedDeletions());
            assertTrue(outcome.error().contains("exceeded"));
            DeletionManifest finalised = manifests.findById(manifest.manifestId()).orElseThrow();
            assertEquals(ManifestStatus.PARTIAL, finalised.status());
            assertEquals(3L, finalised.actualDeletions());
        }

        @Test
        @DisplayName("An unreachable store leaves the failed category unverified")
        void recountFailureUnverified() {
            store = new InMemoryRecordStore() {
                private volatile boolean down;

                @Override
                public long countExpired(String category, Instant cutoff) {
                    if (down) {
                        throw new StoreAccessException("connection refused");
                    }
                    return super.countExpired(category, cutoff);
                }

                @Override
                public long deleteExpired(String category, Instant cutoff) {
                    down = true;
                    throw new StoreAccessException("connection reset");
                }
            };
            insertAged("api_logs", 2, 120);
            DeletionManifest manifest = stored(entry("api_logs", 2, 90));

            DeletionOutcome outcome = executor().execute(manifest, NOW).outcomes().get("api_logs");

            assertEquals(DeletionOutcome.failed("api_logs", 2, "connection reset"), outcome);
        }
    }

    @Nested
    @DisplayName("Preconditions")
    class Preconditions {

        @Test
        @DisplayName("Unsaved manifests are rejected")
        void unsavedRejected() {
            DeletionManifest unsaved = DeletionManifest.pending(NOW, List.of());
            assertThrows(NullPointerException.class, () -> executor().execute(unsaved, NOW));
        }

        @Test
        @DisplayName("Finalised manifests are rejected")
        void finalisedRejected() {
            DeletionManifest manifest = stored();
            DeletionManifest finalised = manifests.finalise(manifest.manifestId(), Map.of(), NOW);

            assertThrows(IllegalStateException.class, () -> executor().execute(finalised, NOW));
        }
    }
}
