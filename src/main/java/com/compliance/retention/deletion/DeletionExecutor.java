package com.compliance.retention.deletion;

import com.compliance.retention.audit.AuditAction;
import com.compliance.retention.audit.AuditService;
import com.compliance.retention.lock.RetentionLock;
import com.compliance.retention.manifest.DeletionManifest;
import com.compliance.retention.manifest.DeletionOutcome;
import com.compliance.retention.manifest.ManifestEntry;
import com.compliance.retention.manifest.ManifestRepository;
import com.compliance.retention.metrics.RetentionMetrics;
import com.compliance.retention.pipeline.CategoryResult;
import com.compliance.retention.pipeline.CategoryTaskRunner;
import com.compliance.retention.pipeline.PipelineStage;
import com.compliance.retention.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Deletes the categories of a stored manifest and verifies each deletion by recount.
 *
 * <p>For each category the expired records are counted, deleted, and counted
 * again with the same cutoff. The deletion succeeded iff nothing expired remains.
 * Failures stay confined to their category; a failed or timed-out category is
 * recounted so deletions that did happen are still recorded. Once every category
 * has resolved the manifest is finalised in a single write.</p>
 */
public class DeletionExecutor {
    private static final Logger log = LoggerFactory.getLogger(DeletionExecutor.class);

    private final RecordStore store;
    private final ManifestRepository manifestRepository;
    private final RetentionLock lock;
    private final CategoryTaskRunner runner;
    private final AuditService auditService;
    private final RetentionMetrics metrics;
    private final Clock clock;

    public DeletionExecutor(RecordStore store, ManifestRepository manifestRepository, RetentionLock lock,
                            CategoryTaskRunner runner, AuditService auditService,
                            RetentionMetrics metrics, Clock clock) {
        this.store = store;
        this.manifestRepository = manifestRepository;
        this.lock = lock;
        this.runner = runner;
        this.auditService = auditService;
        this.metrics = metrics;
        this.clock = clock;
    }

    public DeletionResult execute(DeletionManifest manifest, Instant now) {
        return execute(manifest, now, null);
    }

    /**
     * Deletes every manifest category and finalises the manifest.
     *
     * @param manifest the stored, pending manifest
     * @param now      the run's reference time; cutoffs are derived from it
     * @return the outcomes and the manifest as it was left; still pending if finalisation failed
     */
    public DeletionResult execute(DeletionManifest manifest, Instant now, String runId) {
        Objects.requireNonNull(manifest.manifestId(), "manifest must be persisted before deletion");
        if (!manifest.isPending()) {
            throw new IllegalStateException("Manifest " + manifest.manifestId() + " is already " + manifest.status());
        }
        Map<String, ManifestEntry> entries = new LinkedHashMap<>();
        manifest.categories().forEach(entry -> entries.put(entry.category(), entry));
        log.info("retention.delete.starting manifestId={} categories={}", manifest.manifestId(), entries.keySet());

        Map<String, CategoryResult<DeletionOutcome>> results = runner.runAll(
                PipelineStage.DELETE.label(), runId, entries.keySet(),
                category -> deleteCategory(entries.get(category), now));

        Map<String, DeletionOutcome> outcomes = new LinkedHashMap<>();
        results.forEach((category, result) -> {
            DeletionOutcome outcome = result.isSuccess()
                    ? result.value()
                    : recount(entries.get(category), now, result.errorMessage());
            outcomes.put(category, outcome);
            recordOutcome(manifest.manifestId(), outcome, result, runId);
        });

        return new DeletionResult(finalise(manifest, outcomes, runId), outcomes);
    }

    private DeletionOutcome deleteCategory(ManifestEntry entry, Instant now) {
        String category = entry.category();
        Instant cutoff = now.minus(entry.retentionPeriod());
        long expected = store.countExpired(category, cutoff);
        if (expected == 0) {
            log.debug("retention.delete.nothing category={} cutoff={}", category, cutoff);
            return DeletionOutcome.verified(category, 0, 0, 0);
        }
        long reported = store.deleteExpired(category, cutoff);
        long remaining = store.countExpired(category, cutoff);
        log.debug("retention.delete.category category={} expected={} reported={} remaining={}",
                category, expected, reported, remaining);
        return DeletionOutcome.verified(category, expected, reported, remaining);
    }

    /**
     * Counts what is left of a category whose task failed. The delete call may have
     * gone through before the failure, so the planned count minus the remainder is
     * recorded as deleted. Falls back to an unverified outcome if the count fails too.
     */
    private DeletionOutcome recount(ManifestEntry entry, Instant now, String error) {
        String category = entry.category();
        try {
            long remaining = store.countExpired(category, now.minus(entry.retentionPeriod()));
            return DeletionOutcome.recounted(category, entry.recordsToDelete(), remaining, error);
        } catch (RuntimeException e) {
            log.warn("retention.delete.recount.failed category={} error={}", category, e.getMessage());
            return DeletionOutcome.failed(category, entry.recordsToDelete(), error);
        }
    }

    private void recordOutcome(String manifestId, DeletionOutcome outcome,
                               CategoryResult<DeletionOutcome> result, String runId) {
        String category = outcome.category();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("manifestId", manifestId);
        details.put("expectedDeletions", outcome.expectedDeletions());
        details.put("actualDeletions", outcome.actualDeletions());
        details.put("reportedDeletions", outcome.reportedDeletions());
        details.put("remainingRecords", outcome.remainingRecords());
        details.put("error", outcome.error());

        if (outcome.countMismatch()) {
            log.warn("retention.delete.count.mismatch category={} reported={} actual={}",
                    category, outcome.reportedDeletions(), outcome.actualDeletions());
        }
        if (outcome.success()) {
            metrics.recordRecordsDeleted(category, outcome.actualDeletions());
            auditService.record(AuditAction.CATEGORY_DELETED, runId, category, details);
            log.info("retention.delete.completed category={} deleted={}", category, outcome.actualDeletions());
            return;
        }
        if (outcome.actualDeletions() > 0) {
            metrics.recordRecordsDeleted(category, outcome.actualDeletions());
        }
        metrics.incrementCategoryFailure(PipelineStage.DELETE.label(), category);
        auditService.record(AuditAction.CATEGORY_DELETION_FAILED, runId, category, details);
        if (result.isSuccess()) {
            log.warn("retention.delete.incomplete category={} expected={} remaining={}",
                    category, outcome.expectedDeletions(), outcome.remainingRecords());
        } else {
            log.error("retention.delete.failed category={} error={}", category, outcome.error(), result.error());
        }
    }

    private DeletionManifest finalise(DeletionManifest manifest, Map<String, DeletionOutcome> outcomes, String runId) {
        Instant completedAt = clock.instant();
        try {
            DeletionManifest finalised = lock.withLock(RetentionLock.MANIFEST_KEY,
                    () -> manifestRepository.finalise(manifest.manifestId(), outcomes, completedAt));
            auditService.record(AuditAction.MANIFEST_FINALIZED, runId, Map.of(
                    "manifestId", finalised.manifestId(),
                    "status", finalised.status().name(),
                    "actualDeletions", finalised.actualDeletions()
            ));
            log.info("retention.manifest.finalised manifestId={} status={} actualDeletions={}",
                    finalised.manifestId(), finalised.status(), finalised.actualDeletions());
            return finalised;
        } catch (RuntimeException e) {
            // deletions already happened; the manifest stays PENDING as evidence of an unfinished record
            log.error("retention.manifest.finalise.failed manifestId={} error={}",
                    manifest.manifestId(), e.getMessage(), e);
            auditService.record(AuditAction.MANIFEST_FINALIZE_FAILED, runId, Map.of(
                    "manifestId", manifest.manifestId(),
                    "error", String.valueOf(e.getMessage())
            ));
            return manifest;
        }
    }
}
