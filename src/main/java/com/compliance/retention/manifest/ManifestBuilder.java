package com.compliance.retention.manifest;

import com.compliance.retention.anonymize.AnonymizationOutcome;
import com.compliance.retention.audit.AuditAction;
import com.compliance.retention.audit.AuditService;
import com.compliance.retention.lock.RetentionLock;
import com.compliance.retention.scan.ExpirationRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds and persists the deletion manifest of a cycle.
 *
 * <p>Categories whose anonymization failed are left out: their personal data was
 * not scrubbed, so they are not deleted this cycle. The manifest is written once,
 * under {@link RetentionLock#MANIFEST_KEY}, before any deletion starts.</p>
 */
public class ManifestBuilder {
    private static final Logger log = LoggerFactory.getLogger(ManifestBuilder.class);

    private final ManifestRepository repository;
    private final RetentionLock lock;
    private final AuditService auditService;

    public ManifestBuilder(ManifestRepository repository, RetentionLock lock, AuditService auditService) {
        this.repository = repository;
        this.lock = lock;
        this.auditService = auditService;
    }

    public DeletionManifest create(Map<String, ExpirationRecord> eligible,
                                   Map<String, AnonymizationOutcome> anonymization, Instant now) {
        return create(eligible, anonymization, now, null);
    }

    /**
     * Builds the pending manifest and stores it.
     *
     * @return the stored manifest with its id
     * @throws ManifestPersistException if the manifest cannot be stored
     */
    public DeletionManifest create(Map<String, ExpirationRecord> eligible,
                                   Map<String, AnonymizationOutcome> anonymization, Instant now,
                                   String runId) {
        List<ManifestEntry> entries = new ArrayList<>();
        eligible.forEach((category, record) -> {
            AnonymizationOutcome outcome = anonymization.get(category);
            if (outcome != null && !outcome.success()) {
                log.warn("retention.manifest.excluded category={} reason=anonymization-failed", category);
                return;
            }
            entries.add(new ManifestEntry(category, record.expiredCount(), record.retentionPeriod(),
                    record.oldestRecordTimestamp(), record.newestExpiredTimestamp(), outcome != null));
        });

        DeletionManifest pending = DeletionManifest.pending(now, entries);
        DeletionManifest stored;
        try {
            stored = lock.withLock(RetentionLock.MANIFEST_KEY, () -> repository.create(pending));
        } catch (RuntimeException e) {
            throw new ManifestPersistException("Deletion manifest could not be persisted: " + e.getMessage(), e);
        }

        auditService.record(AuditAction.MANIFEST_CREATED, runId, Map.of(
                "manifestId", stored.manifestId(),
                "categories", stored.categoryNames(),
                "totalRecordsToDelete", stored.totalRecordsToDelete(),
                "anonymizationPerformed", stored.anonymizationPerformed()
        ));
        log.info("retention.manifest.created manifestId={} categories={} totalRecordsToDelete={}",
                stored.manifestId(), stored.categories().size(), stored.totalRecordsToDelete());
        return stored;
    }
}
