package com.compliance.retention.manifest;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Audit record written before any deletion and finalised once all deletions resolve.
 *
 * @param manifestId             id assigned by the repository; null before persistence
 * @param createdAt              the run's reference time
 * @param reason                 why records are being deleted
 * @param categories             planned deletions, in policy order
 * @param totalRecordsToDelete   sum of planned deletions; fixed at creation
 * @param anonymizationPerformed whether any planned category was anonymized first
 * @param legalHoldsChecked      whether legal holds were consulted
 * @param status                 lifecycle status
 * @param deletionResults        outcomes keyed by category; empty while pending
 * @param actualDeletions        total verified deletions; null while pending
 * @param completedAt            finalisation time; null while pending
 */
public record DeletionManifest(
        String manifestId,
        Instant createdAt,
        String reason,
        List<ManifestEntry> categories,
        long totalRecordsToDelete,
        boolean anonymizationPerformed,
        boolean legalHoldsChecked,
        ManifestStatus status,
        Map<String, DeletionOutcome> deletionResults,
        Long actualDeletions,
        Instant completedAt
) {
    public static final String REASON = "retention-policy";

    public DeletionManifest {
        Objects.requireNonNull(createdAt, "createdAt is required");
        Objects.requireNonNull(status, "status is required");
        reason = reason != null ? reason : REASON;
        categories = categories != null ? List.copyOf(categories) : List.of();
        deletionResults = deletionResults != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(deletionResults))
                : Map.of();
        if (totalRecordsToDelete < 0) {
            throw new IllegalArgumentException("totalRecordsToDelete must be >= 0");
        }
    }

    /**
     * Creates a pending manifest; the planned total is summed from the entries.
     */
    public static DeletionManifest pending(Instant createdAt, List<ManifestEntry> entries) {
        long total = entries.stream().mapToLong(ManifestEntry::recordsToDelete).sum();
        boolean anonymized = entries.stream().anyMatch(ManifestEntry::anonymized);
        return new DeletionManifest(null, createdAt, REASON, entries, total, anonymized, true,
                ManifestStatus.PENDING, Map.of(), null, null);
    }

    /**
     * COMPLETED iff every outcome succeeded; an empty set of outcomes is COMPLETED.
     */
    public static ManifestStatus statusFor(Collection<DeletionOutcome> outcomes) {
        return outcomes.stream().allMatch(DeletionOutcome::success)
                ? ManifestStatus.COMPLETED
                : ManifestStatus.PARTIAL;
    }

    public DeletionManifest withId(String id) {
        return new DeletionManifest(id, createdAt, reason, categories, totalRecordsToDelete,
                anonymizationPerformed, legalHoldsChecked, status, deletionResults, actualDeletions, completedAt);
    }

    /**
     * Returns the finalised copy of this manifest.
     *
     * @throws IllegalStateException if this manifest is no longer pending
     */
    public DeletionManifest finalise(Map<String, DeletionOutcome> results, Instant finishedAt) {
        if (status != ManifestStatus.PENDING) {
            throw new IllegalStateException("Manifest " + manifestId + " is already " + status);
        }
        long actual = results.values().stream().mapToLong(DeletionOutcome::actualDeletions).sum();
        return new DeletionManifest(manifestId, createdAt, reason, categories, totalRecordsToDelete,
                anonymizationPerformed, legalHoldsChecked, statusFor(results.values()), results, actual, finishedAt);
    }

    public boolean isPending() {
        return status == ManifestStatus.PENDING;
    }

    public List<String> categoryNames() {
        return categories.stream().map(ManifestEntry::category).toList();
    }
}
