package com.compliance.retention.report;

import com.compliance.retention.manifest.DeletionOutcome;

import java.util.Collection;

/**
 * Totals over the deletion outcomes of a cycle.
 *
 * @param tablesProcessed     categories that reached deletion
 * @param totalRecordsDeleted sum of verified deletions
 * @param successfulDeletions categories deleted without residue
 * @param failedDeletions     categories that failed or left records behind
 */
public record ProcessSummary(
        int tablesProcessed,
        long totalRecordsDeleted,
        int successfulDeletions,
        int failedDeletions
) {
    public static ProcessSummary of(Collection<DeletionOutcome> outcomes) {
        int successful = (int) outcomes.stream().filter(DeletionOutcome::success).count();
        long deleted = outcomes.stream().mapToLong(DeletionOutcome::actualDeletions).sum();
        return new ProcessSummary(outcomes.size(), deleted, successful, outcomes.size() - successful);
    }
}
