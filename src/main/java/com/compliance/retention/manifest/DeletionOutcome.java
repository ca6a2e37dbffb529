package com.compliance.retention.manifest;

import java.util.Objects;

/**
 * Verified result of deleting one category.
 *
 * @param category          the data category
 * @param expectedDeletions expired records counted just before deletion
 * @param actualDeletions   expected minus the records still present afterwards
 * @param reportedDeletions count returned by the store's delete call; -1 when the call never returned
 * @param success           true iff the deletion completed and no expired record remains
 * @param remainingRecords  expired records left after deletion; -1 when verification did not run
 * @param error             failure description, null on success
 */
public record DeletionOutcome(
        String category,
        long expectedDeletions,
        long actualDeletions,
        long reportedDeletions,
        boolean success,
        long remainingRecords,
        String error
) {
    /** Marks an outcome whose verification never ran. */
    public static final long NOT_VERIFIED = -1;

    /** Marks an outcome whose store delete call never returned a count. */
    public static final long NOT_REPORTED = -1;

    public DeletionOutcome {
        Objects.requireNonNull(category, "category is required");
        if (success && remainingRecords != 0) {
            throw new IllegalArgumentException("a successful outcome cannot leave records behind");
        }
    }

    /**
     * Outcome of a deletion whose verification ran.
     */
    public static DeletionOutcome verified(String category, long expected, long reported, long remaining) {
        boolean success = remaining == 0;
        return new DeletionOutcome(category, expected, expected - remaining, reported, success, remaining,
                success ? null : remaining + " expired records remain after deletion");
    }

    public static DeletionOutcome verified(String category, long expected, long remaining) {
        return verified(category, expected, NOT_REPORTED, remaining);
    }

    /**
     * Outcome of a category that errored, recounted afterwards.
     * It never succeeds, even when nothing expired remains.
     */
    public static DeletionOutcome recounted(String category, long expected, long remaining, String error) {
        return new DeletionOutcome(category, expected, Math.max(0, expected - remaining), NOT_REPORTED,
                false, remaining, error != null ? error : "deletion failed");
    }

    /**
     * Outcome of a category that errored before verification.
     */
    public static DeletionOutcome failed(String category, long expected, String error) {
        return new DeletionOutcome(category, expected, 0, NOT_REPORTED, false, NOT_VERIFIED,
                error != null ? error : "deletion failed");
    }

    /**
     * True when the store reported a count that differs from the verified deletions.
     */
    public boolean countMismatch() {
        return reportedDeletions != NOT_REPORTED && remainingRecords != NOT_VERIFIED
                && reportedDeletions != actualDeletions;
    }
}
