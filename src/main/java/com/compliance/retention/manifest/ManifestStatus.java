package com.compliance.retention.manifest;

/**
 * Lifecycle of a deletion manifest. A manifest leaves PENDING exactly once.
 */
public enum ManifestStatus {
    /** Created; deletions may be in progress. */
    PENDING,
    /** Every category was deleted and verified. */
    COMPLETED,
    /** At least one category failed or left records behind. */
    PARTIAL
}
