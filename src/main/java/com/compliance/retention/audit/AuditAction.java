package com.compliance.retention.audit;

/**
 * Auditable decisions taken by a retention cycle.
 */
public enum AuditAction {
    RUN_STARTED,
    CATEGORY_SCAN_FAILED,
    CATEGORY_HELD,
    CATEGORY_ANONYMIZED,
    CATEGORY_ANONYMIZATION_FAILED,
    MANIFEST_CREATED,
    CATEGORY_DELETED,
    CATEGORY_DELETION_FAILED,
    MANIFEST_FINALIZED,
    MANIFEST_FINALIZE_FAILED,
    REPORT_GENERATED,
    REPORT_PERSIST_FAILED,
    RUN_ABORTED
}
