package com.compliance.retention.policy;

/**
 * How a sensitive field is rewritten before its record is deleted.
 */
public enum AnonymizationRule {
    /** A synthetic value unique per record, e.g. {@code anonymized_<uuid>@deleted.local}. */
    UNIQUE_PLACEHOLDER,
    /** A fixed redaction token shared by all records, e.g. {@code DELETED}. */
    REDACTION_TOKEN,
    /** A fixed null-equivalent value, e.g. {@code 0.0.0.0} for addresses. */
    NULL_VALUE
}
