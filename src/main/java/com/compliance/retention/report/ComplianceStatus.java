package com.compliance.retention.report;

/**
 * Verdict of a retention cycle, derived only from the recorded deletion outcomes.
 */
public enum ComplianceStatus {
    COMPLIANT,
    NEEDS_ATTENTION
}
