package com.compliance.retention.hold;

/**
 * Lifecycle of a legal hold. Only ACTIVE holds block deletion.
 */
public enum HoldStatus {
    ACTIVE,
    RELEASED
}
