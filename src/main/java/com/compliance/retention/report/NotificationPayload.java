package com.compliance.retention.report;

import java.time.Instant;
import java.util.Objects;

/**
 * Message handed to the notification sink at the end of a cycle.
 */
public record NotificationPayload(
        String subject,
        ProcessSummary processSummary,
        ComplianceStatus complianceStatus,
        Instant reportDate,
        String manifestId
) {
    public static final String SUBJECT_PREFIX = "Data Retention Process Completed - ";

    public NotificationPayload {
        Objects.requireNonNull(subject, "subject is required");
        Objects.requireNonNull(complianceStatus, "complianceStatus is required");
    }

    public static NotificationPayload from(ComplianceReport report) {
        return new NotificationPayload(
                SUBJECT_PREFIX + report.status().name(),
                report.processSummary(),
                report.status(),
                report.reportDate(),
                report.manifestId()
        );
    }
}
