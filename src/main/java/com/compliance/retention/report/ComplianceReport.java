package com.compliance.retention.report;

import com.compliance.retention.manifest.DeletionOutcome;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of a retention cycle for compliance officers.
 *
 * @param reportId         id assigned when stored; null if storing failed
 * @param reportType       always {@value #REPORT_TYPE}
 * @param reportDate       the run's reference time
 * @param processSummary   deletion totals
 * @param legalHoldSummary holds active during the cycle
 * @param status           COMPLIANT iff every deletion outcome succeeded
 * @param manifestId       the manifest the deletions were recorded in
 * @param outcomes         deletion outcomes keyed by category, in manifest order
 */
public record ComplianceReport(
        String reportId,
        String reportType,
        Instant reportDate,
        ProcessSummary processSummary,
        LegalHoldSummary legalHoldSummary,
        ComplianceStatus status,
        String manifestId,
        Map<String, DeletionOutcome> outcomes
) {
    public static final String REPORT_TYPE = "DATA_RETENTION";

    public ComplianceReport {
        Objects.requireNonNull(reportDate, "reportDate is required");
        Objects.requireNonNull(processSummary, "processSummary is required");
        Objects.requireNonNull(status, "status is required");
        reportType = reportType != null ? reportType : REPORT_TYPE;
        legalHoldSummary = legalHoldSummary != null ? legalHoldSummary : LegalHoldSummary.none();
        outcomes = outcomes != null ? Collections.unmodifiableMap(new LinkedHashMap<>(outcomes)) : Map.of();
    }

    public ComplianceReport withId(String id) {
        return new ComplianceReport(id, reportType, reportDate, processSummary, legalHoldSummary,
                status, manifestId, outcomes);
    }

    public int tablesProcessed() {
        return processSummary.tablesProcessed();
    }

    public long totalDeleted() {
        return processSummary.totalRecordsDeleted();
    }

    public int successfulCount() {
        return processSummary.successfulDeletions();
    }

    public int failedCount() {
        return processSummary.failedDeletions();
    }
}
