package com.compliance.retention.report;

import com.compliance.retention.audit.AuditAction;
import com.compliance.retention.audit.AuditService;
import com.compliance.retention.hold.LegalHold;
import com.compliance.retention.manifest.DeletionManifest;
import com.compliance.retention.manifest.DeletionOutcome;
import com.compliance.retention.manifest.ManifestStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates the evidence of a cycle into a {@link ComplianceReport} and stores it.
 *
 * <p>A cycle is COMPLIANT only when its manifest reached COMPLETED and every
 * deletion outcome succeeded. A report that cannot be stored is still returned,
 * without an id.</p>
 */
public class ComplianceReporter {
    private static final Logger log = LoggerFactory.getLogger(ComplianceReporter.class);

    private final ReportRepository repository;
    private final AuditService auditService;

    public ComplianceReporter(ReportRepository repository, AuditService auditService) {
        this.repository = repository;
        this.auditService = auditService;
    }

    public ComplianceReport report(DeletionManifest manifest, Map<String, DeletionOutcome> outcomes,
                                   Map<String, List<LegalHold>> holdsByCategory, Instant reportDate) {
        return report(manifest, outcomes, holdsByCategory, reportDate, null);
    }

    public ComplianceReport report(DeletionManifest manifest, Map<String, DeletionOutcome> outcomes,
                                   Map<String, List<LegalHold>> holdsByCategory, Instant reportDate,
                                   String runId) {
        ComplianceStatus status = verdict(manifest, outcomes);
        if (manifest.status() != ManifestStatus.COMPLETED) {
            log.warn("retention.report.manifest.unfinished manifestId={} status={}",
                    manifest.manifestId(), manifest.status());
        }
        ComplianceReport report = new ComplianceReport(
                null,
                ComplianceReport.REPORT_TYPE,
                reportDate,
                ProcessSummary.of(outcomes.values()),
                LegalHoldSummary.of(holdsByCategory),
                status,
                manifest.manifestId(),
                outcomes
        );

        try {
            report = repository.save(report);
        } catch (RuntimeException e) {
            log.error("retention.report.persist.failed manifestId={} error={}",
                    manifest.manifestId(), e.getMessage(), e);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("manifestId", manifest.manifestId());
            details.put("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            auditService.record(AuditAction.REPORT_PERSIST_FAILED, runId, details);
            return report;
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reportId", report.reportId());
        details.put("manifestId", manifest.manifestId());
        details.put("status", status.name());
        details.put("totalDeleted", report.totalDeleted());
        auditService.record(AuditAction.REPORT_GENERATED, runId, details);
        log.info("retention.report.generated reportId={} status={} tables={} deleted={} failed={}",
                report.reportId(), status, report.tablesProcessed(), report.totalDeleted(), report.failedCount());
        return report;
    }

    static ComplianceStatus verdict(DeletionManifest manifest, Map<String, DeletionOutcome> outcomes) {
        boolean clean = manifest.status() == ManifestStatus.COMPLETED
                && outcomes.values().stream().allMatch(DeletionOutcome::success);
        return clean ? ComplianceStatus.COMPLIANT : ComplianceStatus.NEEDS_ATTENTION;
    }
}
