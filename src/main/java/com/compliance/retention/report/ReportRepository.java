package com.compliance.retention.report;

import java.util.List;
import java.util.Optional;

/**
 * Storage for compliance reports.
 */
public interface ReportRepository {

    /**
     * Stores a report.
     *
     * @return the stored report carrying its assigned id
     */
    ComplianceReport save(ComplianceReport report);

    Optional<ComplianceReport> findById(String reportId);

    /**
     * Gets the report with the latest report date.
     */
    Optional<ComplianceReport> findLatest();

    List<ComplianceReport> findAll();
}
