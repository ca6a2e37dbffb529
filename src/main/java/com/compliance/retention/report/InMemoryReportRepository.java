package com.compliance.retention.report;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link ReportRepository}.
 */
public class InMemoryReportRepository implements ReportRepository {

    private final List<ComplianceReport> reports = new CopyOnWriteArrayList<>();

    @Override
    public ComplianceReport save(ComplianceReport report) {
        ComplianceReport stored = report.withId(UUID.randomUUID().toString());
        reports.add(stored);
        return stored;
    }

    @Override
    public Optional<ComplianceReport> findById(String reportId) {
        return reports.stream()
                .filter(r -> reportId.equals(r.reportId()))
                .findFirst();
    }

    @Override
    public Optional<ComplianceReport> findLatest() {
        return reports.stream().max(Comparator.comparing(ComplianceReport::reportDate));
    }

    @Override
    public List<ComplianceReport> findAll() {
        return List.copyOf(reports);
    }
}
