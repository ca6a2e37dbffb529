package com.compliance.retention.report;

import com.compliance.retention.graph.GraphConnection;
import com.compliance.retention.graph.GraphSupport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * FalkorDB-backed implementation of {@link ReportRepository}.
 * Reports are {@code :ComplianceReport} nodes with the report as a JSON payload.
 */
public class GraphReportRepository implements ReportRepository {

    private final GraphConnection connection;
    private final ObjectMapper objectMapper;

    public GraphReportRepository(GraphConnection connection) {
        this.connection = connection;
        this.objectMapper = GraphSupport.newObjectMapper();
        GraphSupport.ensureIndex(connection, "ComplianceReport", "id");
    }

    @Override
    public ComplianceReport save(ComplianceReport report) {
        ComplianceReport stored = report.withId(UUID.randomUUID().toString());
        String payload;
        try {
            payload = objectMapper.writeValueAsString(stored);
        } catch (JsonProcessingException e) {
            throw new ReportPersistException("Failed to serialize compliance report", e);
        }
        try {
            connection.execute("""
                    CREATE (r:ComplianceReport {
                        id: $id,
                        reportType: $reportType,
                        reportDate: $reportDate,
                        status: $status,
                        manifestId: $manifestId,
                        payload: $payload
                    })
                    """, Map.of(
                    "id", stored.reportId(),
                    "reportType", stored.reportType(),
                    "reportDate", stored.reportDate().toEpochMilli(),
                    "status", stored.status().name(),
                    "manifestId", stored.manifestId() != null ? stored.manifestId() : "",
                    "payload", payload
            ));
        } catch (RuntimeException e) {
            throw new ReportPersistException("Compliance report could not be stored: " + e.getMessage(), e);
        }
        return stored;
    }

    @Override
    public Optional<ComplianceReport> findById(String reportId) {
        return first(connection.query("""
                MATCH (r:ComplianceReport {id: $id})
                RETURN r.payload as payload
                """, Map.of("id", reportId)));
    }

    @Override
    public Optional<ComplianceReport> findLatest() {
        return first(connection.query("""
                MATCH (r:ComplianceReport)
                RETURN r.payload as payload
                ORDER BY r.reportDate DESC
                LIMIT 1
                """));
    }

    @Override
    public List<ComplianceReport> findAll() {
        List<Map<String, Object>> rows = connection.query("""
                MATCH (r:ComplianceReport)
                RETURN r.payload as payload
                ORDER BY r.reportDate ASC
                """);
        List<ComplianceReport> reports = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            reports.add(deserialize((String) row.get("payload")));
        }
        return reports;
    }

    private Optional<ComplianceReport> first(List<Map<String, Object>> rows) {
        return rows.isEmpty() ? Optional.empty() : Optional.of(deserialize((String) rows.get(0).get("payload")));
    }

    private ComplianceReport deserialize(String json) {
        try {
            return objectMapper.readValue(json, ComplianceReport.class);
        } catch (JsonProcessingException e) {
            throw new ReportPersistException("Stored compliance report is unreadable", e);
        }
    }
}
