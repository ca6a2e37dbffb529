package com.compliance.retention.audit;

import com.compliance.retention.graph.GraphConnection;
import com.compliance.retention.graph.GraphSupport;
import com.compliance.retention.store.StoreAccessException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * FalkorDB-backed implementation of {@link AuditRepository}.
 * Entries are {@code :RetentionAudit} nodes; details are stored as a JSON string
 * and timestamps as epoch milliseconds.
 */
public class GraphAuditRepository implements AuditRepository {
    private static final Logger log = LoggerFactory.getLogger(GraphAuditRepository.class);

    private static final String RETURN_COLUMNS = """
            RETURN a.id as id, a.action as action, a.runId as runId, a.category as category,
                   a.details as details, a.timestamp as timestamp
            ORDER BY a.timestamp ASC
            """;

    private final GraphConnection connection;
    private final ObjectMapper objectMapper;

    public GraphAuditRepository(GraphConnection connection) {
        this.connection = connection;
        this.objectMapper = GraphSupport.newObjectMapper();
        GraphSupport.ensureIndex(connection, "RetentionAudit", "runId");
        GraphSupport.ensureIndex(connection, "RetentionAudit", "action");
        GraphSupport.ensureIndex(connection, "RetentionAudit", "timestamp");
    }

    @Override
    public AuditEntry save(AuditEntry entry) {
        Map<String, Object> params = new HashMap<>();
        params.put("id", entry.id());
        params.put("action", entry.action().name());
        params.put("runId", entry.runId() != null ? entry.runId() : "");
        params.put("category", entry.category() != null ? entry.category() : "");
        params.put("details", serializeDetails(entry.details()));
        params.put("timestamp", entry.timestamp().toEpochMilli());
        connection.execute("""
                CREATE (a:RetentionAudit {
                    id: $id,
                    action: $action,
                    runId: $runId,
                    category: $category,
                    details: $details,
                    timestamp: $timestamp
                })
                """, params);
        return entry;
    }

    @Override
    public List<AuditEntry> findAll() {
        return mapResults(connection.query("MATCH (a:RetentionAudit)\n" + RETURN_COLUMNS));
    }

    @Override
    public List<AuditEntry> findByRunId(String runId) {
        return mapResults(connection.query("MATCH (a:RetentionAudit {runId: $runId})\n" + RETURN_COLUMNS,
                Map.of("runId", runId)));
    }

    @Override
    public List<AuditEntry> findByAction(AuditAction action) {
        return mapResults(connection.query("MATCH (a:RetentionAudit {action: $action})\n" + RETURN_COLUMNS,
                Map.of("action", action.name())));
    }

    @Override
    public List<AuditEntry> findByCategory(String category) {
        return mapResults(connection.query("MATCH (a:RetentionAudit {category: $category})\n" + RETURN_COLUMNS,
                Map.of("category", category)));
    }

    @Override
    public List<AuditEntry> findBetween(Instant start, Instant end) {
        return mapResults(connection.query("""
                MATCH (a:RetentionAudit)
                WHERE a.timestamp >= $start AND a.timestamp <= $end
                """ + RETURN_COLUMNS, Map.of(
                "start", start.toEpochMilli(),
                "end", end.toEpochMilli()
        )));
    }

    @Override
    public int count() {
        return (int) GraphSupport.firstLong(
                connection.query("MATCH (a:RetentionAudit) RETURN count(a) as cnt"), "cnt");
    }

    private List<AuditEntry> mapResults(List<Map<String, Object>> rows) {
        List<AuditEntry> entries = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            entries.add(new AuditEntry(
                    (String) row.get("id"),
                    AuditAction.valueOf((String) row.get("action")),
                    emptyToNull(row.get("runId")),
                    emptyToNull(row.get("category")),
                    deserializeDetails((String) row.get("details")),
                    GraphSupport.toInstant(row.get("timestamp"))
            ));
        }
        return entries;
    }

    private String serializeDetails(Map<String, Object> details) {
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            throw new StoreAccessException("Failed to serialize audit details", e);
        }
    }

    private Map<String, Object> deserializeDetails(String json) {
        if (json == null || json.isEmpty()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<>() {
            });
        } catch (JsonProcessingException e) {
            log.warn("audit.details.unreadable json={} error={}", json, e.getMessage());
            return Map.of();
        }
    }

    private static String emptyToNull(Object value) {
        return value instanceof String s && !s.isEmpty() ? s : null;
    }
}
