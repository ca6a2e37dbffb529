package com.compliance.retention.store;

import com.compliance.retention.graph.GraphConnection;
import com.compliance.retention.graph.GraphSupport;
import com.compliance.retention.graph.InputSanitizer;
import com.compliance.retention.policy.AnonymizationRule;
import com.compliance.retention.policy.FieldRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * FalkorDB-backed implementation of {@link RecordStore}.
 * Records of a category are nodes labelled with the category name and carry
 * {@code created_at} as epoch milliseconds. Writes run in batches so a large
 * backlog never turns into one long-running query.
 */
public class GraphRecordStore implements RecordStore {
    private static final Logger log = LoggerFactory.getLogger(GraphRecordStore.class);

    public static final String CREATED_AT = "created_at";
    public static final String ANONYMIZED_AT = "anonymized_at";
    public static final String ANONYMIZATION_REASON = "anonymization_reason";

    private static final int DEFAULT_BATCH_SIZE = 1000;

    private final GraphConnection connection;
    private final int batchSize;
    private final Set<String> indexedLabels = ConcurrentHashMap.newKeySet();

    public GraphRecordStore(GraphConnection connection) {
        this(connection, DEFAULT_BATCH_SIZE);
    }

    public GraphRecordStore(GraphConnection connection, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.connection = connection;
        this.batchSize = batchSize;
    }

    @Override
    public ExpiredRange findExpired(String category, Instant cutoff) {
        String label = label(category);
        String query = """
                MATCH (r:%s)
                WHERE r.created_at <= $cutoff
                RETURN count(r) as expired, min(r.created_at) as oldest, max(r.created_at) as newest
                """.formatted(label);
        List<Map<String, Object>> rows = run(category, "findExpired",
                () -> connection.query(query, Map.of("cutoff", cutoff.toEpochMilli())));
        long count = GraphSupport.firstLong(rows, "expired");
        if (count == 0) {
            return ExpiredRange.empty();
        }
        Map<String, Object> row = rows.get(0);
        return new ExpiredRange(count,
                GraphSupport.toInstant(row.get("oldest")),
                GraphSupport.toInstant(row.get("newest")));
    }

    @Override
    public long countExpired(String category, Instant cutoff) {
        String query = """
                MATCH (r:%s)
                WHERE r.created_at <= $cutoff
                RETURN count(r) as expired
                """.formatted(label(category));
        return GraphSupport.firstLong(run(category, "countExpired",
                () -> connection.query(query, Map.of("cutoff", cutoff.toEpochMilli()))), "expired");
    }

    @Override
    public long anonymizeExpired(String category, Instant cutoff, List<FieldRule> rules,
                                 Instant anonymizedAt, String reason) {
        if (rules.isEmpty()) {
            return 0;
        }
        Map<String, Object> params = new HashMap<>();
        StringBuilder assignments = new StringBuilder();
        for (int i = 0; i < rules.size(); i++) {
            FieldRule rule = rules.get(i);
            String field = InputSanitizer.validateIdentifier(rule.field());
            assignments.append("r.").append(field).append(" = ");
            if (rule.rule() == AnonymizationRule.UNIQUE_PLACEHOLDER) {
                assignments.append("'").append(FieldRule.PLACEHOLDER_PREFIX).append("' + randomUUID() + $domain").append(i);
                params.put("domain" + i, "@" + rule.token());
            } else {
                assignments.append("$token").append(i);
                params.put("token" + i, rule.token());
            }
            assignments.append(",\n    ");
        }
        String query = """
                MATCH (r:%s)
                WHERE r.created_at <= $cutoff AND r.anonymized_at IS NULL
                WITH r LIMIT $batchSize
                SET %sr.anonymized_at = $anonymizedAt,
                    r.anonymization_reason = $reason
                RETURN count(r) as anonymized
                """.formatted(label(category), assignments);
        params.put("cutoff", cutoff.toEpochMilli());
        params.put("batchSize", batchSize);
        params.put("anonymizedAt", anonymizedAt.toEpochMilli());
        params.put("reason", reason);

        long total = 0;
        long batch;
        do {
            batch = GraphSupport.firstLong(run(category, "anonymizeExpired",
                    () -> connection.query(query, params)), "anonymized");
            total += batch;
            if (batch > 0) {
                log.debug("store.anonymized category={} batch={} total={}", category, batch, total);
            }
        } while (batch >= batchSize);
        return total;
    }

    @Override
    public long deleteExpired(String category, Instant cutoff) {
        String query = """
                MATCH (r:%s)
                WHERE r.created_at <= $cutoff
                WITH r LIMIT $batchSize
                DETACH DELETE r
                RETURN count(r) as deleted
                """.formatted(label(category));
        Map<String, Object> params = Map.of(
                "cutoff", cutoff.toEpochMilli(),
                "batchSize", batchSize
        );

        long total = 0;
        long batch;
        do {
            batch = GraphSupport.firstLong(run(category, "deleteExpired",
                    () -> connection.query(query, params)), "deleted");
            total += batch;
            if (batch > 0) {
                log.debug("store.deleted category={} batch={} total={}", category, batch, total);
            }
        } while (batch >= batchSize);
        return total;
    }

    /**
     * Inserts a record node. Used to seed categories and by integration tests.
     */
    public void insert(String category, String id, Instant createdAt, Map<String, Object> fields) {
        String label = label(category);
        Map<String, Object> params = new HashMap<>();
        StringBuilder properties = new StringBuilder("id: $id, created_at: $createdAt");
        int i = 0;
        for (Map.Entry<String, Object> field : fields.entrySet()) {
            String key = InputSanitizer.validateIdentifier(field.getKey());
            properties.append(", ").append(key).append(": $f").append(i);
            params.put("f" + i, field.getValue());
            i++;
        }
        params.put("id", id);
        params.put("createdAt", createdAt.toEpochMilli());
        String query = "CREATE (r:" + label + " {" + properties + "})";
        run(category, "insert", () -> {
            connection.execute(query, params);
            return null;
        });
    }

    private String label(String category) {
        String label = InputSanitizer.validateIdentifier(category);
        if (indexedLabels.add(label)) {
            GraphSupport.ensureIndex(connection, label, CREATED_AT);
        }
        return label;
    }

    private <T> T run(String category, String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (RuntimeException e) {
            throw new StoreAccessException(
                    "Record store " + operation + " failed for category " + category + ": " + e.getMessage(), e);
        }
    }
}
