package com.compliance.retention.hold;

import com.compliance.retention.graph.GraphConnection;
import com.compliance.retention.graph.GraphSupport;
import com.compliance.retention.store.StoreAccessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * FalkorDB-backed implementation of {@link LegalHoldStore}.
 * Holds are {@code :LegalHold} nodes with epoch-millisecond timestamps; an
 * open-ended hold has no {@code expiration} property. Nodes written without a
 * {@code status} are read as ACTIVE.
 */
public class GraphLegalHoldStore implements LegalHoldStore {
    private static final Logger log = LoggerFactory.getLogger(GraphLegalHoldStore.class);

    private static final String RETURN_COLUMNS = """
            RETURN h.category as category, h.recordId as recordId, h.reason as reason,
                   h.createdBy as createdBy, h.createdAt as createdAt, h.expiration as expiration,
                   coalesce(h.status, 'ACTIVE') as status
            ORDER BY h.createdAt ASC
            """;

    private final GraphConnection connection;

    public GraphLegalHoldStore(GraphConnection connection) {
        this.connection = connection;
        GraphSupport.ensureIndex(connection, "LegalHold", "category");
    }

    @Override
    public List<LegalHold> findActiveHolds(Instant now) {
        try {
            return mapResults(connection.query("""
                    MATCH (h:LegalHold)
                    WHERE coalesce(h.status, 'ACTIVE') = 'ACTIVE'
                      AND (h.expiration IS NULL OR h.expiration > $now)
                    """ + RETURN_COLUMNS, Map.of("now", now.toEpochMilli())));
        } catch (RuntimeException e) {
            throw new StoreAccessException("Legal hold lookup failed: " + e.getMessage(), e);
        }
    }

    @Override
    public LegalHold place(LegalHold hold) {
        Map<String, Object> params = new HashMap<>();
        params.put("category", hold.category());
        params.put("recordId", hold.recordId());
        params.put("reason", hold.reason());
        params.put("createdBy", hold.createdBy());
        params.put("createdAt", hold.createdAt().toEpochMilli());
        params.put("expiration", GraphSupport.toEpochMillis(hold.expiration()));
        params.put("status", hold.status().name());
        try {
            connection.execute("""
                    CREATE (h:LegalHold {
                        category: $category,
                        recordId: $recordId,
                        reason: $reason,
                        createdBy: $createdBy,
                        createdAt: $createdAt,
                        expiration: $expiration,
                        status: $status
                    })
                    """, params);
        } catch (RuntimeException e) {
            throw new StoreAccessException("Legal hold could not be placed on " + hold.category(), e);
        }
        return hold;
    }

    @Override
    public int release(String category, String recordId, Instant releasedAt) {
        List<Map<String, Object>> rows;
        try {
            rows = connection.query("""
                    MATCH (h:LegalHold {category: $category, recordId: $recordId})
                    WHERE coalesce(h.status, 'ACTIVE') = 'ACTIVE'
                    SET h.status = 'RELEASED', h.releasedAt = $releasedAt
                    RETURN count(h) as released
                    """, Map.of(
                    "category", category,
                    "recordId", recordId,
                    "releasedAt", releasedAt.toEpochMilli()
            ));
        } catch (RuntimeException e) {
            throw new StoreAccessException("Legal hold on " + category + " could not be released", e);
        }
        int released = (int) GraphSupport.firstLong(rows, "released");
        log.info("retention.hold.released category={} recordId={} released={}", category, recordId, released);
        return released;
    }

    @Override
    public List<LegalHold> findAll() {
        try {
            return mapResults(connection.query("MATCH (h:LegalHold)\n" + RETURN_COLUMNS));
        } catch (RuntimeException e) {
            throw new StoreAccessException("Legal hold lookup failed: " + e.getMessage(), e);
        }
    }

    private List<LegalHold> mapResults(List<Map<String, Object>> rows) {
        List<LegalHold> holds = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            holds.add(new LegalHold(
                    (String) row.get("category"),
                    String.valueOf(row.get("recordId")),
                    (String) row.get("reason"),
                    (String) row.get("createdBy"),
                    GraphSupport.toInstant(row.get("createdAt")),
                    GraphSupport.toInstant(row.get("expiration")),
                    row.get("status") != null ? HoldStatus.valueOf((String) row.get("status")) : HoldStatus.ACTIVE
            ));
        }
        return holds;
    }
}
