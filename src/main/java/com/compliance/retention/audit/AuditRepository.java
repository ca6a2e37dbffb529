package com.compliance.retention.audit;

import java.time.Instant;
import java.util.List;

/**
 * Append-only storage for audit entries.
 */
public interface AuditRepository {

    AuditEntry save(AuditEntry entry);

    /**
     * Gets all entries in insertion order.
     */
    List<AuditEntry> findAll();

    /**
     * Gets the entries of one retention cycle.
     */
    List<AuditEntry> findByRunId(String runId);

    List<AuditEntry> findByAction(AuditAction action);

    List<AuditEntry> findByCategory(String category);

    /**
     * Gets entries written within a time range, bounds inclusive.
     */
    List<AuditEntry> findBetween(Instant start, Instant end);

    int count();
}
