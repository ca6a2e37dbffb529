package com.compliance.retention.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Records the decisions of each retention cycle.
 *
 * <p>Auditing never interrupts a cycle: a repository failure is logged at ERROR
 * and the entry is returned unsaved. The manifest and report remain the
 * authoritative evidence.</p>
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditRepository repository;
    private final Clock clock;

    public AuditService() {
        this(new InMemoryAuditRepository());
    }

    public AuditService(AuditRepository repository) {
        this(repository, Clock.systemUTC());
    }

    public AuditService(AuditRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public AuditEntry record(AuditEntry entry) {
        try {
            repository.save(entry);
            log.debug("audit.recorded action={} runId={} category={}",
                    entry.action(), entry.runId(), entry.category());
        } catch (RuntimeException e) {
            log.error("audit.persist.failed action={} runId={} category={} error={}",
                    entry.action(), entry.runId(), entry.category(), e.getMessage(), e);
        }
        return entry;
    }

    public AuditEntry record(AuditAction action, String runId, String category, Map<String, Object> details) {
        return record(AuditEntry.builder()
                .action(action)
                .runId(runId)
                .category(category)
                .details(details)
                .timestamp(clock.instant())
                .build());
    }

    /**
     * Records a run-wide entry.
     */
    public AuditEntry record(AuditAction action, String runId, Map<String, Object> details) {
        return record(action, runId, null, details);
    }

    public List<AuditEntry> getEntriesForRun(String runId) {
        return repository.findByRunId(runId);
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return repository.findByAction(action);
    }

    public List<AuditEntry> getEntriesForCategory(String category) {
        return repository.findByCategory(category);
    }

    public List<AuditEntry> getAllEntries() {
        return repository.findAll();
    }

    public int size() {
        return repository.count();
    }
}
