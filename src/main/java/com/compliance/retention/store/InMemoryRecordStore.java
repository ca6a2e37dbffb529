package com.compliance.retention.store;

import com.compliance.retention.policy.FieldRule;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link RecordStore}.
 * Thread-safe: each category's records are guarded by that category's own monitor,
 * so concurrent pipeline tasks on different categories never contend.
 */
public class InMemoryRecordStore implements RecordStore {

    private final Map<String, List<StoredRecord>> tables = new ConcurrentHashMap<>();

    /**
     * Inserts a record with a generated id.
     */
    public StoredRecord insert(String category, Instant createdAt, Map<String, Object> fields) {
        return insert(category, new StoredRecord(UUID.randomUUID().toString(), createdAt, fields, null, null));
    }

    public StoredRecord insert(String category, StoredRecord record) {
        List<StoredRecord> table = table(category);
        synchronized (table) {
            table.add(record);
        }
        return record;
    }

    /**
     * Returns a snapshot of all records in a category.
     */
    public List<StoredRecord> findAll(String category) {
        List<StoredRecord> table = tables.get(category);
        if (table == null) {
            return List.of();
        }
        synchronized (table) {
            return Collections.unmodifiableList(new ArrayList<>(table));
        }
    }

    public int count(String category) {
        List<StoredRecord> table = tables.get(category);
        if (table == null) {
            return 0;
        }
        synchronized (table) {
            return table.size();
        }
    }

    @Override
    public ExpiredRange findExpired(String category, Instant cutoff) {
        List<StoredRecord> table = tables.get(category);
        if (table == null) {
            return ExpiredRange.empty();
        }
        long count = 0;
        Instant oldest = null;
        Instant newest = null;
        synchronized (table) {
            for (StoredRecord record : table) {
                if (isExpired(record, cutoff)) {
                    count++;
                    if (oldest == null || record.createdAt().isBefore(oldest)) {
                        oldest = record.createdAt();
                    }
                    if (newest == null || record.createdAt().isAfter(newest)) {
                        newest = record.createdAt();
                    }
                }
            }
        }
        return new ExpiredRange(count, oldest, newest);
    }

    @Override
    public long countExpired(String category, Instant cutoff) {
        List<StoredRecord> table = tables.get(category);
        if (table == null) {
            return 0;
        }
        synchronized (table) {
            return table.stream().filter(r -> isExpired(r, cutoff)).count();
        }
    }

    @Override
    public long anonymizeExpired(String category, Instant cutoff, List<FieldRule> rules,
                                 Instant anonymizedAt, String reason) {
        List<StoredRecord> table = tables.get(category);
        if (table == null) {
            return 0;
        }
        long rewritten = 0;
        synchronized (table) {
            for (int i = 0; i < table.size(); i++) {
                StoredRecord record = table.get(i);
                if (!isExpired(record, cutoff) || record.isAnonymized()) {
                    continue;
                }
                Map<String, Object> replacements = new LinkedHashMap<>();
                for (FieldRule rule : rules) {
                    replacements.put(rule.field(), rule.replacementValue());
                }
                table.set(i, record.anonymize(replacements, anonymizedAt, reason));
                rewritten++;
            }
        }
        return rewritten;
    }

    @Override
    public long deleteExpired(String category, Instant cutoff) {
        List<StoredRecord> table = tables.get(category);
        if (table == null) {
            return 0;
        }
        synchronized (table) {
            int before = table.size();
            table.removeIf(r -> isExpired(r, cutoff) && isDeletable(category, r));
            return before - table.size();
        }
    }

    /**
     * Hook for subclasses that model store-side constraints blocking deletion of a record.
     */
    protected boolean isDeletable(String category, StoredRecord record) {
        return true;
    }

    private List<StoredRecord> table(String category) {
        return tables.computeIfAbsent(category, k -> new ArrayList<>());
    }

    private static boolean isExpired(StoredRecord record, Instant cutoff) {
        return !record.createdAt().isAfter(cutoff);
    }
}
