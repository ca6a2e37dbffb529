package com.compliance.retention.store;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of a record held by {@link InMemoryRecordStore}.
 *
 * @param id                  record identifier
 * @param createdAt           creation time used for age checks
 * @param fields              record payload; values may be null
 * @param anonymizedAt        anonymization marker, null until anonymized
 * @param anonymizationReason reason tag written with the marker
 */
public record StoredRecord(
        String id,
        Instant createdAt,
        Map<String, Object> fields,
        Instant anonymizedAt,
        String anonymizationReason
) {
    public StoredRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
        // Map.copyOf rejects null values, which a store row may legitimately hold
        fields = fields != null ? Collections.unmodifiableMap(new LinkedHashMap<>(fields)) : Map.of();
    }

    public boolean isAnonymized() {
        return anonymizedAt != null;
    }

    public Object field(String name) {
        return fields.get(name);
    }

    StoredRecord anonymize(Map<String, Object> replacements, Instant at, String reason) {
        Map<String, Object> rewritten = new LinkedHashMap<>(fields);
        rewritten.putAll(replacements);
        return new StoredRecord(id, createdAt, rewritten, at, reason);
    }
}
