package com.compliance.retention.hold;

import java.time.Instant;
import java.util.Objects;

/**
 * A legal hold placed on a record of a data category.
 * While active, the whole category is excluded from deletion.
 *
 * @param category   the held data category
 * @param recordId   the record the hold was placed for
 * @param reason     why the hold exists (litigation, investigation)
 * @param createdBy  who placed the hold
 * @param createdAt  when the hold was placed
 * @param expiration when the hold lapses; null for an open-ended hold
 * @param status     ACTIVE until legal releases the hold
 */
public record LegalHold(
        String category,
        String recordId,
        String reason,
        String createdBy,
        Instant createdAt,
        Instant expiration,
        HoldStatus status
) {
    public LegalHold {
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(recordId, "recordId is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
        if (category.isBlank()) {
            throw new IllegalArgumentException("category must not be blank");
        }
        reason = reason != null ? reason : "";
        createdBy = createdBy != null ? createdBy : "";
        status = status != null ? status : HoldStatus.ACTIVE;
    }

    public LegalHold(String category, String recordId, String reason, String createdBy,
                     Instant createdAt, Instant expiration) {
        this(category, recordId, reason, createdBy, createdAt, expiration, HoldStatus.ACTIVE);
    }

    /**
     * A hold is active when it has not been released and has no expiration or expires after {@code now}.
     */
    public boolean isActive(Instant now) {
        return status == HoldStatus.ACTIVE && (expiration == null || expiration.isAfter(now));
    }

    public LegalHold released() {
        return new LegalHold(category, recordId, reason, createdBy, createdAt, expiration, HoldStatus.RELEASED);
    }

    boolean matches(String category, String recordId) {
        return this.category.equals(category) && this.recordId.equals(recordId);
    }
}
