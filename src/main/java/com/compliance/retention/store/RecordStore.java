package com.compliance.retention.store;

import com.compliance.retention.policy.FieldRule;

import java.time.Instant;
import java.util.List;

/**
 * Access to the records of each data category.
 * Abstracts the underlying store; the pipeline needs only these age-filtered operations.
 *
 * <p>A record is expired for a cutoff when its creation time is at or before the cutoff.
 * Implementations throw {@link StoreAccessException} when the store cannot answer.</p>
 */
public interface RecordStore {

    /**
     * Counts expired records and returns their creation-time bounds.
     *
     * @param category the data category
     * @param cutoff   records created at or before this instant are expired
     * @return count plus oldest and newest creation times (absent when the count is zero)
     */
    ExpiredRange findExpired(String category, Instant cutoff);

    /**
     * Counts expired records.
     */
    long countExpired(String category, Instant cutoff);

    /**
     * Rewrites the given fields on expired records that are not yet anonymized,
     * and stamps them with the anonymization time and reason.
     *
     * @return the number of records rewritten
     */
    long anonymizeExpired(String category, Instant cutoff, List<FieldRule> rules,
                          Instant anonymizedAt, String reason);

    /**
     * Deletes expired records.
     *
     * @return the number of records the store reports as deleted
     */
    long deleteExpired(String category, Instant cutoff);
}
