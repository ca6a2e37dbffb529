package com.compliance.retention.hold;

import java.time.Instant;
import java.util.List;

/**
 * Access to legal holds.
 * Implementations throw {@link com.compliance.retention.store.StoreAccessException}
 * when holds cannot be read; the hold filter treats that as fatal for the run.
 */
public interface LegalHoldStore {

    /**
     * Returns ACTIVE holds that have not lapsed at {@code now}: no expiration, or an expiration after it.
     */
    List<LegalHold> findActiveHolds(Instant now);

    /**
     * Places a hold.
     */
    LegalHold place(LegalHold hold);

    /**
     * Releases the active holds on a record. Released holds are kept but no longer block deletion.
     *
     * @return the number of holds released; 0 if none was active
     */
    int release(String category, String recordId, Instant releasedAt);

    /**
     * Returns every hold, active, lapsed or released.
     */
    List<LegalHold> findAll();
}
