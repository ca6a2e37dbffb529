package com.compliance.retention.hold;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * In-memory implementation of {@link LegalHoldStore}.
 */
public class InMemoryLegalHoldStore implements LegalHoldStore {

    private final List<LegalHold> holds = new ArrayList<>();

    @Override
    public synchronized List<LegalHold> findActiveHolds(Instant now) {
        return holds.stream()
                .filter(h -> h.isActive(now))
                .toList();
    }

    @Override
    public synchronized LegalHold place(LegalHold hold) {
        holds.add(hold);
        return hold;
    }

    @Override
    public synchronized int release(String category, String recordId, Instant releasedAt) {
        int released = 0;
        for (int i = 0; i < holds.size(); i++) {
            LegalHold hold = holds.get(i);
            if (hold.status() == HoldStatus.ACTIVE && hold.matches(category, recordId)) {
                holds.set(i, hold.released());
                released++;
            }
        }
        return released;
    }

    @Override
    public synchronized List<LegalHold> findAll() {
        return List.copyOf(holds);
    }

    public synchronized void clear() {
        holds.clear();
    }
}
