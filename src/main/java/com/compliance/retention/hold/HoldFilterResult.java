package com.compliance.retention.hold;

import com.compliance.retention.scan.ExpirationRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Output of the hold filter.
 *
 * @param eligible        expiration records of categories with no active hold, in scan order
 * @param holdsByCategory every active hold grouped by category, held or not scanned
 */
public record HoldFilterResult(
        Map<String, ExpirationRecord> eligible,
        Map<String, List<LegalHold>> holdsByCategory
) {
    public HoldFilterResult {
        Objects.requireNonNull(eligible, "eligible is required");
        Objects.requireNonNull(holdsByCategory, "holdsByCategory is required");
        eligible = Collections.unmodifiableMap(new LinkedHashMap<>(eligible));
        Map<String, List<LegalHold>> copy = new LinkedHashMap<>();
        holdsByCategory.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        holdsByCategory = Collections.unmodifiableMap(copy);
    }

    public Set<String> heldCategories() {
        return holdsByCategory.keySet();
    }

    public int totalHolds() {
        return holdsByCategory.values().stream().mapToInt(List::size).sum();
    }
}
