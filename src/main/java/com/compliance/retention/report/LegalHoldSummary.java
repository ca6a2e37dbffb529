package com.compliance.retention.report;

import com.compliance.retention.hold.LegalHold;

import java.util.List;
import java.util.Map;

/**
 * Legal holds active during a cycle.
 *
 * @param categoriesWithHolds held categories, in hold-store order
 * @param totalHolds          number of active holds
 */
public record LegalHoldSummary(List<String> categoriesWithHolds, int totalHolds) {

    public LegalHoldSummary {
        categoriesWithHolds = categoriesWithHolds != null ? List.copyOf(categoriesWithHolds) : List.of();
    }

    public static LegalHoldSummary of(Map<String, List<LegalHold>> holdsByCategory) {
        int total = holdsByCategory.values().stream().mapToInt(List::size).sum();
        return new LegalHoldSummary(List.copyOf(holdsByCategory.keySet()), total);
    }

    public static LegalHoldSummary none() {
        return new LegalHoldSummary(List.of(), 0);
    }
}
