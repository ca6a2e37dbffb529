package com.compliance.retention.hold;

import com.compliance.retention.audit.AuditAction;
import com.compliance.retention.audit.AuditService;
import com.compliance.retention.metrics.RetentionMetrics;
import com.compliance.retention.scan.ExpirationRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Removes categories under active legal hold from the deletion candidates.
 *
 * <p>Exclusion is category-wide: one active hold on any record of a category
 * protects the whole category for this cycle. If the hold store cannot be read
 * the filter throws {@link HoldLookupException} rather than guessing.</p>
 */
public class HoldFilter {
    private static final Logger log = LoggerFactory.getLogger(HoldFilter.class);

    private final LegalHoldStore holdStore;
    private final AuditService auditService;
    private final RetentionMetrics metrics;

    public HoldFilter(LegalHoldStore holdStore, AuditService auditService, RetentionMetrics metrics) {
        this.holdStore = holdStore;
        this.auditService = auditService;
        this.metrics = metrics;
    }

    public HoldFilterResult apply(Map<String, ExpirationRecord> expirations, Instant now) {
        return apply(expirations, now, null);
    }

    /**
     * Filters the scan result against the holds active at {@code now}.
     *
     * @throws HoldLookupException if active holds cannot be determined
     */
    public HoldFilterResult apply(Map<String, ExpirationRecord> expirations, Instant now, String runId) {
        List<LegalHold> holds;
        try {
            holds = holdStore.findActiveHolds(now);
        } catch (RuntimeException e) {
            throw new HoldLookupException("Active legal holds could not be read: " + e.getMessage(), e);
        }

        Map<String, List<LegalHold>> holdsByCategory = new LinkedHashMap<>();
        for (LegalHold hold : holds) {
            // a store may return holds that lapse exactly at now
            if (hold.isActive(now)) {
                holdsByCategory.computeIfAbsent(hold.category(), k -> new ArrayList<>()).add(hold);
            }
        }

        Map<String, ExpirationRecord> eligible = new LinkedHashMap<>();
        expirations.forEach((category, record) -> {
            List<LegalHold> categoryHolds = holdsByCategory.get(category);
            if (categoryHolds == null) {
                eligible.put(category, record);
                return;
            }
            log.info("retention.hold.excluded category={} holds={} expired={}",
                    category, categoryHolds.size(), record.expiredCount());
            metrics.incrementHoldExclusion(category);
            auditService.record(AuditAction.CATEGORY_HELD, runId, category, Map.of(
                    "holds", categoryHolds.size(),
                    "expiredRecords", record.expiredCount(),
                    "heldRecordIds", categoryHolds.stream().map(LegalHold::recordId).toList()
            ));
        });

        log.info("retention.hold.completed activeHolds={} heldCategories={} eligible={}",
                holdsByCategory.values().stream().mapToInt(List::size).sum(),
                holdsByCategory.size(), eligible.size());
        return new HoldFilterResult(eligible, holdsByCategory);
    }
}
