package com.compliance.retention.scan;

import com.compliance.retention.audit.AuditAction;
import com.compliance.retention.audit.AuditService;
import com.compliance.retention.metrics.RetentionMetrics;
import com.compliance.retention.pipeline.CategoryResult;
import com.compliance.retention.pipeline.CategoryTaskRunner;
import com.compliance.retention.pipeline.PipelineStage;
import com.compliance.retention.policy.PolicyRegistry;
import com.compliance.retention.policy.RetentionPolicy;
import com.compliance.retention.store.ExpiredRange;
import com.compliance.retention.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Finds, per category, the records that have outlived their retention period.
 *
 * <p>Every category is measured against the same {@code now}. Categories with
 * nothing expired are left out of the result, and so are categories whose scan
 * failed: those are logged, audited and counted, and are retried by the next cycle.</p>
 */
public class ExpirationScanner {
    private static final Logger log = LoggerFactory.getLogger(ExpirationScanner.class);

    private final RecordStore store;
    private final CategoryTaskRunner runner;
    private final AuditService auditService;
    private final RetentionMetrics metrics;

    public ExpirationScanner(RecordStore store, CategoryTaskRunner runner,
                             AuditService auditService, RetentionMetrics metrics) {
        this.store = store;
        this.runner = runner;
        this.auditService = auditService;
        this.metrics = metrics;
    }

    public Map<String, ExpirationRecord> scan(PolicyRegistry policies, Instant now) {
        return scan(policies, now, null);
    }

    /**
     * Scans every policy's category.
     *
     * @return expiration records in policy order, only for categories with expired records
     */
    public Map<String, ExpirationRecord> scan(PolicyRegistry policies, Instant now, String runId) {
        log.info("retention.scan.starting categories={} now={}", policies.size(), now);

        Map<String, CategoryResult<ExpirationRecord>> results = runner.runAll(
                PipelineStage.SCAN.label(), runId, policies.categories(),
                category -> scanCategory(policies.find(category).orElseThrow(), now));

        Map<String, ExpirationRecord> expired = new LinkedHashMap<>();
        results.forEach((category, result) -> {
            if (!result.isSuccess()) {
                log.error("retention.scan.failed category={} error={}", category, result.errorMessage(), result.error());
                metrics.incrementCategoryFailure(PipelineStage.SCAN.label(), category);
                auditService.record(AuditAction.CATEGORY_SCAN_FAILED, runId, category,
                        Map.of("error", result.errorMessage()));
            } else if (result.value().expiredCount() > 0) {
                expired.put(category, result.value());
            }
        });

        log.info("retention.scan.completed categoriesWithExpired={} totalExpired={}",
                expired.size(), expired.values().stream().mapToLong(ExpirationRecord::expiredCount).sum());
        return Collections.unmodifiableMap(expired);
    }

    private ExpirationRecord scanCategory(RetentionPolicy policy, Instant now) {
        Instant cutoff = now.minus(policy.retentionPeriod());
        ExpiredRange range = store.findExpired(policy.category(), cutoff);
        log.debug("retention.scan.category category={} cutoff={} expired={}",
                policy.category(), cutoff, range.count());
        return new ExpirationRecord(policy.category(), range.count(), range.oldest(), range.newest(),
                policy.retentionPeriod());
    }
}
