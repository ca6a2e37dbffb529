package com.compliance.retention.anonymize;

import com.compliance.retention.audit.AuditAction;
import com.compliance.retention.audit.AuditService;
import com.compliance.retention.metrics.RetentionMetrics;
import com.compliance.retention.pipeline.CategoryResult;
import com.compliance.retention.pipeline.CategoryTaskRunner;
import com.compliance.retention.pipeline.PipelineStage;
import com.compliance.retention.policy.AnonymizationProfile;
import com.compliance.retention.policy.AnonymizationProfiles;
import com.compliance.retention.scan.ExpirationRecord;
import com.compliance.retention.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rewrites sensitive fields of expired records before they are deleted.
 *
 * <p>Only categories that appear both in the hold-filtered scan result and in the
 * anonymization profiles are touched. Records already carrying an anonymization
 * marker are skipped, so running the anonymizer twice changes nothing the second
 * time. A category whose anonymization fails gets a failed outcome and must not
 * be deleted in this cycle.</p>
 */
public class Anonymizer {
    private static final Logger log = LoggerFactory.getLogger(Anonymizer.class);

    /** Reason tag stamped on every anonymized record. */
    public static final String REASON = "DATA_RETENTION_POLICY";

    private final RecordStore store;
    private final CategoryTaskRunner runner;
    private final AuditService auditService;
    private final RetentionMetrics metrics;

    public Anonymizer(RecordStore store, CategoryTaskRunner runner,
                      AuditService auditService, RetentionMetrics metrics) {
        this.store = store;
        this.runner = runner;
        this.auditService = auditService;
        this.metrics = metrics;
    }

    public Map<String, AnonymizationOutcome> anonymize(Map<String, ExpirationRecord> eligible,
                                                       AnonymizationProfiles profiles, Instant now) {
        return anonymize(eligible, profiles, now, null);
    }

    /**
     * Anonymizes the eligible categories that have a profile.
     *
     * @return outcomes keyed by category, in the order of {@code eligible}
     */
    public Map<String, AnonymizationOutcome> anonymize(Map<String, ExpirationRecord> eligible,
                                                       AnonymizationProfiles profiles, Instant now,
                                                       String runId) {
        List<String> targets = eligible.keySet().stream()
                .filter(category -> profiles.find(category).isPresent())
                .toList();
        if (targets.isEmpty()) {
            log.info("retention.anonymize.skipped reason=no-profiled-categories");
            return Map.of();
        }
        log.info("retention.anonymize.starting categories={}", targets);

        Map<String, CategoryResult<Long>> results = runner.runAll(
                PipelineStage.ANONYMIZE.label(), runId, targets,
                category -> {
                    AnonymizationProfile profile = profiles.find(category).orElseThrow();
                    Instant cutoff = eligible.get(category).cutoff(now);
                    return store.anonymizeExpired(category, cutoff, profile.fields(), now, REASON);
                });

        Map<String, AnonymizationOutcome> outcomes = new LinkedHashMap<>();
        results.forEach((category, result) -> {
            List<String> fields = profiles.find(category).orElseThrow().fieldNames();
            if (result.isSuccess()) {
                long rewritten = result.value();
                outcomes.put(category, AnonymizationOutcome.succeeded(category, fields, rewritten));
                metrics.recordRecordsAnonymized(category, rewritten);
                auditService.record(AuditAction.CATEGORY_ANONYMIZED, runId, category, Map.of(
                        "fields", fields,
                        "recordsAnonymized", rewritten
                ));
                log.info("retention.anonymize.completed category={} fields={} records={}",
                        category, fields.size(), rewritten);
            } else {
                outcomes.put(category, AnonymizationOutcome.failed(category, fields, result.errorMessage()));
                metrics.incrementCategoryFailure(PipelineStage.ANONYMIZE.label(), category);
                auditService.record(AuditAction.CATEGORY_ANONYMIZATION_FAILED, runId, category, Map.of(
                        "fields", fields,
                        "error", result.errorMessage()
                ));
                log.error("retention.anonymize.failed category={} error={}",
                        category, result.errorMessage(), result.error());
            }
        });
        return Collections.unmodifiableMap(outcomes);
    }
}
