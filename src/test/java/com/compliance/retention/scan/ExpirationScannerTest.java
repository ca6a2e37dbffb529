package com.compliance.retention.scan;

import com.compliance.retention.audit.AuditAction;
import com.compliance.retention.audit.AuditService;
import com.compliance.retention.metrics.MicrometerRetentionMetrics;
import com.compliance.retention.pipeline.CategoryTaskRunner;
import com.compliance.retention.policy.PolicyRegistry;
import com.compliance.retention.store.ExpiredRange;
import com.compliance.retention.store.InMemoryRecordStore;
import com.compliance.retention.store.StoreAccessException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ExpirationScanner Tests")
class ExpirationScannerTest {

    private static final Instant NOW = Instant.parse("2025-06-01T00:00:00Z");

    private InMemoryRecordStore store;
    private CategoryTaskRunner runner;
    private AuditService auditService;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        store = new InMemoryRecordStore();
        runner = new CategoryTaskRunner(4, Duration.ofSeconds(5));
        auditService = new AuditService();
        registry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        runner.close();
    }

    private ExpirationScanner scanner() {
        return new ExpirationScanner(store, runner, auditService, new MicrometerRetentionMetrics(registry));
    }

    @Test
    @DisplayName("Reports count and bounds for each category with expired records")
    void scansExpiredCategories() {
        Instant oldest = NOW.minus(Duration.ofDays(90));
        Instant newest = NOW.minus(Duration.ofDays(31));
        store.insert("session_data", oldest, Map.of());
        store.insert("session_data", newest, Map.of());
        store.insert("session_data", NOW.minus(Duration.ofDays(2)), Map.of());

        Map<String, ExpirationRecord> result = scanner().scan(
                PolicyRegistry.builder().policyDays("session_data", 30).build(), NOW);

        ExpirationRecord record = result.get("session_data");
        assertEquals(2, record.expiredCount());
        assertEquals(oldest, record.oldestRecordTimestamp());
        assertEquals(newest, record.newestExpiredTimestamp());
        assertEquals(Duration.ofDays(30), record.retentionPeriod());
        assertEquals(NOW.minus(Duration.ofDays(30)), record.cutoff(NOW));
    }

    @Test
    @DisplayName("Categories with nothing expired are omitted and order follows the policies")
    void omitsEmptyCategories() {
        store.insert("temp_files", NOW.minus(Duration.ofDays(8)), Map.of());
        store.insert("cache_data", NOW.minus(Duration.ofDays(2)), Map.of());
        store.insert("marketing_data", NOW.minus(Duration.ofDays(10)), Map.of());

        Map<String, ExpirationRecord> result = scanner().scan(PolicyRegistry.builder()
                .policyDays("temp_files", 7)
                .policyDays("marketing_data", 365)
                .policyDays("cache_data", 1)
                .build(), NOW);

        assertEquals(List.of("temp_files", "cache_data"), List.copyOf(result.keySet()));
        assertThrows(UnsupportedOperationException.class, () -> result.remove("temp_files"));
    }

    @Test
    @DisplayName("A failing category is audited and omitted while the others are scanned")
    void isolatesFailures() {
        store = new InMemoryRecordStore() {
            @Override
            public ExpiredRange findExpired(String category, Instant cutoff) {
                if (category.equals("audit_logs")) {
                    throw new StoreAccessException("table locked");
                }
                return super.findExpired(category, cutoff);
            }
        };
        store.insert("session_data", NOW.minus(Duration.ofDays(40)), Map.of());

        Map<String, ExpirationRecord> result = scanner().scan(PolicyRegistry.builder()
                .policyDays("audit_logs", 2555)
                .policyDays("session_data", 30)
                .build(), NOW, "run-7");

        assertEquals(List.of("session_data"), List.copyOf(result.keySet()));
        var failures = auditService.getEntriesByAction(AuditAction.CATEGORY_SCAN_FAILED);
        assertEquals(1, failures.size());
        assertEquals("audit_logs", failures.get(0).category());
        assertEquals("table locked", failures.get(0).details().get("error"));
        assertEquals(1.0, registry.find("retention.category.failures")
                .tag("stage", "scan").tag("category", "audit_logs").counter().count());
    }

    @Test
    @DisplayName("An empty policy table scans nothing")
    void emptyPolicies() {
        assertTrue(scanner().scan(PolicyRegistry.builder().build(), NOW).isEmpty());
    }
}
