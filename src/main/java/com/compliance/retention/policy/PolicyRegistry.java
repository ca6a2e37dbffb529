package com.compliance.retention.policy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, ordered table of retention policies keyed by category.
 * Iteration order is the registration order and is preserved through every
 * pipeline stage, so manifests and reports list categories deterministically.
 */
public final class PolicyRegistry {

    private final Map<String, RetentionPolicy> policies;

    private PolicyRegistry(Map<String, RetentionPolicy> policies) {
        this.policies = Collections.unmodifiableMap(new LinkedHashMap<>(policies));
    }

    /**
     * Creates the default policy table.
     * - Session data: 30 days
     * - Activity logs: 90 days
     * - Audit and transaction logs: 7 years
     * - Profiles and support tickets: 3 years
     * - Marketing and backup data: 1 year
     * - Temporary files: 7 days, cache: 1 day
     */
    public static PolicyRegistry defaults() {
        return builder()
                .policy("user_activity_logs", Duration.ofDays(90))
                .policy("session_data", Duration.ofDays(30))
                .policy("audit_logs", Duration.ofDays(2555))
                .policy("user_profiles", Duration.ofDays(1095))
                .policy("transaction_logs", Duration.ofDays(2555))
                .policy("marketing_data", Duration.ofDays(365))
                .policy("support_tickets", Duration.ofDays(1095))
                .policy("backup_data", Duration.ofDays(365))
                .policy("temp_files", Duration.ofDays(7))
                .policy("cache_data", Duration.ofDays(1))
                .build();
    }

    public static PolicyRegistry of(List<RetentionPolicy> policies) {
        Builder builder = builder();
        policies.forEach(builder::policy);
        return builder.build();
    }

    public Optional<RetentionPolicy> find(String category) {
        return Optional.ofNullable(policies.get(category));
    }

    public boolean contains(String category) {
        return policies.containsKey(category);
    }

    public Set<String> categories() {
        return policies.keySet();
    }

    public List<RetentionPolicy> policies() {
        return List.copyOf(policies.values());
    }

    public int size() {
        return policies.size();
    }

    public boolean isEmpty() {
        return policies.isEmpty();
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>();
        policies.values().forEach(p -> parts.add(p.category() + "=" + p.retentionDays() + "d"));
        return "PolicyRegistry" + parts;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, RetentionPolicy> policies = new LinkedHashMap<>();

        public Builder policy(RetentionPolicy policy) {
            Objects.requireNonNull(policy, "policy is required");
            if (policies.putIfAbsent(policy.category(), policy) != null) {
                throw new IllegalArgumentException("Duplicate retention policy for category " + policy.category());
            }
            return this;
        }

        public Builder policy(String category, Duration retentionPeriod) {
            return policy(new RetentionPolicy(category, retentionPeriod));
        }

        public Builder policyDays(String category, long days) {
            return policy(RetentionPolicy.ofDays(category, days));
        }

        public PolicyRegistry build() {
            return new PolicyRegistry(policies);
        }
    }
}
