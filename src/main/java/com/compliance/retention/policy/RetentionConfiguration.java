package com.compliance.retention.policy;

import java.util.Objects;

/**
 * The complete, immutable input table for one retention cycle.
 *
 * @param policies retention period per category
 * @param profiles anonymization profile per category (may cover only some categories)
 */
public record RetentionConfiguration(PolicyRegistry policies, AnonymizationProfiles profiles) {

    public RetentionConfiguration {
        Objects.requireNonNull(policies, "policies is required");
        profiles = profiles != null ? profiles : AnonymizationProfiles.none();
    }

    public static RetentionConfiguration defaults() {
        return new RetentionConfiguration(PolicyRegistry.defaults(), AnonymizationProfiles.defaults());
    }

    public static RetentionConfiguration of(PolicyRegistry policies) {
        return new RetentionConfiguration(policies, AnonymizationProfiles.none());
    }
}
