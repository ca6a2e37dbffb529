package com.compliance.retention.policy;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered set of field rules applied to a category's expired records before deletion.
 *
 * @param category the data category
 * @param fields   field rules in application order, one per field
 */
public record AnonymizationProfile(String category, List<FieldRule> fields) {

    public AnonymizationProfile {
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(fields, "fields is required");
        fields = List.copyOf(fields);
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("Anonymization profile for " + category + " has no fields");
        }
        Set<String> seen = new HashSet<>();
        for (FieldRule rule : fields) {
            if (!seen.add(rule.field())) {
                throw new IllegalArgumentException(
                        "Field " + rule.field() + " listed twice in profile for " + category);
            }
        }
    }

    /**
     * Builds a profile whose rules are inferred from the field names.
     */
    public static AnonymizationProfile ofFields(String category, String... fieldNames) {
        return new AnonymizationProfile(category, List.of(fieldNames).stream()
                .map(FieldRule::forField)
                .toList());
    }

    public List<String> fieldNames() {
        return fields.stream().map(FieldRule::field).toList();
    }
}
