package com.compliance.retention.policy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable registry of anonymization profiles keyed by category.
 */
public final class AnonymizationProfiles {

    private static final AnonymizationProfiles NONE = new AnonymizationProfiles(Map.of());

    private final Map<String, AnonymizationProfile> profiles;

    private AnonymizationProfiles(Map<String, AnonymizationProfile> profiles) {
        this.profiles = Collections.unmodifiableMap(new LinkedHashMap<>(profiles));
    }

    /**
     * Profiles for the personal-data categories of the default policy table.
     */
    public static AnonymizationProfiles defaults() {
        return of(List.of(
                AnonymizationProfile.ofFields("user_profiles",
                        "email", "first_name", "last_name", "phone", "address"),
                AnonymizationProfile.ofFields("user_activity_logs",
                        "user_id", "ip_address", "user_agent"),
                AnonymizationProfile.ofFields("transaction_logs",
                        "user_id", "payment_method", "billing_address"),
                AnonymizationProfile.ofFields("support_tickets",
                        "user_id", "email", "phone", "description")
        ));
    }

    public static AnonymizationProfiles none() {
        return NONE;
    }

    public static AnonymizationProfiles of(List<AnonymizationProfile> profiles) {
        Map<String, AnonymizationProfile> byCategory = new LinkedHashMap<>();
        for (AnonymizationProfile profile : profiles) {
            if (byCategory.putIfAbsent(profile.category(), profile) != null) {
                throw new IllegalArgumentException(
                        "Duplicate anonymization profile for category " + profile.category());
            }
        }
        return new AnonymizationProfiles(byCategory);
    }

    public Optional<AnonymizationProfile> find(String category) {
        return Optional.ofNullable(profiles.get(category));
    }

    public Set<String> categories() {
        return profiles.keySet();
    }

    public int size() {
        return profiles.size();
    }
}
