package com.compliance.retention.policy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FieldRuleTest {

    @ParameterizedTest
    @DisplayName("The rule is inferred from the field name")
    @CsvSource({
            "email, UNIQUE_PLACEHOLDER, deleted.local",
            "contact_email, UNIQUE_PLACEHOLDER, deleted.local",
            "first_name, REDACTION_TOKEN, DELETED",
            "last_name, REDACTION_TOKEN, DELETED",
            "phone, REDACTION_TOKEN, 000-000-0000",
            "ip_address, NULL_VALUE, 0.0.0.0",
            "user_id, REDACTION_TOKEN, ANONYMIZED",
            "billing_address, REDACTION_TOKEN, ANONYMIZED"
    })
    void testInference(String field, AnonymizationRule rule, String token) {
        FieldRule fieldRule = FieldRule.forField(field);

        assertEquals(field, fieldRule.field());
        assertEquals(rule, fieldRule.rule());
        assertEquals(token, fieldRule.token());
    }

    @Test
    @DisplayName("Placeholders are unique per call")
    void testPlaceholderUnique() {
        FieldRule rule = FieldRule.forField("email");

        String first = rule.replacementValue();
        String second = rule.replacementValue();

        assertNotEquals(first, second);
        assertTrue(first.startsWith("anonymized_"));
        assertTrue(first.endsWith("@deleted.local"));
    }

    @Test
    @DisplayName("Tokens are fixed")
    void testTokenFixed() {
        FieldRule rule = FieldRule.forField("phone");
        assertEquals(rule.replacementValue(), rule.replacementValue());
    }

    @Test
    @DisplayName("Profiles reject duplicate and empty field lists")
    void testProfileValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> AnonymizationProfile.ofFields("user_profiles", "email", "email"));
        assertThrows(IllegalArgumentException.class,
                () -> new AnonymizationProfile("user_profiles", List.of()));
        assertThrows(IllegalArgumentException.class, () -> FieldRule.forField("drop table"));
    }

    @Test
    @DisplayName("Default profiles cover the personal-data categories")
    void testDefaultProfiles() {
        AnonymizationProfiles profiles = AnonymizationProfiles.defaults();

        assertEquals(4, profiles.size());
        assertEquals(List.of("email", "first_name", "last_name", "phone", "address"),
                profiles.find("user_profiles").orElseThrow().fieldNames());
        assertTrue(profiles.find("session_data").isEmpty());
        assertEquals(0, AnonymizationProfiles.none().size());
        assertThrows(IllegalArgumentException.class, () -> AnonymizationProfiles.of(List.of(
                AnonymizationProfile.ofFields("a", "email"),
                AnonymizationProfile.ofFields("a", "phone"))));
    }
}
