package com.compliance.retention.policy;

import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * Anonymization rule bound to one field of a category's records.
 *
 * @param field the field (column or property) name
 * @param rule  the rewrite rule
 * @param token the replacement for {@link AnonymizationRule#REDACTION_TOKEN} and
 *              {@link AnonymizationRule#NULL_VALUE}; for
 *              {@link AnonymizationRule#UNIQUE_PLACEHOLDER} the placeholder domain
 */
public record FieldRule(String field, AnonymizationRule rule, String token) {

    public static final String PLACEHOLDER_PREFIX = "anonymized_";
    public static final String PLACEHOLDER_DOMAIN = "deleted.local";
    public static final String NAME_TOKEN = "DELETED";
    public static final String PHONE_TOKEN = "000-000-0000";
    public static final String IP_NULL_VALUE = "0.0.0.0";
    public static final String GENERIC_TOKEN = "ANONYMIZED";

    public FieldRule {
        Objects.requireNonNull(field, "field is required");
        Objects.requireNonNull(rule, "rule is required");
        Objects.requireNonNull(token, "token is required");
        if (!RetentionPolicy.CATEGORY_PATTERN.matcher(field).matches()) {
            throw new IllegalArgumentException("field must be a plain identifier, got: '" + field + "'");
        }
    }

    /**
     * Infers the rule from a field name: email fields get unique placeholders,
     * names and phone numbers fixed tokens, IP addresses a null address, and
     * everything else the generic {@value #GENERIC_TOKEN} token.
     */
    public static FieldRule forField(String field) {
        String name = field.toLowerCase(Locale.ROOT);
        if (name.equals("email") || name.endsWith("_email")) {
            return new FieldRule(field, AnonymizationRule.UNIQUE_PLACEHOLDER, PLACEHOLDER_DOMAIN);
        }
        if (name.equals("first_name") || name.equals("last_name")) {
            return new FieldRule(field, AnonymizationRule.REDACTION_TOKEN, NAME_TOKEN);
        }
        if (name.equals("phone")) {
            return new FieldRule(field, AnonymizationRule.REDACTION_TOKEN, PHONE_TOKEN);
        }
        if (name.equals("ip_address")) {
            return new FieldRule(field, AnonymizationRule.NULL_VALUE, IP_NULL_VALUE);
        }
        return new FieldRule(field, AnonymizationRule.REDACTION_TOKEN, GENERIC_TOKEN);
    }

    /**
     * Produces the replacement value for one record.
     * Placeholder values differ on every call; token values never do.
     */
    public String replacementValue() {
        if (rule == AnonymizationRule.UNIQUE_PLACEHOLDER) {
            return PLACEHOLDER_PREFIX + UUID.randomUUID() + "@" + token;
        }
        return token;
    }
}
