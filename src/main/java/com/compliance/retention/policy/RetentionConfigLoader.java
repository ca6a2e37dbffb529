package com.compliance.retention.policy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a {@link RetentionConfiguration} from a JSON policy document.
 *
 * <p>Document layout:</p>
 * <pre>
 * {
 *   "policies": [
 *     { "category": "session_data", "retentionDays": 30 },
 *     { "category": "cache_data", "retention": "PT12H" }
 *   ],
 *   "anonymization": {
 *     "user_profiles": ["email", "first_name"],
 *     "devices": [ { "field": "mac", "rule": "NULL_VALUE", "token": "00:00:00:00:00:00" } ]
 *   }
 * }
 * </pre>
 *
 * <p>Plain field names get their rule inferred by {@link FieldRule#forField(String)};
 * object entries state the rule explicitly.</p>
 */
public class RetentionConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(RetentionConfigLoader.class);

    /** Classpath resource carrying the default policy table. */
    public static final String DEFAULT_RESOURCE = "retention-policies.json";

    private final ObjectMapper objectMapper;

    public RetentionConfigLoader() {
        this(new ObjectMapper());
    }

    public RetentionConfigLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public RetentionConfiguration loadDefault() {
        return loadResource(DEFAULT_RESOURCE);
    }

    public RetentionConfiguration loadResource(String resourceName) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = RetentionConfigLoader.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resourceName)) {
            if (in == null) {
                throw new RetentionConfigurationException("Policy resource not found on classpath: " + resourceName);
            }
            RetentionConfiguration configuration = parse(objectMapper.readTree(in));
            log.info("retention.config.loaded source=classpath:{} policies={} profiles={}",
                    resourceName, configuration.policies().size(), configuration.profiles().size());
            return configuration;
        } catch (IOException e) {
            throw new RetentionConfigurationException("Failed to read policy resource " + resourceName, e);
        }
    }

    public RetentionConfiguration load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            RetentionConfiguration configuration = parse(objectMapper.readTree(in));
            log.info("retention.config.loaded source={} policies={} profiles={}",
                    path, configuration.policies().size(), configuration.profiles().size());
            return configuration;
        } catch (IOException e) {
            throw new RetentionConfigurationException("Failed to read policy document " + path, e);
        }
    }

    public RetentionConfiguration parse(String json) {
        try {
            return parse(objectMapper.readTree(json));
        } catch (IOException e) {
            throw new RetentionConfigurationException("Malformed policy document", e);
        }
    }

    private RetentionConfiguration parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new RetentionConfigurationException("Policy document must be a JSON object");
        }
        JsonNode policiesNode = root.path("policies");
        if (!policiesNode.isArray() || policiesNode.isEmpty()) {
            throw new RetentionConfigurationException("Policy document must declare a non-empty 'policies' array");
        }

        try {
            PolicyRegistry.Builder registry = PolicyRegistry.builder();
            for (JsonNode node : policiesNode) {
                registry.policy(parsePolicy(node));
            }

            List<AnonymizationProfile> profiles = new ArrayList<>();
            JsonNode anonymizationNode = root.path("anonymization");
            if (anonymizationNode.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> it = anonymizationNode.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> entry = it.next();
                    profiles.add(parseProfile(entry.getKey(), entry.getValue()));
                }
            }
            return new RetentionConfiguration(registry.build(), AnonymizationProfiles.of(profiles));
        } catch (IllegalArgumentException | NullPointerException | DateTimeParseException e) {
            throw new RetentionConfigurationException("Invalid policy document: " + e.getMessage(), e);
        }
    }

    private RetentionPolicy parsePolicy(JsonNode node) {
        String category = node.path("category").asText(null);
        if (node.hasNonNull("retentionDays")) {
            return RetentionPolicy.ofDays(category, node.get("retentionDays").asLong());
        }
        if (node.hasNonNull("retention")) {
            return new RetentionPolicy(category, Duration.parse(node.get("retention").asText()));
        }
        throw new RetentionConfigurationException(
                "Policy for '" + category + "' needs either 'retentionDays' or 'retention'");
    }

    private AnonymizationProfile parseProfile(String category, JsonNode fieldsNode) {
        if (!fieldsNode.isArray()) {
            throw new RetentionConfigurationException("Anonymization fields for " + category + " must be an array");
        }
        List<FieldRule> rules = new ArrayList<>();
        for (JsonNode fieldNode : fieldsNode) {
            if (fieldNode.isTextual()) {
                rules.add(FieldRule.forField(fieldNode.asText()));
            } else {
                String field = fieldNode.path("field").asText(null);
                AnonymizationRule rule = AnonymizationRule.valueOf(
                        fieldNode.path("rule").asText("").toUpperCase(Locale.ROOT));
                String token = fieldNode.hasNonNull("token")
                        ? fieldNode.get("token").asText()
                        : FieldRule.forField(field).token();
                rules.add(new FieldRule(field, rule, token));
            }
        }
        return new AnonymizationProfile(category, rules);
    }
}
