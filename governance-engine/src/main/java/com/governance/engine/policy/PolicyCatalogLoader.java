package com.governance.engine.policy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.governance.core.exception.SpecificationLoadException;
import com.governance.core.model.policy.PolicyAction;
import com.governance.core.model.policy.RateWindow;
import com.governance.engine.json.CanonicalJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Loads {@link PolicyCatalog} from YAML. Malformed policies abort startup.
 */
public class PolicyCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(PolicyCatalogLoader.class);

    public static final String DEFAULT_LOCATION = "classpath:governance/policies/automation-policies.yaml";

    private final ObjectMapper yamlMapper;
    private final ResourceLoader resourceLoader;

    public PolicyCatalogLoader() {
        this(new DefaultResourceLoader());
    }

    public PolicyCatalogLoader(ResourceLoader resourceLoader) {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.resourceLoader = resourceLoader;
    }

    public PolicyCatalog load(String location) {
        log.info("Loading automation policies from {}", location);
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new SpecificationLoadException(location, "file not found");
        }

        JsonNode root;
        try (InputStream inputStream = resource.getInputStream()) {
            root = yamlMapper.readTree(inputStream);
        } catch (IOException e) {
            throw new SpecificationLoadException(location, "unreadable YAML: " + e.getMessage(), e);
        }
        if (root == null || !root.path("policies").isArray()) {
            throw new SpecificationLoadException(location, "missing 'policies' list");
        }

        Map<String, PolicyAction> actions = new HashMap<>();
        for (JsonNode node : root.path("policies")) {
            PolicyAction action = parse(node, location);
            if (actions.putIfAbsent(action.actionType(), action) != null) {
                throw new SpecificationLoadException(location, "duplicate policy for " + action.actionType());
            }
        }

        PolicyCatalog catalog = new PolicyCatalog(
            root.path("version").asText("unversioned"), CanonicalJson.hash(root), actions);
        log.info("Loaded {} automation policies (version {}, hash {})",
            actions.size(), catalog.version(), catalog.contentHash().substring(0, 12));
        return catalog;
    }

    public PolicyCatalog loadDefault() {
        return load(DEFAULT_LOCATION);
    }

    private PolicyAction parse(JsonNode node, String location) {
        String actionType = node.path("action_type").asText(null);
        try {
            Set<String> environments = new HashSet<>();
            node.path("allowed_envs").forEach(env -> environments.add(env.asText().trim().toLowerCase(Locale.ROOT)));

            List<String> template = new ArrayList<>();
            node.path("idempotency_key_template").forEach(field -> template.add(field.asText()));

            return new PolicyAction(
                actionType,
                node.path("description").asText(null),
                environments,
                RateWindow.fromOptional(optionalInt(node, "max_runs_per_window"), optionalLong(node, "window_seconds")),
                optionalLong(node, "cooldown_seconds"),
                node.path("requires_approval").asBoolean(false),
                template
            );
        } catch (IllegalArgumentException e) {
            throw new SpecificationLoadException(location, "policy " + actionType + ": " + e.getMessage(), e);
        }
    }

    private static Integer optionalInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asInt();
    }

    private static Long optionalLong(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asLong();
    }
}
