package com.governance.engine.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.governance.core.exception.SpecificationLoadException;
import com.governance.core.model.run.GovernedAction;
import com.governance.core.model.run.PlaybookDefinition;
import com.governance.core.model.run.RetryPolicy;
import com.governance.core.model.run.StepDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads playbook YAML files matching a location pattern into a {@link PlaybookRegistry}.
 *
 * <pre>
 * playbook_id: issue-publish
 * timeout_ms: 120000
 * steps:
 *   - name: publish
 *     action: github.createIssue
 *     params: { repo: "${input.repo}" }
 *     if: "${input.publish}"
 *     assign: issue
 *     retry: { max_attempts: 3, backoff_multiplier: 2 }
 *     governance:
 *       action_type: issue_publish
 *       target_type: issue
 *       target_identifier: "${input.repo}#${input.canonicalId}"
 * </pre>
 */
public class PlaybookLoader {

    private static final Logger log = LoggerFactory.getLogger(PlaybookLoader.class);

    public static final String DEFAULT_LOCATION = "classpath*:governance/playbooks/*.yaml";

    private final ObjectMapper yamlMapper;
    private final ResourcePatternResolver resolver;
    private final Duration defaultTimeout;
    private final Duration maxBackoff;

    public PlaybookLoader(Duration defaultTimeout, Duration maxBackoff) {
        this(new PathMatchingResourcePatternResolver(), defaultTimeout, maxBackoff);
    }

    public PlaybookLoader(ResourcePatternResolver resolver, Duration defaultTimeout, Duration maxBackoff) {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.resolver = resolver;
        this.defaultTimeout = defaultTimeout;
        this.maxBackoff = maxBackoff;
    }

    public PlaybookRegistry load(String locationPattern) {
        Resource[] resources;
        try {
            resources = resolver.getResources(locationPattern);
        } catch (IOException e) {
            throw new SpecificationLoadException(locationPattern, "cannot list playbooks: " + e.getMessage(), e);
        }

        Map<String, PlaybookDefinition> playbooks = new HashMap<>();
        for (Resource resource : resources) {
            String source = resource.getDescription();
            PlaybookDefinition playbook = parse(read(resource, source), source);
            if (playbooks.putIfAbsent(playbook.playbookId(), playbook) != null) {
                throw new SpecificationLoadException(source, "duplicate playbook " + playbook.playbookId());
            }
            log.debug("Loaded playbook {} with {} steps from {}", playbook.playbookId(), playbook.steps().size(), source);
        }
        log.info("Loaded {} playbooks from {}", playbooks.size(), locationPattern);
        return new PlaybookRegistry(playbooks);
    }

    /**
     * Parses a single playbook document, e.g. one submitted inline.
     */
    public PlaybookDefinition parse(JsonNode doc, String source) {
        String playbookId = doc.path("playbook_id").asText(null);
        try {
            List<StepDefinition> steps = new ArrayList<>();
            for (JsonNode step : doc.path("steps")) {
                steps.add(parseStep(step));
            }
            JsonNode timeout = doc.get("timeout_ms");
            return new PlaybookDefinition(
                playbookId,
                doc.path("name").asText(playbookId),
                doc.path("description").asText(null),
                steps,
                timeout == null || timeout.isNull() ? defaultTimeout : Duration.ofMillis(timeout.asLong()),
                doc.path("continue_on_error").asBoolean(false)
            );
        } catch (IllegalArgumentException e) {
            throw new SpecificationLoadException(source, "playbook " + playbookId + ": " + e.getMessage(), e);
        }
    }

    private JsonNode read(Resource resource, String source) {
        try (InputStream inputStream = resource.getInputStream()) {
            JsonNode root = yamlMapper.readTree(inputStream);
            if (root == null || !root.isObject()) {
                throw new SpecificationLoadException(source, "document is empty or not a mapping");
            }
            return root;
        } catch (IOException e) {
            throw new SpecificationLoadException(source, "unreadable YAML: " + e.getMessage(), e);
        }
    }

    private StepDefinition parseStep(JsonNode node) {
        JsonNode continueOnError = node.get("continue_on_error");
        return new StepDefinition(
            node.path("name").asText(null),
            node.path("action").asText(null),
            node.get("params"),
            node.path("if").asText(null),
            node.path("assign").asText(null),
            parseRetry(node.get("retry")),
            continueOnError == null || continueOnError.isNull() ? null : continueOnError.asBoolean(),
            parseGovernance(node.get("governance"))
        );
    }

    private RetryPolicy parseRetry(JsonNode node) {
        if (node == null || node.isNull()) {
            return RetryPolicy.noRetry();
        }
        return RetryPolicy.exponential(
            node.path("max_attempts").asInt(1),
            node.path("backoff_multiplier").asDouble(2.0),
            maxBackoff
        );
    }

    private static GovernedAction parseGovernance(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        JsonNode transition = node.path("transition");
        return new GovernedAction(
            node.path("action_type").asText(null),
            node.path("target_type").asText(null),
            node.path("target_identifier").asText(null),
            transition.path("from").asText(null),
            transition.path("to").asText(null),
            node.path("evidence_variable").asText(null)
        );
    }
}
