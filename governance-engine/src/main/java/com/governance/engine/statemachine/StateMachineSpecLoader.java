package com.governance.engine.statemachine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.governance.core.exception.SpecificationLoadException;
import com.governance.core.model.statemachine.ExternalSource;
import com.governance.core.model.statemachine.ExternalStatusMapping;
import com.governance.core.model.statemachine.Precondition;
import com.governance.core.model.statemachine.SideEffect;
import com.governance.core.model.statemachine.SideEffectKind;
import com.governance.core.model.statemachine.StateCategory;
import com.governance.core.model.statemachine.StateDefinition;
import com.governance.core.model.statemachine.TransitionDefinition;
import com.governance.core.model.statemachine.TransitionKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the lifecycle specification from three YAML documents in one directory:
 * {@value #STATES_FILE}, {@value #TRANSITIONS_FILE} and {@value #MAPPING_FILE}.
 *
 * Any structural problem is fatal: the loader throws {@link SpecificationLoadException}
 * rather than returning a partially usable specification.
 */
public class StateMachineSpecLoader {

    private static final Logger log = LoggerFactory.getLogger(StateMachineSpecLoader.class);

    public static final String DEFAULT_LOCATION = "classpath:governance/state-machine/v1";
    public static final String STATES_FILE = "state-machine.yaml";
    public static final String TRANSITIONS_FILE = "transitions.yaml";
    public static final String MAPPING_FILE = "external-mapping.yaml";

    private final ObjectMapper yamlMapper;
    private final ResourceLoader resourceLoader;

    public StateMachineSpecLoader() {
        this(new DefaultResourceLoader());
    }

    public StateMachineSpecLoader(ResourceLoader resourceLoader) {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.resourceLoader = resourceLoader;
    }

    /**
     * @param location directory location, e.g. {@code classpath:governance/state-machine/v1}
     *                 or {@code file:/etc/governance/state-machine}
     */
    public StateMachineSpec load(String location) {
        String base = location.endsWith("/") ? location : location + "/";
        log.info("Loading state machine specification from {}", base);

        JsonNode statesDoc = read(base + STATES_FILE);
        JsonNode transitionsDoc = read(base + TRANSITIONS_FILE);
        JsonNode mappingDoc = read(base + MAPPING_FILE);

        Map<String, StateDefinition> states = parseStates(statesDoc, base + STATES_FILE);
        Map<StateMachineSpec.TransitionKey, TransitionDefinition> transitions =
            parseTransitions(transitionsDoc, states, base + TRANSITIONS_FILE);
        ExternalStatusMapping mapping = parseMapping(mappingDoc, states, base + MAPPING_FILE);

        String version = statesDoc.path("version").asText("unversioned");
        log.info("Loaded state machine {}: {} states, {} transitions", version, states.size(), transitions.size());
        return new StateMachineSpec(version, states, transitions, mapping);
    }

    public StateMachineSpec loadDefault() {
        return load(DEFAULT_LOCATION);
    }

    private JsonNode read(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new SpecificationLoadException(location, "file not found");
        }
        try (InputStream inputStream = resource.getInputStream()) {
            JsonNode root = yamlMapper.readTree(inputStream);
            if (root == null || !root.isObject()) {
                throw new SpecificationLoadException(location, "document is empty or not a mapping");
            }
            return root;
        } catch (IOException e) {
            throw new SpecificationLoadException(location, "unreadable YAML: " + e.getMessage(), e);
        }
    }

    // ========== States ==========

    private Map<String, StateDefinition> parseStates(JsonNode doc, String source) {
        JsonNode statesNode = doc.path("states");
        if (!statesNode.isObject() || statesNode.isEmpty()) {
            throw new SpecificationLoadException(source, "no states defined");
        }

        Map<String, StateDefinition> states = new LinkedHashMap<>();
        statesNode.fields().forEachRemaining(entry -> {
            String name = entry.getKey();
            JsonNode node = entry.getValue();
            StateCategory category;
            try {
                category = StateCategory.fromTag(node.path("category").asText(null));
            } catch (IllegalArgumentException e) {
                throw new SpecificationLoadException(source, "state " + name + " has invalid category", e);
            }
            states.put(name, new StateDefinition(
                name,
                node.path("description").asText(""),
                category,
                node.path("terminal").asBoolean(false),
                node.path("active").asBoolean(true),
                textList(node.path("entry_conditions")),
                textList(node.path("exit_conditions")),
                textList(node.path("predecessors")),
                textList(node.path("successors"))
            ));
        });

        for (StateDefinition state : states.values()) {
            if (state.terminal() && !state.successors().isEmpty()) {
                throw new SpecificationLoadException(source,
                    "terminal state " + state.name() + " declares successors " + state.successors());
            }
            if (state.isHold() && state.terminal()) {
                throw new SpecificationLoadException(source, "hold state " + state.name() + " cannot be terminal");
            }
            requireKnown(states, state.successors(), source, "successor of " + state.name());
            requireKnown(states, state.predecessors(), source, "predecessor of " + state.name());
        }
        return states;
    }

    // ========== Transitions ==========

    private Map<StateMachineSpec.TransitionKey, TransitionDefinition> parseTransitions(
            JsonNode doc, Map<String, StateDefinition> states, String source) {
        Map<StateMachineSpec.TransitionKey, TransitionDefinition> transitions = new HashMap<>();

        for (JsonNode node : doc.path("transitions")) {
            String from = node.path("from").asText(null);
            String to = node.path("to").asText(null);
            String name = node.path("name").asText(from + "_TO_" + to);
            requireKnown(states, List.of(String.valueOf(from), String.valueOf(to)), source, "endpoint of " + name);

            if (!states.get(from).hasSuccessor(to)) {
                throw new SpecificationLoadException(source,
                    "transition " + name + " is not a declared successor edge " + from + " -> " + to);
            }

            TransitionDefinition transition;
            try {
                transition = new TransitionDefinition(
                    name, from, to,
                    TransitionKind.fromTag(node.path("type").asText(null)),
                    node.path("description").asText(""),
                    parsePreconditions(node.path("preconditions")),
                    parseSideEffects(node.path("side_effects")),
                    node.path("evidence_required").asBoolean(false),
                    textList(node.path("evidence_types")),
                    node.path("auto_transition").asBoolean(false),
                    textList(node.path("auto_transition_on"))
                );
            } catch (IllegalArgumentException e) {
                throw new SpecificationLoadException(source, "transition " + name + ": " + e.getMessage(), e);
            }

            if (transition.autoTransition() && transition.autoTransitionOn().isEmpty()) {
                throw new SpecificationLoadException(source,
                    "automatic transition " + name + " must name the evidence that triggers it");
            }

            StateMachineSpec.TransitionKey key = new StateMachineSpec.TransitionKey(from, to);
            if (transitions.putIfAbsent(key, transition) != null) {
                throw new SpecificationLoadException(source, "duplicate transition " + from + " -> " + to);
            }
        }

        // A hold state must be able to return to every state it lists.
        for (StateDefinition state : states.values()) {
            if (!state.isHold()) {
                continue;
            }
            for (String successor : state.successors()) {
                if (!transitions.containsKey(new StateMachineSpec.TransitionKey(state.name(), successor))) {
                    throw new SpecificationLoadException(source,
                        "hold state " + state.name() + " has no transition for successor " + successor);
                }
            }
        }
        return transitions;
    }

    private List<Precondition> parsePreconditions(JsonNode node) {
        List<Precondition> preconditions = new ArrayList<>();
        for (JsonNode element : node) {
            preconditions.add(Precondition.of(
                element.path("type").asText(),
                element.path("required").asBoolean(true)
            ));
        }
        return preconditions;
    }

    private List<SideEffect> parseSideEffects(JsonNode node) {
        List<SideEffect> effects = new ArrayList<>();
        for (JsonNode element : node) {
            String tag = element.path("type").asText();
            Map<String, String> parameters = new LinkedHashMap<>();
            element.fields().forEachRemaining(field -> {
                if (!"type".equals(field.getKey()) && !field.getValue().isNull()) {
                    parameters.put(field.getKey(), field.getValue().asText());
                }
            });
            effects.add(new SideEffect(tag, SideEffectKind.fromTag(tag), parameters));
        }
        return effects;
    }

    // ========== External mapping ==========

    private ExternalStatusMapping parseMapping(JsonNode doc, Map<String, StateDefinition> states, String source) {
        Map<ExternalSource, Map<String, String>> inbound = new EnumMap<>(ExternalSource.class);
        JsonNode inboundNode = doc.path("inbound");
        for (ExternalSource externalSource : ExternalSource.values()) {
            Map<String, String> table = new HashMap<>();
            inboundNode.path(tableName(externalSource)).fields().forEachRemaining(entry -> {
                if (entry.getValue().isNull()) {
                    return;
                }
                String state = entry.getValue().asText();
                requireKnown(states, List.of(state), source, "mapping target of '" + entry.getKey() + "'");
                table.put(entry.getKey(), state);
            });
            inbound.put(externalSource, table);
        }

        Map<ExternalSource, Set<String>> doneSignals = new EnumMap<>(ExternalSource.class);
        JsonNode doneNode = doc.path("done_signals");
        for (ExternalSource externalSource : ExternalSource.values()) {
            doneSignals.put(externalSource, new HashSet<>(textList(doneNode.path(tableName(externalSource)))));
        }

        Map<String, ExternalStatusMapping.StateLabels> labels = new HashMap<>();
        doc.path("outbound_labels").fields().forEachRemaining(entry -> {
            requireKnown(states, List.of(entry.getKey()), source, "outbound label state");
            labels.put(entry.getKey(), new ExternalStatusMapping.StateLabels(
                entry.getValue().path("primary").asText(null),
                textList(entry.getValue().path("additional"))
            ));
        });

        Map<String, ExternalStatusMapping.CheckRequirements> checks = new HashMap<>();
        doc.path("checks").fields().forEachRemaining(entry -> {
            requireKnown(states, List.of(entry.getKey()), source, "checks state");
            checks.put(entry.getKey(), new ExternalStatusMapping.CheckRequirements(
                textList(entry.getValue().path("required")),
                textList(entry.getValue().path("optional"))
            ));
        });

        return new ExternalStatusMapping(inbound, doneSignals, labels, checks);
    }

    private static String tableName(ExternalSource source) {
        return switch (source) {
            case PROJECT_STATUS -> "project_status";
            case LABEL -> "labels";
            case PR_STATUS -> "pr_status";
        };
    }

    // ========== Helpers ==========

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node != null && node.isArray()) {
            node.forEach(element -> values.add(element.asText()));
        }
        return values;
    }

    private static void requireKnown(Map<String, StateDefinition> states, List<String> names,
                                     String source, String role) {
        for (String name : names) {
            if (!states.containsKey(name)) {
                throw new SpecificationLoadException(source, "unknown state '" + name + "' referenced as " + role);
            }
        }
    }
}
