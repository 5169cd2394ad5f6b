package com.governance.engine.statemachine;

import com.governance.core.exception.NotFoundException;
import com.governance.core.model.statemachine.Evidence;
import com.governance.core.model.statemachine.ExternalSource;
import com.governance.core.model.statemachine.ExternalStatusMapping;
import com.governance.core.model.statemachine.Precondition;
import com.governance.core.model.statemachine.PreconditionResult;
import com.governance.core.model.statemachine.StateDefinition;
import com.governance.core.model.statemachine.TransitionDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, validated lifecycle specification. Built once by {@link StateMachineSpecLoader}
 * and shared by every consumer; all queries are pure lookups.
 */
public final class StateMachineSpec {

    private static final Logger log = LoggerFactory.getLogger(StateMachineSpec.class);

    private final String version;
    private final Map<String, StateDefinition> states;
    private final Map<TransitionKey, TransitionDefinition> transitions;
    private final ExternalStatusMapping mapping;

    StateMachineSpec(String version,
                     Map<String, StateDefinition> states,
                     Map<TransitionKey, TransitionDefinition> transitions,
                     ExternalStatusMapping mapping) {
        this.version = version;
        this.states = Map.copyOf(states);
        this.transitions = Map.copyOf(transitions);
        this.mapping = mapping;
    }

    public String version() {
        return version;
    }

    public Collection<StateDefinition> states() {
        return states.values();
    }

    public Collection<TransitionDefinition> transitions() {
        return transitions.values();
    }

    public Optional<StateDefinition> findState(String name) {
        return Optional.ofNullable(name).map(states::get);
    }

    /**
     * @throws NotFoundException if no state has this name
     */
    public StateDefinition getState(String name) {
        return findState(name).orElseThrow(() -> new NotFoundException("State", name));
    }

    public boolean isTerminalState(String name) {
        return findState(name).map(StateDefinition::terminal).orElse(false);
    }

    /**
     * Structural check only: {@code to} must be a declared successor of a non-terminal {@code from}.
     */
    public boolean isTransitionAllowed(String from, String to) {
        StateDefinition source = states.get(from);
        if (source == null || source.terminal()) {
            return false;
        }
        return source.hasSuccessor(to);
    }

    /**
     * @return the transition for the ordered pair; empty means unspecified and must be denied
     */
    public Optional<TransitionDefinition> getTransition(String from, String to) {
        return Optional.ofNullable(transitions.get(new TransitionKey(from, to)));
    }

    /**
     * A required precondition is met only when the evidence maps its tag to true.
     * Evidence tags this system does not recognize are accepted and logged.
     */
    public PreconditionResult checkPreconditions(TransitionDefinition transition, Evidence evidence) {
        List<String> unrecognized = evidence.unrecognizedTags();
        if (!unrecognized.isEmpty()) {
            log.warn("Unrecognized evidence tags for transition {}: {}", transition.name(), unrecognized);
        }

        List<String> missing = new ArrayList<>();
        for (Precondition precondition : transition.requiredPreconditions()) {
            if (!evidence.isPresent(precondition.tag())) {
                missing.add(precondition.tag());
            }
        }
        return missing.isEmpty() ? PreconditionResult.satisfied() : PreconditionResult.unmet(missing);
    }

    /**
     * @throws NotFoundException for an unknown state
     */
    public List<StateDefinition> getValidNextStates(String name) {
        StateDefinition state = getState(name);
        if (state.terminal()) {
            return List.of();
        }
        return state.successors().stream().map(states::get).toList();
    }

    /**
     * Translate an external tracker signal. A mapping that would land on a terminal state
     * is honoured only for signals listed as done signals for that source.
     */
    public Optional<StateDefinition> mapExternalStatusToState(String externalStatus, ExternalSource source) {
        if (externalStatus == null) {
            return Optional.empty();
        }
        Optional<StateDefinition> mapped = mapping.lookup(source, externalStatus.trim()).map(states::get);
        if (mapped.isPresent() && mapped.get().terminal()
                && !mapping.isDoneSignal(source, externalStatus.trim())) {
            log.info("Ignoring {} signal '{}': maps to terminal state {} without a done signal",
                source, externalStatus, mapped.get().name());
            return Optional.empty();
        }
        return mapped;
    }

    public List<String> getExternalLabelsForState(String name) {
        getState(name);
        ExternalStatusMapping.StateLabels labels = mapping.outboundLabels().get(name);
        return labels == null ? List.of() : labels.all();
    }

    public ExternalStatusMapping.CheckRequirements getRequiredChecks(String name) {
        getState(name);
        return mapping.checks().getOrDefault(name,
            new ExternalStatusMapping.CheckRequirements(List.of(), List.of()));
    }

    record TransitionKey(String from, String to) {
    }
}
