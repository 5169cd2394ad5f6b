package com.governance.core.model.statemachine;

import java.util.List;

/**
 * A directed edge between two states with the evidence it demands.
 * At most one definition exists per ordered (from, to) pair.
 */
public record TransitionDefinition(
    String name,
    String from,
    String to,
    TransitionKind kind,
    String description,
    List<Precondition> preconditions,
    List<SideEffect> sideEffects,
    boolean evidenceRequired,
    List<String> evidenceTypes,
    boolean autoTransition,
    List<String> autoTransitionOn
) {
    public TransitionDefinition {
        preconditions = preconditions == null ? List.of() : List.copyOf(preconditions);
        sideEffects = sideEffects == null ? List.of() : List.copyOf(sideEffects);
        evidenceTypes = evidenceTypes == null ? List.of() : List.copyOf(evidenceTypes);
        autoTransitionOn = autoTransitionOn == null ? List.of() : List.copyOf(autoTransitionOn);
    }

    public List<Precondition> requiredPreconditions() {
        return preconditions.stream().filter(Precondition::required).toList();
    }

    public boolean isTriggeredBy(String evidenceTag) {
        return autoTransition && autoTransitionOn.contains(evidenceTag);
    }
}
