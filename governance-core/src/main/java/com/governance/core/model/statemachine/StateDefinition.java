package com.governance.core.model.statemachine;

import java.util.List;

/**
 * A lifecycle state of a tracked work item.
 *
 * Invariants:
 * - a terminal state has no successors
 * - a special-hold state is never terminal
 */
public record StateDefinition(
    String name,
    String description,
    StateCategory category,
    boolean terminal,
    boolean active,
    List<String> entryConditions,
    List<String> exitConditions,
    List<String> predecessors,
    List<String> successors
) {
    public StateDefinition {
        entryConditions = entryConditions == null ? List.of() : List.copyOf(entryConditions);
        exitConditions = exitConditions == null ? List.of() : List.copyOf(exitConditions);
        predecessors = predecessors == null ? List.of() : List.copyOf(predecessors);
        successors = successors == null ? List.of() : List.copyOf(successors);
    }

    public boolean isHold() {
        return category == StateCategory.SPECIAL_HOLD;
    }

    public boolean hasSuccessor(String stateName) {
        return successors.contains(stateName);
    }
}
