package com.governance.core.model.statemachine;

import java.util.List;

/**
 * Outcome of checking a transition's required preconditions against supplied evidence.
 */
public record PreconditionResult(
    boolean met,
    List<String> missing
) {
    public PreconditionResult {
        missing = List.copyOf(missing);
    }

    public static PreconditionResult satisfied() {
        return new PreconditionResult(true, List.of());
    }

    public static PreconditionResult unmet(List<String> missing) {
        return new PreconditionResult(false, missing);
    }
}
