package com.governance.engine.statemachine;

import com.governance.core.model.statemachine.TransitionDefinition;

import java.util.List;

/**
 * Combined structural and evidence check for one requested transition.
 */
public record TransitionVerdict(
    boolean allowed,
    Code code,
    String message,
    TransitionDefinition transition,
    List<String> missingPreconditions
) {
    public enum Code {
        TRANSITION_ALLOWED,
        UNKNOWN_STATE,
        TERMINAL_STATE,
        NOT_A_SUCCESSOR,
        TRANSITION_UNSPECIFIED,
        PRECONDITIONS_UNMET,
        AUTO_TRANSITION_NOT_PERMITTED
    }

    public TransitionVerdict {
        missingPreconditions = missingPreconditions == null ? List.of() : List.copyOf(missingPreconditions);
    }

    static TransitionVerdict allow(TransitionDefinition transition) {
        return new TransitionVerdict(true, Code.TRANSITION_ALLOWED,
            "Transition " + transition.name() + " allowed", transition, List.of());
    }

    static TransitionVerdict reject(Code code, String message, TransitionDefinition transition, List<String> missing) {
        return new TransitionVerdict(false, code, message, transition, missing);
    }
}
