package com.governance.core.model.statemachine;

import java.util.Map;

/**
 * Declared effect of taking a transition. Effects are descriptive; executing them is
 * the job of the step actions that perform the transition.
 */
public record SideEffect(
    String tag,
    SideEffectKind kind,
    Map<String, String> parameters
) {
    public SideEffect {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }
}
