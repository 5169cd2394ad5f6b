package com.governance.core.model.run;

/**
 * Marks a step as state-changing: before it runs, the engine checks the lifecycle
 * transition (when one is named) and asks the policy gate for admission.
 *
 * @param targetIdentifier  template resolved against run variables, e.g. {@code ${input.repo}#${input.issue}}
 * @param evidenceVariable  run variable holding the evidence map for the transition
 */
public record GovernedAction(
    String actionType,
    String targetType,
    String targetIdentifier,
    String transitionFrom,
    String transitionTo,
    String evidenceVariable
) {
    public static final String DEFAULT_EVIDENCE_VARIABLE = "evidence";

    public GovernedAction {
        if (actionType == null || actionType.isBlank()) {
            throw new IllegalArgumentException("Governed action requires an actionType");
        }
        if ((transitionFrom == null) != (transitionTo == null)) {
            throw new IllegalArgumentException("Transition requires both from and to states");
        }
        if (evidenceVariable == null || evidenceVariable.isBlank()) {
            evidenceVariable = DEFAULT_EVIDENCE_VARIABLE;
        }
    }

    public boolean hasTransition() {
        return transitionFrom != null;
    }
}
