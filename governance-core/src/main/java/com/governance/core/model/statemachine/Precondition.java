package com.governance.core.model.statemachine;

/**
 * A named precondition of a transition.
 * Only required preconditions gate the transition.
 */
public record Precondition(
    String tag,
    EvidenceKind kind,
    boolean required
) {
    public static Precondition of(String tag, boolean required) {
        return new Precondition(tag, EvidenceKind.fromTag(tag), required);
    }
}
