package com.governance.core.model.run;

/**
 * Lifecycle of a single step within a run.
 */
public enum StepStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    SKIPPED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED;
    }

    /**
     * RUNNING -> RUNNING records another attempt; RUNNING -> PENDING parks a step
     * behind an approval gate; RUNNING -> SKIPPED drops a duplicate admission.
     */
    public boolean canTransitionTo(StepStatus target) {
        return switch (this) {
            case PENDING -> target == RUNNING || target == SKIPPED;
            case RUNNING -> target == RUNNING || target == SUCCEEDED || target == FAILED
                || target == SKIPPED || target == PENDING;
            case SUCCEEDED, FAILED, SKIPPED -> false;
        };
    }
}
