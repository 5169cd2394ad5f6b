package com.governance.core.model.run;

/**
 * Lifecycle of a playbook run.
 */
public enum RunStatus {
    /**
     * Persisted with all steps pending, not yet driven.
     * Transitions: -> RUNNING, CANCELLED
     */
    PENDING,

    /**
     * Steps are being executed.
     * Transitions: -> PAUSED, COMPLETED, FAILED, CANCELLED
     */
    RUNNING,

    /**
     * Halted by an operator or by an approval gate. Only a resume leaves this state.
     * Transitions: -> RUNNING
     */
    PAUSED,

    /**
     * Every step reached a terminal status without stopping the run. Terminal state.
     */
    COMPLETED,

    /**
     * A step failed without continueOnError, or the run timed out. Terminal state.
     */
    FAILED,

    /**
     * Stopped on request. Terminal state; never resumable.
     */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(RunStatus target) {
        return switch (this) {
            case PENDING -> target == RUNNING || target == CANCELLED;
            case RUNNING -> target == PAUSED || target == COMPLETED || target == FAILED || target == CANCELLED;
            case PAUSED -> target == RUNNING;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
