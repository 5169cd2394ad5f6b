package com.governance.core.exception;

/**
 * Thrown when a run or step is asked to move to a status its current status does not allow.
 */
public class InvalidStateTransitionException extends GovernanceException {

    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";

    public InvalidStateTransitionException(String entityType, String entityId,
                                           Enum<?> currentState, Enum<?> targetState) {
        super(ERROR_CODE, String.format(
            "Cannot transition %s %s from %s to %s",
            entityType, entityId, currentState, targetState
        ));
    }

    public InvalidStateTransitionException(String message) {
        super(ERROR_CODE, message);
    }
}
