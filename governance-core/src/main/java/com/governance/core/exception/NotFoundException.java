package com.governance.core.exception;

/**
 * Thrown when a state, run, policy or playbook is not found.
 */
public class NotFoundException extends GovernanceException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
