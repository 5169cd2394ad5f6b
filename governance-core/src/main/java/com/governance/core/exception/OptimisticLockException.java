package com.governance.core.exception;

/**
 * Thrown when a conditional update finds the record changed underneath it.
 */
public class OptimisticLockException extends GovernanceException {

    public static final String ERROR_CODE = "OPTIMISTIC_LOCK_CONFLICT";

    public OptimisticLockException(String entityType, String entityId, long expectedVersion) {
        super(ERROR_CODE, String.format(
            "Optimistic lock conflict on %s[%s]: expected version %d",
            entityType, entityId, expectedVersion
        ));
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
