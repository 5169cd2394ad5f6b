package com.governance.core.exception;

/**
 * Thrown when the backing store cannot be read or written.
 * Callers surface this as a retryable infrastructure error, never as an allow.
 */
public class PersistenceException extends GovernanceException {

    public static final String ERROR_CODE = "PERSISTENCE_UNAVAILABLE";

    public PersistenceException(String operation, Throwable cause) {
        super(ERROR_CODE, String.format("Persistence operation failed: %s", operation), cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
