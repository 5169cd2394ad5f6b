package com.governance.core.exception;

/**
 * Base exception for all control plane errors.
 */
public class GovernanceException extends RuntimeException {

    private final String errorCode;

    public GovernanceException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public GovernanceException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Whether the caller may retry the same request later and expect a different outcome.
     */
    public boolean isRetryable() {
        return false;
    }
}
