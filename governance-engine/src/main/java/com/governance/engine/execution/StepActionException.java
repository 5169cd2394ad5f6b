package com.governance.engine.execution;

/**
 * Thrown by step action handlers on failure.
 */
public class StepActionException extends Exception {

    private final String errorCode;
    private final boolean retryable;

    public StepActionException(String errorCode, String message) {
        this(errorCode, message, true);
    }

    public StepActionException(String errorCode, String message, boolean retryable) {
        super(message);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public StepActionException(String errorCode, String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * A failure that retrying cannot fix, e.g. a rejected request.
     */
    public static StepActionException permanent(String errorCode, String message) {
        return new StepActionException(errorCode, message, false);
    }

    public static StepActionException transientFailure(String errorCode, String message) {
        return new StepActionException(errorCode, message, true);
    }
}
