package com.governance.core.exception;

/**
 * Thrown when a state machine, policy or playbook document cannot be loaded.
 * Raised during startup; the process must not serve requests with a partial specification.
 */
public class SpecificationLoadException extends GovernanceException {

    public static final String ERROR_CODE = "SPECIFICATION_LOAD_FAILED";

    public SpecificationLoadException(String source, String problem) {
        super(ERROR_CODE, String.format("Invalid specification %s: %s", source, problem));
    }

    public SpecificationLoadException(String source, String problem, Throwable cause) {
        super(ERROR_CODE, String.format("Invalid specification %s: %s", source, problem), cause);
    }
}
