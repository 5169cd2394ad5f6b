package com.governance.core.model.policy;

/**
 * Stable reason codes carried by policy decisions.
 */
public enum DenialReason {
    ALL_CHECKS_PASSED,
    NO_POLICY_DEFINED,
    INVALID_POLICY_CONFIGURATION,
    ENVIRONMENT_NOT_PERMITTED,
    APPROVAL_REQUIRED,
    RATE_LIMIT_EXCEEDED,
    COOLDOWN_ACTIVE;

    public boolean isDenial() {
        return this != ALL_CHECKS_PASSED;
    }

    /**
     * Whether the same request could be allowed later without changing anything but time.
     */
    public boolean isTemporal() {
        return this == RATE_LIMIT_EXCEEDED || this == COOLDOWN_ACTIVE;
    }
}
