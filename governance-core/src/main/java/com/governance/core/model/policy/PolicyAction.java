package com.governance.core.model.policy;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Governance rules for one action type.
 *
 * Invariants:
 * - allowedEnvironments is non-empty
 * - a rate window is either complete or absent (enforced by {@link RateWindow#fromOptional})
 * - cooldownSeconds, when present, is positive
 */
public record PolicyAction(
    String actionType,
    String description,
    Set<String> allowedEnvironments,
    RateWindow rateLimit,
    Long cooldownSeconds,
    boolean requiresApproval,
    List<String> idempotencyKeyTemplate
) {
    public PolicyAction {
        if (actionType == null || actionType.isBlank()) {
            throw new IllegalArgumentException("actionType is required");
        }
        if (allowedEnvironments == null || allowedEnvironments.isEmpty()) {
            throw new IllegalArgumentException("allowedEnvironments must not be empty for " + actionType);
        }
        if (cooldownSeconds != null && cooldownSeconds < 1) {
            throw new IllegalArgumentException("cooldownSeconds must be positive for " + actionType);
        }
        allowedEnvironments = Set.copyOf(allowedEnvironments);
        idempotencyKeyTemplate = idempotencyKeyTemplate == null ? List.of() : List.copyOf(idempotencyKeyTemplate);
    }

    public boolean hasRateLimit() {
        return rateLimit != null;
    }

    public boolean hasCooldown() {
        return cooldownSeconds != null;
    }

    public Duration cooldown() {
        return cooldownSeconds == null ? Duration.ZERO : Duration.ofSeconds(cooldownSeconds);
    }

    public boolean allowsEnvironment(String environment) {
        return allowedEnvironments.contains(environment);
    }
}
