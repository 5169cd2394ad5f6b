package com.governance.core.model.policy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.time.Instant;

/**
 * Result of evaluating a governed action. Denials are values, not exceptions.
 *
 * @param nextAllowedAt earliest time a temporal denial may clear; null otherwise
 */
public record PolicyDecision(
    Decision decision,
    DenialReason reasonCode,
    String reason,
    Instant nextAllowedAt,
    boolean requiresApproval,
    String idempotencyKey,
    String idempotencyKeyHash,
    String policyName,
    JsonNode enforcementData
) {
    public PolicyDecision {
        if (enforcementData == null) {
            enforcementData = JsonNodeFactory.instance.objectNode();
        }
    }

    public boolean allow() {
        return decision == Decision.ALLOWED;
    }

    public static PolicyDecision allowed(String reason, String key, String keyHash,
                                         String policyName, JsonNode enforcementData) {
        return new PolicyDecision(Decision.ALLOWED, DenialReason.ALL_CHECKS_PASSED, reason,
            null, false, key, keyHash, policyName, enforcementData);
    }

    public static PolicyDecision denied(DenialReason reasonCode, String reason, Instant nextAllowedAt,
                                        String key, String keyHash, String policyName,
                                        JsonNode enforcementData) {
        return new PolicyDecision(Decision.DENIED, reasonCode, reason, nextAllowedAt,
            reasonCode == DenialReason.APPROVAL_REQUIRED, key, keyHash, policyName, enforcementData);
    }
}
