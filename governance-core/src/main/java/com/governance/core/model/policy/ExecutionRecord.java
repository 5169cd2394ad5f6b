package com.governance.core.model.policy;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only audit row written for every governed action attempt.
 *
 * Allowed rows carry an admission sequence: the number of earlier allowed rows for the
 * same action type and target. The store keeps that pair unique, so two concurrent
 * callers that read the same history cannot both be admitted.
 */
public record ExecutionRecord(
    UUID recordId,
    String requestId,
    String actionType,
    String actionFingerprint,
    String targetType,
    String targetIdentifier,
    Decision decision,
    DenialReason reasonCode,
    String reason,
    String idempotencyKey,
    String idempotencyKeyHash,
    String policyName,
    JsonNode enforcementData,
    String deploymentEnv,
    String actor,
    String approvalFingerprint,
    Long admissionSequence,
    Instant nextAllowedAt,
    Instant createdAt
) {
    public boolean isAllowed() {
        return decision == Decision.ALLOWED;
    }

    public static ExecutionRecord of(PolicyEvaluationContext context, PolicyDecision decision,
                                     String actionFingerprint, Long admissionSequence, Instant createdAt) {
        return new ExecutionRecord(
            UUID.randomUUID(),
            context.requestId(),
            context.actionType(),
            actionFingerprint,
            context.targetType(),
            context.targetIdentifier(),
            decision.decision(),
            decision.reasonCode(),
            decision.reason(),
            decision.idempotencyKey(),
            decision.idempotencyKeyHash(),
            decision.policyName(),
            decision.enforcementData(),
            context.deploymentEnv(),
            context.actor(),
            context.approvalFingerprint(),
            decision.allow() ? admissionSequence : null,
            decision.nextAllowedAt(),
            createdAt
        );
    }
}
