package com.governance.core.model.policy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.UUID;

/**
 * A request to perform a governed action.
 *
 * @param requestId         caller-supplied id, unique per attempt; replays of the same id are duplicates
 * @param deploymentEnv     target environment, may be null
 * @param actionContext     fields the idempotency key template draws from
 * @param hasApproval       whether a human approval accompanies the request
 * @param approvalFingerprint identity of the approving actor, recorded for audit
 */
public record PolicyEvaluationContext(
    String requestId,
    String actionType,
    String targetType,
    String targetIdentifier,
    String deploymentEnv,
    String actor,
    JsonNode actionContext,
    boolean hasApproval,
    String approvalFingerprint
) {
    public PolicyEvaluationContext {
        if (actionType == null || actionType.isBlank()) {
            throw new IllegalArgumentException("actionType is required");
        }
        if (targetIdentifier == null || targetIdentifier.isBlank()) {
            throw new IllegalArgumentException("targetIdentifier is required");
        }
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        if (actionContext == null || actionContext.isNull()) {
            actionContext = JsonNodeFactory.instance.objectNode();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String requestId;
        private String actionType;
        private String targetType;
        private String targetIdentifier;
        private String deploymentEnv;
        private String actor;
        private JsonNode actionContext;
        private boolean hasApproval;
        private String approvalFingerprint;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder actionType(String actionType) {
            this.actionType = actionType;
            return this;
        }

        public Builder targetType(String targetType) {
            this.targetType = targetType;
            return this;
        }

        public Builder targetIdentifier(String targetIdentifier) {
            this.targetIdentifier = targetIdentifier;
            return this;
        }

        public Builder deploymentEnv(String deploymentEnv) {
            this.deploymentEnv = deploymentEnv;
            return this;
        }

        public Builder actor(String actor) {
            this.actor = actor;
            return this;
        }

        public Builder actionContext(JsonNode actionContext) {
            this.actionContext = actionContext;
            return this;
        }

        public Builder approval(String approvalFingerprint) {
            this.hasApproval = approvalFingerprint != null;
            this.approvalFingerprint = approvalFingerprint;
            return this;
        }

        public PolicyEvaluationContext build() {
            return new PolicyEvaluationContext(
                requestId, actionType, targetType, targetIdentifier,
                deploymentEnv, actor, actionContext, hasApproval, approvalFingerprint
            );
        }
    }
}
