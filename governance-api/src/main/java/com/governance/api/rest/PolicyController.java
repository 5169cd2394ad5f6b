package com.governance.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.governance.core.model.policy.ExecutionRecord;
import com.governance.core.model.policy.PolicyDecision;
import com.governance.core.model.policy.PolicyEvaluationContext;
import com.governance.engine.policy.GateResult;
import com.governance.engine.policy.PolicyGate;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * REST API for policy decisions.
 */
@RestController
@RequestMapping("/api/v1/policy")
public class PolicyController {

    private final PolicyGate policyGate;

    public PolicyController(PolicyGate policyGate) {
        this.policyGate = policyGate;
    }

    /**
     * Dry run: evaluates without writing to the audit trail.
     */
    @PostMapping("/evaluate")
    public ResponseEntity<DecisionResponse> evaluate(@RequestBody PolicyRequest request) {
        PolicyDecision decision = policyGate.evaluator().evaluate(request.toContext());
        return ResponseEntity.ok(DecisionResponse.from(decision));
    }

    /**
     * Evaluates and records the attempt. The caller may act only when {@code mayProceed} is true.
     */
    @PostMapping("/execute")
    public ResponseEntity<ExecuteResponse> execute(@RequestBody PolicyRequest request) {
        GateResult result = policyGate.evaluateAndRecord(request.toContext());
        return ResponseEntity.ok(ExecuteResponse.from(result));
    }

    @GetMapping("/history")
    public ResponseEntity<List<RecordResponse>> history(
            @RequestParam String actionType,
            @RequestParam String targetIdentifier,
            @RequestParam(defaultValue = "50") int limit) {
        List<RecordResponse> records = policyGate.history(actionType, targetIdentifier, limit).stream()
            .map(RecordResponse::from)
            .toList();
        return ResponseEntity.ok(records);
    }

    // ========== DTOs ==========

    public record PolicyRequest(
        String requestId,
        String actionType,
        String targetType,
        String targetIdentifier,
        String deploymentEnv,
        String actor,
        JsonNode actionContext,
        Boolean hasApproval,
        String approvalFingerprint
    ) {
        PolicyEvaluationContext toContext() {
            boolean approved = Boolean.TRUE.equals(hasApproval) || approvalFingerprint != null;
            return new PolicyEvaluationContext(requestId, actionType, targetType, targetIdentifier,
                deploymentEnv, actor, actionContext, approved, approvalFingerprint);
        }
    }

    public record DecisionResponse(
        String decision,
        boolean allow,
        String reasonCode,
        String reason,
        Instant nextAllowedAt,
        boolean requiresApproval,
        String idempotencyKey,
        String idempotencyKeyHash,
        String policyName,
        JsonNode enforcementData
    ) {
        public static DecisionResponse from(PolicyDecision decision) {
            return new DecisionResponse(
                decision.decision().name().toLowerCase(Locale.ROOT),
                decision.allow(),
                decision.reasonCode().name(),
                decision.reason(),
                decision.nextAllowedAt(),
                decision.requiresApproval(),
                decision.idempotencyKey(),
                decision.idempotencyKeyHash(),
                decision.policyName(),
                decision.enforcementData()
            );
        }
    }

    public record ExecuteResponse(
        String outcome,
        boolean mayProceed,
        UUID recordId,
        DecisionResponse decision
    ) {
        public static ExecuteResponse from(GateResult result) {
            return new ExecuteResponse(
                result.outcome().name(),
                result.mayProceed(),
                result.record() != null ? result.record().recordId() : null,
                DecisionResponse.from(result.decision())
            );
        }
    }

    public record RecordResponse(
        UUID recordId,
        String requestId,
        String actionType,
        String targetIdentifier,
        String decision,
        String reasonCode,
        String reason,
        String idempotencyKeyHash,
        String deploymentEnv,
        String actor,
        String approvalFingerprint,
        Instant nextAllowedAt,
        Instant createdAt
    ) {
        public static RecordResponse from(ExecutionRecord record) {
            return new RecordResponse(
                record.recordId(),
                record.requestId(),
                record.actionType(),
                record.targetIdentifier(),
                record.decision().name(),
                record.reasonCode().name(),
                record.reason(),
                record.idempotencyKeyHash(),
                record.deploymentEnv(),
                record.actor(),
                record.approvalFingerprint(),
                record.nextAllowedAt(),
                record.createdAt()
            );
        }
    }
}
