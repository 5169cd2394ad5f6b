package com.governance.engine.policy;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.governance.core.exception.PersistenceException;
import com.governance.core.model.policy.DenialReason;
import com.governance.core.model.policy.PolicyAction;
import com.governance.core.model.policy.PolicyDecision;
import com.governance.core.model.policy.PolicyEvaluationContext;
import com.governance.core.model.policy.RateWindow;
import com.governance.engine.metrics.GovernanceMetrics;
import com.governance.engine.persistence.InMemoryExecutionRecordRepository;
import com.governance.engine.test.TimeController;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PolicyEvaluatorTest {

    private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");

    private TimeController time;
    private InMemoryExecutionRecordRepository records;
    private GovernanceMetrics metrics;
    private PolicyEvaluator evaluator;
    private PolicyGate gate;

    @BeforeEach
    void setUp() {
        time = TimeController.frozenAt(T0);
        records = new InMemoryExecutionRecordRepository();
        metrics = new GovernanceMetrics(new SimpleMeterRegistry());
        evaluator = new PolicyEvaluator(new PolicyCatalogLoader().loadDefault(), records, time, metrics);
        gate = new PolicyGate(evaluator, records, time, metrics);
    }

    @Test
    @DisplayName("Unknown action type is denied with the hash of an empty key")
    void evaluate_unknownAction_shouldDenyWithNoPolicy() {
        PolicyDecision decision = evaluator.evaluate(publish("staging").actionType("label_sync").build());

        assertThat(decision.allow()).isFalse();
        assertThat(decision.reasonCode()).isEqualTo(DenialReason.NO_POLICY_DEFINED);
        assertThat(decision.idempotencyKey()).isEmpty();
        assertThat(decision.idempotencyKeyHash()).isEqualTo(IdempotencyKeys.hash(""));
        assertThat(decision.policyName()).isNull();
    }

    @Test
    void evaluate_environmentNotListed_shouldDeny() {
        PolicyDecision decision = evaluator.evaluate(publish("production").build());

        assertThat(decision.reasonCode()).isEqualTo(DenialReason.ENVIRONMENT_NOT_PERMITTED);
        assertThat(decision.enforcementData().get("allowedEnvironments").get(0).asText()).isEqualTo("staging");
    }

    @Test
    void evaluate_environmentIsNormalized() {
        PolicyDecision decision = evaluator.evaluate(publish("  Staging ").build());

        assertThat(decision.allow()).isTrue();
        assertThat(decision.enforcementData().get("environment").asText()).isEqualTo("staging");
    }

    @Test
    @DisplayName("Absent environment passes only when the policy allows a non-production environment")
    void evaluate_absentEnvironment() {
        PolicyAction prodOnly = new PolicyAction("release_tag", "Tag a release", Set.of("production"),
            null, null, false, List.of("repo"));
        PolicyAction withStaging = new PolicyAction("label_sync", "Sync labels", Set.of("staging", "production"),
            null, null, false, List.of("repo"));
        PolicyEvaluator custom = new PolicyEvaluator(
            new PolicyCatalog("test", "hash", Map.of("release_tag", prodOnly, "label_sync", withStaging)),
            records, time, metrics);

        PolicyDecision denied = custom.evaluate(context("release_tag", null).build());
        PolicyDecision allowed = custom.evaluate(context("label_sync", null).build());

        assertThat(denied.reasonCode()).isEqualTo(DenialReason.ENVIRONMENT_NOT_PERMITTED);
        assertThat(denied.reason()).contains("(unspecified)");
        assertThat(allowed.allow()).isTrue();
    }

    @Test
    void evaluate_approvalRequiredWithoutApproval_shouldDeny() {
        PolicyDecision decision = evaluator.evaluate(context("pr_merge", "production").build());

        assertThat(decision.reasonCode()).isEqualTo(DenialReason.APPROVAL_REQUIRED);
        assertThat(decision.requiresApproval()).isTrue();
        assertThat(decision.nextAllowedAt()).isNull();
    }

    @Test
    void evaluate_approvalPresent_shouldRecordFingerprint() {
        PolicyDecision decision = evaluator.evaluate(context("pr_merge", "production").approval("alice").build());

        assertThat(decision.allow()).isTrue();
        assertThat(decision.enforcementData().get("approvalFingerprint").asText()).isEqualTo("alice");
    }

    @Test
    @DisplayName("Second publish inside the window is denied until the first admission ages out")
    void evaluate_rateWindowExhausted_shouldDenyUntilWindowPasses() {
        assertThat(gate.evaluateAndRecord(publish("staging").build()).mayProceed()).isTrue();

        time.advanceMinutes(10);
        PolicyDecision denied = evaluator.evaluate(publish("staging").build());

        assertThat(denied.reasonCode()).isEqualTo(DenialReason.RATE_LIMIT_EXCEEDED);
        assertThat(denied.nextAllowedAt()).isEqualTo(T0.plus(Duration.ofHours(1)));
        assertThat(denied.enforcementData().get("executionsInWindow").asLong()).isEqualTo(1);

        time.setTime(T0.plus(Duration.ofHours(1)).plusSeconds(1));
        assertThat(evaluator.evaluate(publish("staging").build()).allow()).isTrue();
    }

    @Test
    void evaluate_rateWindowIsPerTarget() {
        gate.evaluateAndRecord(publish("staging").build());

        PolicyDecision other = evaluator.evaluate(publish("staging").targetIdentifier("acme/web#I002").build());

        assertThat(other.allow()).isTrue();
    }

    @Test
    void evaluate_cooldownActive_shouldReportWhenItClears() {
        gate.evaluateAndRecord(transition().build());

        time.advanceSeconds(10);
        PolicyDecision denied = evaluator.evaluate(transition().build());
        assertThat(denied.reasonCode()).isEqualTo(DenialReason.COOLDOWN_ACTIVE);
        assertThat(denied.nextAllowedAt()).isEqualTo(T0.plusSeconds(30));

        time.setTime(T0.plusSeconds(30));
        assertThat(evaluator.evaluate(transition().build()).allow()).isTrue();
    }

    @Test
    void evaluate_deniedAttemptsDoNotConsumeTheWindow() {
        gate.evaluateAndRecord(publish("production").build());

        assertThat(evaluator.evaluate(publish("staging").build()).allow()).isTrue();
    }

    @Test
    void evaluate_shouldBuildKeyFromTemplate() {
        PolicyDecision decision = evaluator.evaluate(publish("staging").build());

        assertThat(decision.idempotencyKey()).isEqualTo("canonicalId=I001::owner=acme::repo=web");
        assertThat(decision.idempotencyKeyHash()).isEqualTo(IdempotencyKeys.hash(decision.idempotencyKey()));
        assertThat(decision.policyName()).isEqualTo("issue_publish");
    }

    @Test
    void evaluate_auditTrailUnavailable_shouldFailClosed() {
        InMemoryExecutionRecordRepository broken = new InMemoryExecutionRecordRepository() {
            @Override
            public synchronized long countAllowedSince(String actionType, String targetIdentifier, Instant since) {
                throw new IllegalStateException("connection refused");
            }
        };
        PolicyEvaluator failing = new PolicyEvaluator(new PolicyCatalogLoader().loadDefault(), broken, time, metrics);

        assertThatThrownBy(() -> failing.evaluate(publish("staging").build()))
            .isInstanceOf(PersistenceException.class)
            .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void evaluate_shouldCountDecisions() {
        evaluator.evaluate(publish("production").build());

        assertThat(metrics.registry().get(GovernanceMetrics.POLICY_DECISIONS)
            .tag("reason", "ENVIRONMENT_NOT_PERMITTED").counter().count()).isEqualTo(1.0);
    }

    private static PolicyEvaluationContext.Builder publish(String env) {
        ObjectNode fields = JsonNodeFactory.instance.objectNode()
            .put("owner", "acme")
            .put("repo", "web")
            .put("canonicalId", "I001");
        return PolicyEvaluationContext.builder()
            .actionType("issue_publish")
            .targetType("issue")
            .targetIdentifier("acme/web#I001")
            .deploymentEnv(env)
            .actor("bot")
            .actionContext(fields);
    }

    private static PolicyEvaluationContext.Builder transition() {
        ObjectNode fields = JsonNodeFactory.instance.objectNode()
            .put("owner", "acme")
            .put("repo", "web")
            .put("issueNumber", 7)
            .put("toState", "IN_PROGRESS");
        return context("issue_state_transition", "staging")
            .targetIdentifier("acme/web#7")
            .actionContext(fields);
    }

    private static PolicyEvaluationContext.Builder context(String actionType, String env) {
        return PolicyEvaluationContext.builder()
            .actionType(actionType)
            .targetType("pull_request")
            .targetIdentifier("acme/web#42")
            .deploymentEnv(env)
            .actor("bot")
            .actionContext(JsonNodeFactory.instance.objectNode().put("owner", "acme").put("repo", "web").put("prNumber", 42));
    }
}
