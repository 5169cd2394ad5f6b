package com.governance.engine.metrics;

import com.governance.core.model.policy.PolicyDecision;
import com.governance.core.model.run.RunStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Operational metrics for policy decisions and playbook runs.
 *
 * Metrics exposed:
 * - policy decisions by action, decision and reason
 * - duplicate admissions rejected by the audit trail
 * - runs by lifecycle event and live runs by status
 * - step duration, retries and failures
 */
public class GovernanceMetrics {

    public static final String POLICY_DECISIONS = "governance.policy.decisions";
    public static final String POLICY_DUPLICATES = "governance.policy.duplicates";
    public static final String RUN_EVENTS = "governance.runs";
    public static final String RUN_ACTIVE = "governance.runs.active";
    public static final String RUN_DURATION = "governance.run.duration";
    public static final String STEP_DURATION = "governance.step.duration";
    public static final String STEP_RETRIES = "governance.step.retries";
    public static final String STEP_FAILURES = "governance.step.failures";
    public static final String SPEC_LOADS = "governance.spec.loads";

    private final MeterRegistry registry;
    private final Map<RunStatus, AtomicInteger> activeRuns = new EnumMap<>(RunStatus.class);

    public GovernanceMetrics(MeterRegistry registry) {
        this.registry = registry;
        for (RunStatus status : new RunStatus[]{RunStatus.PENDING, RunStatus.RUNNING, RunStatus.PAUSED}) {
            AtomicInteger gauge = new AtomicInteger(0);
            activeRuns.put(status, gauge);
            Gauge.builder(RUN_ACTIVE, gauge, AtomicInteger::get)
                .tag("status", status.name())
                .description("Runs currently in " + status + " status")
                .register(registry);
        }
    }

    public MeterRegistry registry() {
        return registry;
    }

    // ========== Policy Metrics ==========

    public void policyDecision(String actionType, PolicyDecision decision) {
        Counter.builder(POLICY_DECISIONS)
            .tag("action", actionType)
            .tag("decision", decision.decision().name())
            .tag("reason", decision.reasonCode().name())
            .description("Governed action decisions")
            .register(registry)
            .increment();
    }

    public void duplicateAdmission(String actionType) {
        Counter.builder(POLICY_DUPLICATES)
            .tag("action", actionType)
            .description("Governed actions rejected as already processed or pending")
            .register(registry)
            .increment();
    }

    public void specificationLoaded(String kind) {
        Counter.builder(SPEC_LOADS)
            .tag("kind", kind)
            .description("Specification documents loaded")
            .register(registry)
            .increment();
    }

    // ========== Run Metrics ==========

    public void runTransition(String playbookId, RunStatus from, RunStatus to) {
        Counter.builder(RUN_EVENTS)
            .tag("playbook", playbookId)
            .tag("status", to.name())
            .description("Run status changes")
            .register(registry)
            .increment();

        adjust(from, -1);
        adjust(to, 1);
    }

    public void runCreated(String playbookId) {
        Counter.builder(RUN_EVENTS)
            .tag("playbook", playbookId)
            .tag("status", RunStatus.PENDING.name())
            .description("Run status changes")
            .register(registry)
            .increment();
        adjust(RunStatus.PENDING, 1);
    }

    public void runFinished(String playbookId, RunStatus outcome, Duration duration) {
        Timer.builder(RUN_DURATION)
            .tag("playbook", playbookId)
            .tag("outcome", outcome.name())
            .description("Run duration from start to terminal status")
            .register(registry)
            .record(duration);
    }

    // ========== Step Metrics ==========

    public void stepCompleted(String playbookId, String stepName, String outcome, Duration duration) {
        Timer.builder(STEP_DURATION)
            .tag("playbook", playbookId)
            .tag("step", stepName)
            .tag("outcome", outcome)
            .description("Step execution duration across attempts")
            .register(registry)
            .record(duration);
    }

    public void stepRetried(String playbookId, String stepName, int attemptNumber) {
        Counter.builder(STEP_RETRIES)
            .tag("playbook", playbookId)
            .tag("step", stepName)
            .tag("attempt", String.valueOf(attemptNumber))
            .description("Step retry attempts")
            .register(registry)
            .increment();
    }

    public void stepFailed(String playbookId, String stepName, String errorCode) {
        Counter.builder(STEP_FAILURES)
            .tag("playbook", playbookId)
            .tag("step", stepName)
            .tag("error_code", sanitize(errorCode))
            .description("Steps that ended failed")
            .register(registry)
            .increment();
    }

    private void adjust(RunStatus status, int delta) {
        AtomicInteger gauge = activeRuns.get(status);
        if (gauge != null) {
            gauge.updateAndGet(value -> Math.max(0, value + delta));
        }
    }

    private String sanitize(String code) {
        if (code == null || code.isBlank()) {
            return "unspecified";
        }
        String sanitized = code.toLowerCase()
            .replaceAll("[^a-z0-9_]", "_")
            .replaceAll("_+", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
