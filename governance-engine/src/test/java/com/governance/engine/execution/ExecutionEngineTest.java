package com.governance.engine.execution;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.governance.core.exception.InvalidStateTransitionException;
import com.governance.core.exception.NotFoundException;
import com.governance.core.model.policy.Decision;
import com.governance.core.model.policy.DenialReason;
import com.governance.core.model.policy.ExecutionRecord;
import com.governance.core.model.policy.PolicyAction;
import com.governance.core.model.run.GovernedAction;
import com.governance.core.model.run.PlaybookDefinition;
import com.governance.core.model.run.RetryPolicy;
import com.governance.core.model.run.Run;
import com.governance.core.model.run.RunResult;
import com.governance.core.model.run.RunStatus;
import com.governance.core.model.run.StepDefinition;
import com.governance.core.model.run.StepRun;
import com.governance.core.model.run.StepStatus;
import com.governance.engine.metrics.GovernanceMetrics;
import com.governance.engine.persistence.InMemoryExecutionRecordRepository;
import com.governance.engine.persistence.InMemoryRunRepository;
import com.governance.engine.persistence.InMemoryStepRunRepository;
import com.governance.engine.policy.IdempotencyKeys;
import com.governance.engine.policy.PolicyCatalog;
import com.governance.engine.policy.PolicyCatalogLoader;
import com.governance.engine.policy.PolicyEvaluator;
import com.governance.engine.policy.PolicyGate;
import com.governance.engine.statemachine.StateMachineSpecLoader;
import com.governance.engine.statemachine.TransitionGuard;
import com.governance.engine.test.RecordingSleeper;
import com.governance.engine.test.TimeController;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExecutionEngineTest {

    private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");

    private final ObjectMapper mapper = new ObjectMapper();

    private TimeController time;
    private RecordingSleeper sleeper;
    private GovernanceMetrics metrics;
    private InMemoryRunRepository runs;
    private InMemoryStepRunRepository steps;
    private InMemoryExecutionRecordRepository records;
    private PolicyGate gate;
    private StepActionRegistry actions;
    private ExecutionEngine engine;

    @BeforeEach
    void setUp() {
        time = TimeController.frozenAt(T0);
        sleeper = new RecordingSleeper(time);
        metrics = new GovernanceMetrics(new SimpleMeterRegistry());
        actions = StepActionRegistry.withBuiltins();
        engine = newEngine(new PolicyCatalogLoader().loadDefault(), new InMemoryExecutionRecordRepository(), sleeper);
    }

    private ExecutionEngine newEngine(PolicyCatalog catalog, InMemoryExecutionRecordRepository auditTrail, Sleeper waits) {
        runs = new InMemoryRunRepository();
        steps = new InMemoryStepRunRepository();
        records = auditTrail;
        gate = new PolicyGate(new PolicyEvaluator(catalog, records, time, metrics), records, time, metrics);
        PlaybookRegistry playbooks = new PlaybookLoader(Duration.ofMinutes(5), Duration.ofSeconds(60))
            .load(PlaybookLoader.DEFAULT_LOCATION);
        return new ExecutionEngine(runs, steps, playbooks, actions,
            new TransitionGuard(new StateMachineSpecLoader().loadDefault()),
            gate, time, waits, metrics, mapper);
    }

    @Nested
    class BundledPlaybooks {

        @Test
        @DisplayName("issue-publish prepares, admits and publishes")
        void issuePublish_shouldComplete() {
            RunResult result = engine.start("issue-publish", " Staging ", publishInput(true), "ci");

            assertThat(result.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(result.run().environment()).isEqualTo("staging");
            assertThat(result.steps()).extracting(StepRun::status)
                .containsExactly(StepStatus.SUCCEEDED, StepStatus.SUCCEEDED);
            assertThat(result.output().at("/published/title").asText()).isEqualTo("Hello");
            assertThat(result.steps().get(1).idempotencyKeyHash())
                .isEqualTo(IdempotencyKeys.hash("canonicalId=I001::owner=acme::repo=web"));
            assertThat(result.run().completedAt()).isEqualTo(T0);
            assertThat(gate.history("issue_publish", "acme/web#I001", 10)).hasSize(1);
        }

        @Test
        void issuePublish_conditionFalse_shouldSkipPublish() {
            RunResult result = engine.start("issue-publish", "staging", publishInput(false), "ci");

            assertThat(result.status()).isEqualTo(RunStatus.COMPLETED);
            StepRun publish = result.steps().get(1);
            assertThat(publish.status()).isEqualTo(StepStatus.SKIPPED);
            assertThat(publish.errorCode()).isEqualTo(ExecutionEngine.CONDITION_NOT_MET);
            assertThat(publish.attempts()).isZero();
            assertThat(gate.history("issue_publish", "acme/web#I001", 10)).isEmpty();
        }

        @Test
        @DisplayName("A second publish of the same issue within the hour is rate limited")
        void issuePublish_twiceWithinWindow_shouldFailSecondRun() {
            engine.start("issue-publish", "staging", publishInput(true), "ci");
            time.advanceMinutes(5);

            RunResult second = engine.start("issue-publish", "staging", publishInput(true), "ci");

            assertThat(second.status()).isEqualTo(RunStatus.FAILED);
            assertThat(second.run().lastErrorCode()).isEqualTo(DenialReason.RATE_LIMIT_EXCEEDED.name());
            assertThat(second.steps().get(1).error()).contains("next allowed at " + T0.plus(Duration.ofHours(1)));
            assertThat(sleeper.sleeps()).isEmpty();
        }

        @Test
        void issuePublish_inProduction_shouldFailWithoutRetry() {
            RunResult result = engine.start("issue-publish", "production", publishInput(true), "ci");

            assertThat(result.status()).isEqualTo(RunStatus.FAILED);
            assertThat(result.steps().get(1).errorCode()).isEqualTo(DenialReason.ENVIRONMENT_NOT_PERMITTED.name());
            assertThat(result.steps().get(1).attempts()).isEqualTo(1);
        }

        @Test
        @DisplayName("pr-merge pauses for approval and completes once an operator resumes it")
        void prMerge_shouldPauseForApprovalThenComplete() {
            RunResult paused = engine.start("pr-merge", "production", mergeInput(true), "ci");

            assertThat(paused.status()).isEqualTo(RunStatus.PAUSED);
            assertThat(paused.run().pausedBy()).isEqualTo(ExecutionEngine.POLICY_ACTOR);
            assertThat(paused.run().approvalStepIndex()).isZero();
            assertThat(paused.run().isAwaitingApproval()).isTrue();
            StepRun gated = paused.steps().get(0);
            assertThat(gated.status()).isEqualTo(StepStatus.PENDING);
            assertThat(gated.errorCode()).isEqualTo(DenialReason.APPROVAL_REQUIRED.name());
            assertThat(gated.attempts()).isZero();

            time.advanceMinutes(3);
            Run resumed = engine.resume(paused.run().runId(), "alice");
            assertThat(resumed.approvalGrantedBy()).isEqualTo("alice");
            assertThat(resumed.deadline()).isEqualTo(paused.run().deadline().plus(Duration.ofMinutes(3)));

            RunResult done = engine.advance(resumed.runId());

            assertThat(done.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(done.steps()).extracting(StepRun::status)
                .containsExactly(StepStatus.SUCCEEDED, StepStatus.SUCCEEDED);
            assertThat(done.output().at("/merge/prNumber").isNumber()).isTrue();
            List<ExecutionRecord> history = gate.history("pr_merge", "acme/web#42", 10);
            assertThat(history).extracting(ExecutionRecord::decision)
                .containsExactlyInAnyOrder(Decision.DENIED, Decision.ALLOWED);
            assertThat(history).filteredOn(ExecutionRecord::isAllowed)
                .extracting(ExecutionRecord::approvalFingerprint).containsExactly("alice");
        }

        @Test
        void prMerge_withoutEvidence_shouldFailOnTransitionGuard() {
            RunResult result = engine.start("pr-merge", "production", mergeInput(false), "ci");

            assertThat(result.status()).isEqualTo(RunStatus.FAILED);
            assertThat(result.run().lastErrorCode()).isEqualTo("PRECONDITIONS_UNMET");
            assertThat(result.steps().get(1).status()).isEqualTo(StepStatus.PENDING);
            assertThat(gate.history("pr_merge", "acme/web#42", 10)).isEmpty();
        }

        @Test
        void start_unknownPlaybook_shouldThrowNotFound() {
            assertThatThrownBy(() -> engine.start("nope", "staging", null, "ci"))
                .isInstanceOf(NotFoundException.class);
        }
    }

    @Nested
    class RetriesAndFailures {

        @Test
        void transientFailures_shouldBackOffExponentially() {
            AtomicInteger calls = new AtomicInteger();
            actions.register("test.flaky", context -> {
                if (calls.incrementAndGet() < 3) {
                    throw StepActionException.transientFailure("UPSTREAM_503", "try again");
                }
                return context.toJsonNode(Map.of("attempt", context.getAttemptNumber()));
            });

            RunResult result = engine.start(playbook(false,
                step("flaky", "test.flaky", RetryPolicy.exponential(3, 2.0, Duration.ofSeconds(60)))),
                "staging", null, "ci");

            assertThat(result.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(sleeper.sleeps()).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
            StepRun flaky = result.steps().get(0);
            assertThat(flaky.attempts()).isEqualTo(3);
            assertThat(flaky.output().get("attempt").asInt()).isEqualTo(3);
        }

        @Test
        void permanentFailure_shouldNotRetry() {
            actions.register("test.broken", context -> {
                throw StepActionException.permanent("BAD_INPUT", "missing title");
            });

            RunResult result = engine.start(playbook(false,
                step("broken", "test.broken", RetryPolicy.exponential(3, 2.0, Duration.ofSeconds(60))),
                step("after", StepActionRegistry.ECHO, null)), "staging", null, "ci");

            assertThat(result.status()).isEqualTo(RunStatus.FAILED);
            assertThat(result.run().lastErrorCode()).isEqualTo("BAD_INPUT");
            assertThat(result.run().lastError()).contains("broken").contains("missing title");
            assertThat(result.steps().get(1).status()).isEqualTo(StepStatus.PENDING);
            assertThat(sleeper.sleeps()).isEmpty();
        }

        @Test
        void retriesExhausted_shouldFailWithLastError() {
            actions.register("test.down", context -> {
                throw StepActionException.transientFailure("UPSTREAM_503", "still down");
            });

            RunResult result = engine.start(playbook(false,
                step("down", "test.down", RetryPolicy.exponential(2, 2.0, Duration.ofSeconds(60)))),
                "staging", null, "ci");

            assertThat(result.status()).isEqualTo(RunStatus.FAILED);
            assertThat(result.steps().get(0).attempts()).isEqualTo(2);
            assertThat(result.steps().get(0).errorCode()).isEqualTo("UPSTREAM_503");
        }

        @Test
        void unexpectedException_shouldBecomeStepExecutionError() {
            actions.register("test.npe", context -> {
                throw new IllegalStateException("boom");
            });

            RunResult result = engine.start(playbook(false, step("npe", "test.npe", null)), "staging", null, "ci");

            assertThat(result.steps().get(0).errorCode()).isEqualTo(ExecutionEngine.STEP_EXECUTION_ERROR);
            assertThat(result.steps().get(0).error()).isEqualTo("boom");
        }

        @Test
        void unknownAction_shouldFailStep() {
            RunResult result = engine.start(playbook(false, step("ghost", "test.missing", null)), "staging", null, "ci");

            assertThat(result.status()).isEqualTo(RunStatus.FAILED);
            assertThat(result.steps().get(0).errorCode()).isEqualTo(ExecutionEngine.UNKNOWN_ACTION);
        }

        @Test
        void continueOnError_shouldRunRemainingSteps() {
            actions.register("test.broken", context -> {
                throw StepActionException.permanent("BAD_INPUT", "nope");
            });

            RunResult result = engine.start(playbook(true,
                step("broken", "test.broken", null),
                step("after", StepActionRegistry.ECHO, null)), "staging", null, "ci");

            assertThat(result.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(result.summary()).isEqualTo(new RunResult.Summary(2, 1, 1, 0, 0));
        }
    }

    @Nested
    class Timeouts {

        @Test
        void deadlinePassedBetweenSteps_shouldFailRun() {
            actions.register("test.slow", context -> {
                time.advanceSeconds(10);
                return context.getParams();
            });

            RunResult result = engine.start(playbook(false, Duration.ofSeconds(5),
                step("slow", "test.slow", null),
                step("next", StepActionRegistry.ECHO, null)), "staging", null, "ci");

            assertThat(result.status()).isEqualTo(RunStatus.FAILED);
            assertThat(result.run().lastErrorCode()).isEqualTo(ExecutionEngine.RUN_TIMEOUT);
            assertThat(result.steps()).extracting(StepRun::status)
                .containsExactly(StepStatus.SUCCEEDED, StepStatus.PENDING);
        }

        @Test
        void backoffPastDeadline_shouldFailInFlightStep() {
            actions.register("test.down", context -> {
                throw StepActionException.transientFailure("UPSTREAM_503", "down");
            });

            RunResult result = engine.start(playbook(false, Duration.ofSeconds(5),
                step("down", "test.down", RetryPolicy.exponential(5, 2.0, Duration.ofSeconds(60)))),
                "staging", null, "ci");

            assertThat(sleeper.sleeps()).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
            assertThat(result.status()).isEqualTo(RunStatus.FAILED);
            assertThat(result.steps().get(0).status()).isEqualTo(StepStatus.FAILED);
            assertThat(result.steps().get(0).errorCode()).isEqualTo(ExecutionEngine.RUN_TIMEOUT);
            assertThat(result.steps().get(0).attempts()).isEqualTo(3);
        }
    }

    @Nested
    class OperatorControl {

        @Test
        @DisplayName("Pause lets the in-flight step finish and starts nothing after it")
        void pause_duringStep_shouldStopBeforeNextStep() {
            actions.register("test.pausing", context -> {
                engine.pause(context.getRunId(), "bob", "maintenance window");
                return context.getParams();
            });

            RunResult paused = engine.start(playbook(false,
                step("first", "test.pausing", null),
                step("second", StepActionRegistry.ECHO, null)), "staging", null, "ci");

            assertThat(paused.status()).isEqualTo(RunStatus.PAUSED);
            assertThat(paused.run().pausedBy()).isEqualTo("bob");
            assertThat(paused.run().pauseReason()).isEqualTo("maintenance window");
            assertThat(paused.run().approvalStepIndex()).isNull();
            assertThat(paused.steps()).extracting(StepRun::status)
                .containsExactly(StepStatus.SUCCEEDED, StepStatus.PENDING);

            engine.resume(paused.run().runId(), "bob");
            RunResult done = engine.advance(paused.run().runId());

            assertThat(done.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(done.run().resumedBy()).isEqualTo("bob");
        }

        @Test
        void cancel_duringStep_shouldStopRun() {
            actions.register("test.cancelling", context -> {
                engine.cancel(context.getRunId(), "carol", "wrong target");
                return context.getParams();
            });

            RunResult result = engine.start(playbook(false,
                step("first", "test.cancelling", null),
                step("second", StepActionRegistry.ECHO, null)), "staging", null, "ci");

            assertThat(result.status()).isEqualTo(RunStatus.CANCELLED);
            assertThat(result.run().cancelledBy()).isEqualTo("carol");
            assertThat(result.run().lastErrorCode()).isEqualTo(ExecutionEngine.CANCELLED);
            assertThat(result.steps().get(1).status()).isEqualTo(StepStatus.PENDING);
        }

        @Test
        void cancel_pausedRun_shouldBeRejected() {
            RunResult paused = engine.start("pr-merge", "production", mergeInput(true), "ci");

            assertThatThrownBy(() -> engine.cancel(paused.run().runId(), "carol", "no"))
                .isInstanceOf(InvalidStateTransitionException.class);
        }

        @Test
        void pauseAndResume_requireValidStatusAndActor() {
            RunResult done = engine.start(playbook(false, step("only", StepActionRegistry.ECHO, null)), "staging", null, "ci");
            UUID runId = done.run().runId();

            assertThatThrownBy(() -> engine.pause(runId, "bob", "late"))
                .isInstanceOf(InvalidStateTransitionException.class);
            assertThatThrownBy(() -> engine.resume(runId, "bob"))
                .isInstanceOf(InvalidStateTransitionException.class)
                .hasMessageContaining("only a PAUSED run can be resumed");
            assertThatThrownBy(() -> engine.pause(runId, " ", "late"))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void resume_runningRun_shouldBeRejectedAndLeaveRunUnchanged() {
            RunResult paused = engine.start("pr-merge", "production", mergeInput(true), "ci");
            UUID runId = paused.run().runId();
            Run running = engine.resume(runId, "alice");
            assertThat(running.status()).isEqualTo(RunStatus.RUNNING);

            assertThatThrownBy(() -> engine.resume(runId, "bob"))
                .isInstanceOf(InvalidStateTransitionException.class)
                .hasMessageContaining("is RUNNING");

            Run after = engine.getRun(runId).run();
            assertThat(after.status()).isEqualTo(RunStatus.RUNNING);
            assertThat(after.version()).isEqualTo(running.version());
            assertThat(after.resumedBy()).isEqualTo("alice");
        }

        @Test
        void advance_nonRunningRun_shouldReturnItUnchanged() {
            RunResult done = engine.start(playbook(false, step("only", StepActionRegistry.ECHO, null)), "staging", null, "ci");

            RunResult again = engine.advance(done.run().runId());

            assertThat(again.run()).isEqualTo(done.run());
        }

        @Test
        void getRun_unknown_shouldThrowNotFound() {
            assertThatThrownBy(() -> engine.getRun(UUID.randomUUID())).isInstanceOf(NotFoundException.class);
        }
    }

    @Nested
    class Recovery {

        @Test
        @DisplayName("A step interrupted after admission replays its own audit row on recovery")
        void interruptedGovernedStep_shouldResumeWithOwnAdmission() {
            AtomicInteger calls = new AtomicInteger();
            actions.register("test.flaky", context -> {
                if (calls.incrementAndGet() == 1) {
                    throw StepActionException.transientFailure("UPSTREAM_503", "try again");
                }
                return context.getParams();
            });
            engine = newEngine(new PolicyCatalogLoader().loadDefault(), new InMemoryExecutionRecordRepository(),
                duration -> {
                    throw new InterruptedException("shutdown");
                });
            PlaybookDefinition playbook = playbook(false, governedStep("publish", "test.flaky",
                RetryPolicy.exponential(3, 2.0, Duration.ofSeconds(60)), "issue_publish"));

            RunResult interrupted = engine.start(playbook, "staging", publishInput(true), "ci");
            assertThat(Thread.interrupted()).isTrue();

            assertThat(interrupted.status()).isEqualTo(RunStatus.RUNNING);
            assertThat(interrupted.steps().get(0).status()).isEqualTo(StepStatus.RUNNING);
            assertThat(engine.findRecoverableRuns(10)).extracting(Run::runId).contains(interrupted.run().runId());

            RunResult recovered = engine.advance(interrupted.run().runId());

            assertThat(recovered.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(recovered.steps().get(0).attempts()).isEqualTo(2);
            assertThat(gate.history("issue_publish", "acme/web#I001", 10)).hasSize(1);
        }

        @Test
        @DisplayName("A step that loses its admission slot to another run is skipped")
        void lostAdmissionSlot_shouldSkipAsDuplicate() {
            PolicyAction unlimited = new PolicyAction("label_sync", "Sync labels", Set.of("staging"),
                null, null, false, List.of("owner", "repo"));
            InMemoryExecutionRecordRepository stale = new InMemoryExecutionRecordRepository() {
                @Override
                public synchronized long countAllowed(String actionType, String targetIdentifier) {
                    return 0;
                }
            };
            engine = newEngine(new PolicyCatalog("test", "hash", Map.of("label_sync", unlimited)), stale, sleeper);
            PlaybookDefinition playbook = playbook(false,
                governedStep("sync", StepActionRegistry.ECHO, null, "label_sync"));

            RunResult first = engine.start(playbook, "staging", publishInput(true), "ci");
            RunResult second = engine.start(playbook, "staging", publishInput(true), "ci");

            assertThat(first.steps().get(0).status()).isEqualTo(StepStatus.SUCCEEDED);
            StepRun skipped = second.steps().get(0);
            assertThat(skipped.status()).isEqualTo(StepStatus.SKIPPED);
            assertThat(skipped.errorCode()).isEqualTo(ExecutionEngine.DUPLICATE_ACTION);
            assertThat(second.status()).isEqualTo(RunStatus.COMPLETED);
        }
    }

    // ========== Fixtures ==========

    private ObjectNode publishInput(boolean publish) {
        ObjectNode variables = mapper.createObjectNode();
        variables.putObject("input")
            .put("owner", "acme")
            .put("repo", "web")
            .put("canonicalId", "I001")
            .put("title", "Hello")
            .put("publish", publish);
        return variables;
    }

    private ObjectNode mergeInput(boolean withEvidence) {
        ObjectNode variables = mapper.createObjectNode();
        variables.putObject("input")
            .put("owner", "acme")
            .put("repo", "web")
            .put("prNumber", 42);
        if (withEvidence) {
            variables.putObject("evidence").put("pr_merged", true);
        }
        return variables;
    }

    private static PlaybookDefinition playbook(boolean continueOnError, StepDefinition... steps) {
        return playbook(continueOnError, Duration.ofMinutes(5), steps);
    }

    private static PlaybookDefinition playbook(boolean continueOnError, Duration timeout, StepDefinition... steps) {
        return new PlaybookDefinition("test-" + UUID.randomUUID(), "Test", null, List.of(steps), timeout, continueOnError);
    }

    private StepDefinition step(String name, String action, RetryPolicy retry) {
        return new StepDefinition(name, action, mapper.createObjectNode().put("step", name),
            null, null, retry, null, null);
    }

    private StepDefinition governedStep(String name, String action, RetryPolicy retry, String actionType) {
        ObjectNode params = mapper.createObjectNode()
            .put("owner", "${input.owner}")
            .put("repo", "${input.repo}")
            .put("canonicalId", "${input.canonicalId}");
        return new StepDefinition(name, action, params, null, null, retry, null,
            new GovernedAction(actionType, "issue", "${input.owner}/${input.repo}#${input.canonicalId}",
                null, null, null));
    }
}
