package com.governance.engine.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.governance.core.exception.InvalidStateTransitionException;
import com.governance.core.exception.NotFoundException;
import com.governance.core.exception.OptimisticLockException;
import com.governance.core.model.policy.DenialReason;
import com.governance.core.model.policy.ExecutionRecord;
import com.governance.core.model.policy.PolicyDecision;
import com.governance.core.model.policy.PolicyEvaluationContext;
import com.governance.core.model.run.GovernedAction;
import com.governance.core.model.run.PlaybookDefinition;
import com.governance.core.model.run.RetryPolicy;
import com.governance.core.model.run.Run;
import com.governance.core.model.run.RunResult;
import com.governance.core.model.run.RunStatus;
import com.governance.core.model.run.StepDefinition;
import com.governance.core.model.run.StepRun;
import com.governance.core.model.run.StepStatus;
import com.governance.core.model.statemachine.Evidence;
import com.governance.core.repository.RunRepository;
import com.governance.core.repository.StepRunRepository;
import com.governance.engine.logging.LoggingContext;
import com.governance.engine.metrics.GovernanceMetrics;
import com.governance.engine.policy.GateResult;
import com.governance.engine.policy.PolicyGate;
import com.governance.engine.statemachine.TransitionGuard;
import com.governance.engine.statemachine.TransitionVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Drives playbook runs step by step.
 *
 * Every step and run status change is persisted before the engine moves on, so the stored state
 * is always a valid resume point. Run updates are compare-and-set on the run version, step updates
 * on the expected step status. No lock is held while a step action runs.
 *
 * Governed steps are checked against the lifecycle state machine and then admitted by the
 * {@link PolicyGate}. An approval-required denial pauses the run; the operator who resumes it
 * becomes the approval for that step.
 */
public class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    public static final String POLICY_ACTOR = "policy";

    public static final String RUN_TIMEOUT = "RUN_TIMEOUT";
    public static final String DUPLICATE_ACTION = "DUPLICATE_ACTION";
    public static final String CONDITION_NOT_MET = "CONDITION_NOT_MET";
    public static final String UNKNOWN_ACTION = "UNKNOWN_ACTION";
    public static final String STEP_EXECUTION_ERROR = "STEP_EXECUTION_ERROR";
    public static final String PLAYBOOK_MISMATCH = "PLAYBOOK_MISMATCH";
    public static final String CANCELLED = "CANCELLED";

    private static final int MAX_RUN_UPDATE_ATTEMPTS = 5;

    private final RunRepository runRepository;
    private final StepRunRepository stepRepository;
    private final PlaybookRegistry playbooks;
    private final StepActionRegistry actions;
    private final TransitionGuard transitionGuard;
    private final PolicyGate policyGate;
    private final Clock clock;
    private final Sleeper sleeper;
    private final GovernanceMetrics metrics;
    private final ObjectMapper objectMapper;

    // Definitions of runs started by this process; recovered runs fall back to the registry.
    private final Map<UUID, PlaybookDefinition> activePlaybooks = new ConcurrentHashMap<>();

    public ExecutionEngine(
            RunRepository runRepository,
            StepRunRepository stepRepository,
            PlaybookRegistry playbooks,
            StepActionRegistry actions,
            TransitionGuard transitionGuard,
            PolicyGate policyGate,
            Clock clock,
            Sleeper sleeper,
            GovernanceMetrics metrics,
            ObjectMapper objectMapper) {
        this.runRepository = runRepository;
        this.stepRepository = stepRepository;
        this.playbooks = playbooks;
        this.actions = actions;
        this.transitionGuard = transitionGuard;
        this.policyGate = policyGate;
        this.clock = clock;
        this.sleeper = sleeper;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
    }

    // ========== Run control ==========

    public RunResult start(String playbookId, String environment, ObjectNode variables, String triggeredBy) {
        return start(playbooks.get(playbookId), environment, variables, triggeredBy);
    }

    /**
     * Persists a new run with every step pending, moves it to RUNNING and drives it until it
     * finishes, pauses or fails.
     */
    public RunResult start(PlaybookDefinition playbook, String environment, ObjectNode variables, String triggeredBy) {
        Instant now = clock.instant();
        String env = environment == null || environment.isBlank() ? null : environment.trim().toLowerCase(Locale.ROOT);
        Run run = Run.create(playbook, env, variables, triggeredBy, now);

        try (var ctx = LoggingContext.forRun(run.runId(), playbook.playbookId())) {
            runRepository.insert(run);
            List<StepRun> stepRuns = new ArrayList<>();
            for (int i = 0; i < playbook.steps().size(); i++) {
                stepRuns.add(StepRun.pending(run.runId(), i, playbook.steps().get(i).name()));
            }
            stepRepository.insertAll(stepRuns);
            activePlaybooks.put(run.runId(), playbook);
            metrics.runCreated(playbook.playbookId());

            log.info("Created run {} of playbook {} ({} steps, env={}, triggeredBy={})",
                run.runId(), playbook.playbookId(), stepRuns.size(), env, triggeredBy);

            updateRun(run.runId(), current -> {
                requireTransition(current, RunStatus.RUNNING);
                return current.toBuilder()
                    .status(RunStatus.RUNNING)
                    .startedAt(now)
                    .deadline(now.plus(playbook.timeout()))
                    .build();
            });
        }
        return drive(run.runId(), playbook);
    }

    /**
     * Continues a RUNNING run from its first step that has not finished. Used after a resume and by
     * pollers after a restart; a step found RUNNING is attempted again. Runs in any other status are
     * returned unchanged.
     */
    public RunResult advance(UUID runId) {
        Run run = loadRun(runId);
        if (run.status() != RunStatus.RUNNING) {
            log.debug("Run {} is {}, nothing to advance", runId, run.status());
            return result(run);
        }
        return drive(runId, playbookFor(run));
    }

    /**
     * Stops the run from starting further steps. A step already in flight completes.
     *
     * @throws InvalidStateTransitionException unless the run is RUNNING
     */
    public Run pause(UUID runId, String pausedBy, String reason) {
        requireActor(pausedBy, "pausedBy");
        Run paused = updateRun(runId, current -> {
            requireTransition(current, RunStatus.PAUSED);
            return current.toBuilder()
                .status(RunStatus.PAUSED)
                .paused(pausedBy, reason, clock.instant())
                .approvalStepIndex(null)
                .approvalGrantedBy(null)
                .build();
        });
        log.info("Run {} paused by {}: {}", runId, pausedBy, reason);
        return paused;
    }

    /**
     * Returns a paused run to RUNNING. The time spent paused does not count against the run timeout.
     * Call {@link #advance(UUID)} to continue executing steps.
     *
     * @throws InvalidStateTransitionException unless the run is PAUSED
     */
    public Run resume(UUID runId, String resumedBy) {
        requireActor(resumedBy, "resumedBy");
        Run resumed = updateRun(runId, current -> {
            if (current.status() != RunStatus.PAUSED) {
                throw new InvalidStateTransitionException(String.format(
                    "Run %s is %s; only a PAUSED run can be resumed", runId, current.status()));
            }
            Instant now = clock.instant();
            Run.Builder builder = current.toBuilder()
                .status(RunStatus.RUNNING)
                .resumed(resumedBy, now);
            if (current.deadline() != null && current.pausedAt() != null) {
                builder.deadline(current.deadline().plus(Duration.between(current.pausedAt(), now)));
            }
            if (current.approvalStepIndex() != null) {
                builder.approvalGrantedBy(resumedBy);
            }
            return builder.build();
        });
        if (resumed.approvalStepIndex() != null) {
            log.info("Run {} resumed by {}, approving step {}", runId, resumedBy, resumed.approvalStepIndex());
        } else {
            log.info("Run {} resumed by {}", runId, resumedBy);
        }
        return resumed;
    }

    /**
     * Stops the run for good. Step results already recorded are left as they are.
     *
     * @throws InvalidStateTransitionException unless the run is PENDING or RUNNING
     */
    public Run cancel(UUID runId, String cancelledBy, String reason) {
        requireActor(cancelledBy, "cancelledBy");
        Instant now = clock.instant();
        Run cancelled = updateRun(runId, current -> {
            requireTransition(current, RunStatus.CANCELLED);
            return current.toBuilder()
                .status(RunStatus.CANCELLED)
                .cancelledBy(cancelledBy)
                .completedAt(now)
                .error(CANCELLED, reason != null ? reason : "Cancelled by " + cancelledBy)
                .build();
        });
        finished(cancelled, now);
        log.info("Run {} cancelled by {}: {}", runId, cancelledBy, reason);
        return cancelled;
    }

    public RunResult getRun(UUID runId) {
        return result(loadRun(runId));
    }

    /**
     * Runs persisted as RUNNING, e.g. left behind by a crashed process.
     */
    public List<Run> findRecoverableRuns(int limit) {
        return runRepository.findByStatus(RunStatus.RUNNING, limit);
    }

    // ========== Step loop ==========

    private enum StepOutcome { CONTINUE, HALT }

    private RunResult drive(UUID runId, PlaybookDefinition playbook) {
        try {
            while (true) {
                Run run = loadRun(runId);
                if (run.status() != RunStatus.RUNNING) {
                    log.info("Run {} is {}, no further steps started", runId, run.status());
                    break;
                }
                List<StepRun> stepRuns = stepRepository.findByRun(runId);
                Optional<StepRun> next = stepRuns.stream().filter(step -> !step.status().isTerminal()).findFirst();

                if (isPastDeadline(run)) {
                    timeOut(run, playbook, next.filter(step -> step.status() == StepStatus.RUNNING).orElse(null));
                    break;
                }
                if (next.isEmpty()) {
                    finishRun(runId, RunStatus.COMPLETED, null, null);
                    break;
                }
                if (next.get().stepIndex() >= playbook.steps().size()) {
                    finishRun(runId, RunStatus.FAILED, PLAYBOOK_MISMATCH,
                        "Playbook " + playbook.playbookId() + " has no step " + next.get().stepIndex());
                    break;
                }
                if (executeStep(run, playbook, next.get()) == StepOutcome.HALT) {
                    break;
                }
            }
        } catch (StepSuperseded e) {
            log.warn("Run {} stopped driving: {}", runId, e.getMessage());
        }
        return result(loadRun(runId));
    }

    private StepOutcome executeStep(Run run, PlaybookDefinition playbook, StepRun stepRun) {
        StepDefinition step = playbook.steps().get(stepRun.stepIndex());
        try (var ctx = LoggingContext.forStep(run.runId(), playbook.playbookId(), step.name(), stepRun.attempts() + 1)) {
            if (stepRun.status() == StepStatus.PENDING
                    && !ConditionEvaluator.evaluate(step.condition(), run.variables())) {
                transitionStep(stepRun.skipped(CONDITION_NOT_MET, "Condition not met: " + step.condition(),
                    clock.instant()), stepRun.status());
                metrics.stepCompleted(playbook.playbookId(), step.name(), "skipped", Duration.ZERO);
                log.info("Skipped step {}: condition {} not met", step.name(), step.condition());
                return StepOutcome.CONTINUE;
            }

            StepRun running = transitionStep(stepRun.startAttempt(clock.instant()), stepRun.status());
            log.debug("Step {} attempt {} started", step.name(), running.attempts());

            Optional<StepActionHandler> handler = actions.find(step.action());
            if (handler.isEmpty()) {
                return failStep(playbook, step, running, UNKNOWN_ACTION, "No handler registered for action " + step.action());
            }

            JsonNode params = VariableResolver.resolve(step.params(), run.variables());

            if (step.isGoverned()) {
                Admission admission = admit(run, step, running, params);
                switch (admission.kind()) {
                    case PROCEED -> running = admission.step();
                    case SKIP -> {
                        transitionStep(admission.step(), StepStatus.RUNNING);
                        metrics.stepCompleted(playbook.playbookId(), step.name(), "skipped", Duration.ZERO);
                        return StepOutcome.CONTINUE;
                    }
                    case AWAIT_APPROVAL -> {
                        awaitApproval(run, running, admission.reason());
                        return StepOutcome.HALT;
                    }
                    case REJECT -> {
                        return failStep(playbook, step, running, admission.errorCode(), admission.reason());
                    }
                }
            }

            return invoke(run, playbook, step, running, handler.get(), params);
        }
    }

    private StepOutcome invoke(Run run, PlaybookDefinition playbook, StepDefinition step, StepRun running,
                               StepActionHandler handler, JsonNode params) {
        RetryPolicy retryPolicy = step.retryPolicy();
        while (true) {
            StepActionContext context = new StepActionContext(
                run.runId(), playbook.playbookId(), step.name(), running.attempts(), run.environment(),
                params, run.variables().deepCopy(), running.idempotencyKeyHash(), objectMapper);

            String errorCode;
            String errorMessage;
            boolean retryable;
            try {
                JsonNode output = handler.execute(context);
                succeed(run, playbook, step, running, output);
                return StepOutcome.CONTINUE;
            } catch (StepActionException e) {
                errorCode = e.getErrorCode();
                errorMessage = e.getMessage();
                retryable = e.isRetryable();
            } catch (RuntimeException e) {
                log.error("Step {} handler threw unexpectedly", step.name(), e);
                errorCode = STEP_EXECUTION_ERROR;
                errorMessage = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                retryable = true;
            }

            if (!retryable || !retryPolicy.shouldRetry(errorCode) || !retryPolicy.hasMoreAttempts(running.attempts())) {
                return failStep(playbook, step, running, errorCode, errorMessage);
            }

            Duration backoff = retryPolicy.computeBackoff(running.attempts());
            running = transitionStep(running.attemptFailed(errorCode, errorMessage), StepStatus.RUNNING);
            metrics.stepRetried(playbook.playbookId(), step.name(), running.attempts());
            log.warn("Step {} attempt {}/{} failed with {}: {}; retrying in {} ms",
                step.name(), running.attempts(), retryPolicy.maxAttempts(), errorCode, errorMessage, backoff.toMillis());

            Run latest = loadRun(run.runId());
            if (latest.deadline() != null && clock.instant().plus(backoff).isAfter(latest.deadline())) {
                timeOut(latest, playbook, running);
                return StepOutcome.HALT;
            }
            try {
                sleeper.sleep(backoff);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting to retry step {}; the step stays RUNNING for recovery", step.name());
                return StepOutcome.HALT;
            }

            latest = loadRun(run.runId());
            if (latest.isTerminal()) {
                log.info("Run {} became {} during backoff, abandoning step {}", run.runId(), latest.status(), step.name());
                return StepOutcome.HALT;
            }
            running = transitionStep(running.startAttempt(clock.instant()), StepStatus.RUNNING);
        }
    }

    private void succeed(Run run, PlaybookDefinition playbook, StepDefinition step, StepRun running, JsonNode output) {
        if (step.assign() != null && !step.assign().isBlank()) {
            updateRun(run.runId(), current -> {
                if (current.isTerminal()) {
                    return current;
                }
                ObjectNode variables = current.variables().deepCopy();
                variables.set(step.assign(), output);
                return current.toBuilder().variables(variables).build();
            });
        }
        StepRun succeeded = transitionStep(running.succeeded(output, clock.instant()), StepStatus.RUNNING);
        metrics.stepCompleted(playbook.playbookId(), step.name(), "succeeded", Duration.ofMillis(succeeded.durationMs()));
        log.info("Step {} succeeded after {} attempt(s) in {} ms", step.name(), succeeded.attempts(), succeeded.durationMs());
    }

    private StepOutcome failStep(PlaybookDefinition playbook, StepDefinition step, StepRun running,
                                 String errorCode, String message) {
        StepRun failed = transitionStep(running.failed(errorCode, message, clock.instant()), StepStatus.RUNNING);
        metrics.stepFailed(playbook.playbookId(), step.name(), errorCode);
        metrics.stepCompleted(playbook.playbookId(), step.name(), "failed", Duration.ofMillis(failed.durationMs()));

        if (playbook.continueOnError(step)) {
            log.warn("Step {} failed with {}: {}; continuing", step.name(), errorCode, message);
            return StepOutcome.CONTINUE;
        }
        log.error("Step {} failed with {}: {}; stopping run", step.name(), errorCode, message);
        finishRun(running.runId(), RunStatus.FAILED, errorCode, "Step " + step.name() + " failed: " + message);
        return StepOutcome.HALT;
    }

    // ========== Governance ==========

    private enum AdmissionKind { PROCEED, SKIP, AWAIT_APPROVAL, REJECT }

    private record Admission(AdmissionKind kind, StepRun step, String errorCode, String reason) {
    }

    private Admission admit(Run run, StepDefinition step, StepRun running, JsonNode params) {
        GovernedAction governance = step.governance();

        if (governance.hasTransition()) {
            Evidence evidence = evidenceFrom(run.variables().get(governance.evidenceVariable()));
            TransitionVerdict verdict = transitionGuard.evaluate(
                governance.transitionFrom(), governance.transitionTo(), evidence);
            if (!verdict.allowed()) {
                return new Admission(AdmissionKind.REJECT, running, verdict.code().name(), verdict.message());
            }
        }

        boolean approved = run.approvalGrantedBy() != null
            && Objects.equals(run.approvalStepIndex(), running.stepIndex());
        // A retried admission of the same step replays its own audit row instead of taking a new slot.
        String requestId = run.runId() + ":" + running.stepIndex() + (approved ? ":approved" : "");

        PolicyEvaluationContext.Builder request = PolicyEvaluationContext.builder()
            .requestId(requestId)
            .actionType(governance.actionType())
            .targetType(governance.targetType())
            .targetIdentifier(VariableResolver.substitute(governance.targetIdentifier(), run.variables()))
            .deploymentEnv(run.environment())
            .actor(run.triggeredBy())
            .actionContext(params);
        if (approved) {
            request.approval(run.approvalGrantedBy());
        }

        GateResult result = policyGate.evaluateAndRecord(request.build());
        ExecutionRecord record = result.record();
        boolean ownReplay = record != null && requestId.equals(record.requestId());
        if (result.isDuplicate() && !ownReplay) {
            String reason = "Action " + governance.actionType() + " already processed or pending"
                + " (key hash " + result.decision().idempotencyKeyHash() + ")";
            log.info("Skipping step {}: {}", step.name(), reason);
            return new Admission(AdmissionKind.SKIP,
                running.skipped(DUPLICATE_ACTION, reason, clock.instant()), DUPLICATE_ACTION, reason);
        }

        PolicyDecision decision = result.decision();
        if (decision.allow()) {
            StepRun admitted = transitionStep(running.withIdempotencyKeyHash(decision.idempotencyKeyHash()),
                StepStatus.RUNNING);
            return new Admission(AdmissionKind.PROCEED, admitted, null, null);
        }
        if (decision.reasonCode() == DenialReason.APPROVAL_REQUIRED) {
            return new Admission(AdmissionKind.AWAIT_APPROVAL, running, decision.reasonCode().name(), decision.reason());
        }
        String reason = decision.nextAllowedAt() != null
            ? decision.reason() + " (next allowed at " + decision.nextAllowedAt() + ")"
            : decision.reason();
        return new Admission(AdmissionKind.REJECT, running, decision.reasonCode().name(), reason);
    }

    private void awaitApproval(Run run, StepRun running, String reason) {
        transitionStep(running.awaitingApproval(reason), StepStatus.RUNNING);
        Instant now = clock.instant();
        updateRun(run.runId(), current -> {
            if (current.isTerminal()) {
                return current;
            }
            Run.Builder builder = current.toBuilder()
                .approvalStepIndex(running.stepIndex())
                .approvalGrantedBy(null);
            if (current.status() == RunStatus.RUNNING) {
                builder.status(RunStatus.PAUSED).paused(POLICY_ACTOR, reason, now);
            }
            return builder.build();
        });
        log.info("Run {} paused: step {} requires approval", run.runId(), running.stepName());
    }

    private static Evidence evidenceFrom(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Evidence.none();
        }
        Map<String, Boolean> tags = new LinkedHashMap<>();
        node.fields().forEachRemaining(entry -> tags.put(entry.getKey(), entry.getValue().asBoolean(false)));
        return Evidence.of(tags);
    }

    // ========== Persistence helpers ==========

    private StepRun transitionStep(StepRun updated, StepStatus expected) {
        if (!expected.canTransitionTo(updated.status())) {
            throw new InvalidStateTransitionException("Step",
                updated.runId() + "/" + updated.stepName(), expected, updated.status());
        }
        if (!stepRepository.transition(updated, expected)) {
            throw new StepSuperseded(String.format("step %s of run %s is no longer %s",
                updated.stepName(), updated.runId(), expected));
        }
        return updated;
    }

    /**
     * Reads the current run, applies the change and writes it back with the next version, retrying on
     * concurrent updates. A change that returns its input unchanged writes nothing.
     */
    private Run updateRun(UUID runId, UnaryOperator<Run> change) {
        for (int attempt = 1; ; attempt++) {
            Run current = loadRun(runId);
            Run changed = change.apply(current);
            if (changed == current) {
                return current;
            }
            Run next = changed.toBuilder().incrementVersion().build();
            try {
                runRepository.update(next);
            } catch (OptimisticLockException e) {
                if (attempt >= MAX_RUN_UPDATE_ATTEMPTS) {
                    throw e;
                }
                log.debug("Run {} changed concurrently, re-reading (attempt {})", runId, attempt);
                continue;
            }
            if (current.status() != next.status()) {
                metrics.runTransition(next.playbookId(), current.status(), next.status());
            }
            return next;
        }
    }

    private void finishRun(UUID runId, RunStatus status, String errorCode, String message) {
        Instant now = clock.instant();
        Run finished = updateRun(runId, current -> {
            if (current.status() != RunStatus.RUNNING) {
                return current;
            }
            Run.Builder builder = current.toBuilder().status(status).completedAt(now);
            if (errorCode != null) {
                builder.error(errorCode, message);
            }
            return builder.build();
        });
        if (finished.status() == status) {
            finished(finished, now);
            log.info("Run {} {}", runId, status);
        }
    }

    private void timeOut(Run run, PlaybookDefinition playbook, StepRun inFlight) {
        String message = "Run exceeded its timeout of " + playbook.timeout().toMillis() + " ms";
        if (inFlight != null) {
            transitionStep(inFlight.failed(RUN_TIMEOUT, message, clock.instant()), StepStatus.RUNNING);
            metrics.stepFailed(playbook.playbookId(), inFlight.stepName(), RUN_TIMEOUT);
        }
        log.warn("Run {} timed out (deadline {})", run.runId(), run.deadline());
        finishRun(run.runId(), RunStatus.FAILED, RUN_TIMEOUT, message);
    }

    private void finished(Run run, Instant now) {
        activePlaybooks.remove(run.runId());
        Instant startedAt = run.startedAt() != null ? run.startedAt() : run.createdAt();
        metrics.runFinished(run.playbookId(), run.status(), Duration.between(startedAt, now));
    }

    private boolean isPastDeadline(Run run) {
        return run.deadline() != null && !clock.instant().isBefore(run.deadline());
    }

    private Run loadRun(UUID runId) {
        return runRepository.findById(runId)
            .orElseThrow(() -> new NotFoundException("Run", runId.toString()));
    }

    private RunResult result(Run run) {
        return new RunResult(run, stepRepository.findByRun(run.runId()));
    }

    private PlaybookDefinition playbookFor(Run run) {
        PlaybookDefinition active = activePlaybooks.get(run.runId());
        return active != null ? active : playbooks.get(run.playbookId());
    }

    private static void requireTransition(Run run, RunStatus target) {
        if (!run.status().canTransitionTo(target)) {
            throw new InvalidStateTransitionException("Run", run.runId().toString(), run.status(), target);
        }
    }

    private static void requireActor(String actor, String field) {
        if (actor == null || actor.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }

    /**
     * Another caller moved a step first; this driver backs off.
     */
    private static final class StepSuperseded extends RuntimeException {
        StepSuperseded(String message) {
            super(message);
        }
    }
}
