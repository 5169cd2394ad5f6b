package com.governance.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.governance.core.model.run.Run;
import com.governance.core.model.run.RunResult;
import com.governance.core.model.run.RunStatus;
import com.governance.core.model.run.StepRun;
import com.governance.core.model.run.StepStatus;
import com.governance.engine.execution.ExecutionEngine;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * REST API for playbook runs.
 */
@RestController
@RequestMapping("/api/v1/runs")
public class RunController {

    private final ExecutionEngine executionEngine;

    public RunController(ExecutionEngine executionEngine) {
        this.executionEngine = executionEngine;
    }

    /**
     * Start a run. The call returns once the run has finished, paused or failed.
     */
    @PostMapping
    public ResponseEntity<RunResponse> startRun(@RequestBody StartRunRequest request) {
        RunResult result = executionEngine.start(
            request.playbookId(),
            request.environment(),
            request.variables(),
            request.triggeredBy()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(RunResponse.from(result));
    }

    @GetMapping("/{runId}")
    public ResponseEntity<RunResponse> getRun(@PathVariable UUID runId) {
        return ResponseEntity.ok(RunResponse.from(executionEngine.getRun(runId)));
    }

    /**
     * Runs left RUNNING, typically after a restart. Each can be continued with {@code /advance}.
     */
    @GetMapping("/recoverable")
    public ResponseEntity<List<RunSummaryResponse>> recoverableRuns(@RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(executionEngine.findRecoverableRuns(limit).stream()
            .map(RunSummaryResponse::from)
            .toList());
    }

    @PostMapping("/{runId}/pause")
    public ResponseEntity<RunResponse> pauseRun(@PathVariable UUID runId, @RequestBody PauseRequest request) {
        executionEngine.pause(runId, request.pausedBy(), request.reason());
        return ResponseEntity.ok(RunResponse.from(executionEngine.getRun(runId)));
    }

    /**
     * Resume a paused run. Resuming a run paused on an approval gate grants that approval.
     */
    @PostMapping("/{runId}/resume")
    public ResponseEntity<RunResponse> resumeRun(@PathVariable UUID runId, @RequestBody ResumeRequest request) {
        executionEngine.resume(runId, request.resumedBy());
        RunResult result = request.advance() == null || request.advance()
            ? executionEngine.advance(runId)
            : executionEngine.getRun(runId);
        return ResponseEntity.ok(RunResponse.from(result));
    }

    @PostMapping("/{runId}/cancel")
    public ResponseEntity<RunResponse> cancelRun(@PathVariable UUID runId, @RequestBody CancelRequest request) {
        executionEngine.cancel(runId, request.cancelledBy(), request.reason());
        return ResponseEntity.ok(RunResponse.from(executionEngine.getRun(runId)));
    }

    @PostMapping("/{runId}/advance")
    public ResponseEntity<RunResponse> advanceRun(@PathVariable UUID runId) {
        return ResponseEntity.ok(RunResponse.from(executionEngine.advance(runId)));
    }

    // ========== DTOs ==========

    public record StartRunRequest(
        String playbookId,
        String environment,
        ObjectNode variables,
        String triggeredBy
    ) {}

    public record PauseRequest(String pausedBy, String reason) {}

    /**
     * @param advance continue executing steps after resuming; defaults to true
     */
    public record ResumeRequest(String resumedBy, Boolean advance) {}

    public record CancelRequest(String cancelledBy, String reason) {}

    public record RunResponse(
        UUID runId,
        String playbookId,
        RunStatus status,
        String environment,
        String triggeredBy,
        JsonNode variables,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        Instant deadline,
        String pausedBy,
        String pauseReason,
        Integer approvalStepIndex,
        String approvalGrantedBy,
        String cancelledBy,
        String lastErrorCode,
        String lastError,
        long version,
        List<StepResponse> steps,
        RunResult.Summary summary
    ) {
        public static RunResponse from(RunResult result) {
            Run run = result.run();
            return new RunResponse(
                run.runId(),
                run.playbookId(),
                run.status(),
                run.environment(),
                run.triggeredBy(),
                run.variables(),
                run.createdAt(),
                run.startedAt(),
                run.completedAt(),
                run.deadline(),
                run.pausedBy(),
                run.pauseReason(),
                run.approvalStepIndex(),
                run.approvalGrantedBy(),
                run.cancelledBy(),
                run.lastErrorCode(),
                run.lastError(),
                run.version(),
                result.steps().stream().map(StepResponse::from).toList(),
                result.summary()
            );
        }
    }

    public record StepResponse(
        int stepIndex,
        String stepName,
        StepStatus status,
        int attempts,
        JsonNode output,
        String errorCode,
        String error,
        String idempotencyKeyHash,
        Instant startedAt,
        Instant completedAt
    ) {
        static StepResponse from(StepRun step) {
            return new StepResponse(
                step.stepIndex(),
                step.stepName(),
                step.status(),
                step.attempts(),
                step.output(),
                step.errorCode(),
                step.error(),
                step.idempotencyKeyHash(),
                step.startedAt(),
                step.completedAt()
            );
        }
    }

    public record RunSummaryResponse(
        UUID runId,
        String playbookId,
        RunStatus status,
        Instant startedAt,
        Instant deadline,
        long version
    ) {
        static RunSummaryResponse from(Run run) {
            return new RunSummaryResponse(run.runId(), run.playbookId(), run.status(),
                run.startedAt(), run.deadline(), run.version());
        }
    }
}
