package com.governance.core.model.run;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

/**
 * Persisted result of one step of one run. Owned exclusively by its run.
 */
public record StepRun(
    UUID runId,
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
    public static StepRun pending(UUID runId, int stepIndex, String stepName) {
        return new StepRun(runId, stepIndex, stepName, StepStatus.PENDING, 0,
            null, null, null, null, null, null);
    }

    public StepRun startAttempt(Instant now) {
        return new StepRun(runId, stepIndex, stepName, StepStatus.RUNNING, attempts + 1,
            output, null, null, idempotencyKeyHash,
            startedAt != null ? startedAt : now, null);
    }

    public StepRun withIdempotencyKeyHash(String hash) {
        return new StepRun(runId, stepIndex, stepName, status, attempts,
            output, errorCode, error, hash, startedAt, completedAt);
    }

    public StepRun succeeded(JsonNode stepOutput, Instant now) {
        return new StepRun(runId, stepIndex, stepName, StepStatus.SUCCEEDED, attempts,
            stepOutput, null, null, idempotencyKeyHash, startedAt, now);
    }

    public StepRun failed(String code, String message, Instant now) {
        return new StepRun(runId, stepIndex, stepName, StepStatus.FAILED, attempts,
            output, code, message, idempotencyKeyHash, startedAt, now);
    }

    public StepRun attemptFailed(String code, String message) {
        return new StepRun(runId, stepIndex, stepName, StepStatus.RUNNING, attempts,
            output, code, message, idempotencyKeyHash, startedAt, null);
    }

    public StepRun skipped(String code, String reason, Instant now) {
        return new StepRun(runId, stepIndex, stepName, StepStatus.SKIPPED, attempts,
            output, code, reason, idempotencyKeyHash, startedAt, now);
    }

    /**
     * Park a running step behind an approval gate; the attempt does not count.
     */
    public StepRun awaitingApproval(String reason) {
        return new StepRun(runId, stepIndex, stepName, StepStatus.PENDING, Math.max(0, attempts - 1),
            output, "APPROVAL_REQUIRED", reason, idempotencyKeyHash, startedAt, null);
    }

    public long durationMs() {
        if (startedAt == null || completedAt == null) {
            return 0L;
        }
        return completedAt.toEpochMilli() - startedAt.toEpochMilli();
    }
}
