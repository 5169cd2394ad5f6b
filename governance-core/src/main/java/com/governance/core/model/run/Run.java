package com.governance.core.model.run;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.UUID;

/**
 * A single execution of a playbook. Primary source of truth for run status.
 *
 * Invariants:
 * - status transitions follow {@link RunStatus#canTransitionTo}
 * - version increases by one on every persisted change
 * - approvalStepIndex is set only while the run is paused on an approval gate
 */
public record Run(
    UUID runId,
    String playbookId,
    RunStatus status,
    String triggeredBy,
    String environment,
    ObjectNode variables,

    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    Instant deadline,

    String pausedBy,
    String pauseReason,
    Instant pausedAt,
    String resumedBy,
    Instant resumedAt,
    Integer approvalStepIndex,
    String approvalGrantedBy,
    String cancelledBy,

    String lastErrorCode,
    String lastError,

    long version
) {
    public static Run create(PlaybookDefinition playbook, String environment, ObjectNode variables,
                             String triggeredBy, Instant now) {
        return new Run(
            UUID.randomUUID(),
            playbook.playbookId(),
            RunStatus.PENDING,
            triggeredBy,
            environment,
            variables != null ? variables.deepCopy() : JsonNodeFactory.instance.objectNode(),
            now,
            null,
            null,
            null,
            null, null, null, null, null, null, null, null,
            null, null,
            0L
        );
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isAwaitingApproval() {
        return status == RunStatus.PAUSED && approvalStepIndex != null;
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static class Builder {
        private final UUID runId;
        private final String playbookId;
        private final String triggeredBy;
        private final String environment;
        private final Instant createdAt;
        private RunStatus status;
        private ObjectNode variables;
        private Instant startedAt;
        private Instant completedAt;
        private Instant deadline;
        private String pausedBy;
        private String pauseReason;
        private Instant pausedAt;
        private String resumedBy;
        private Instant resumedAt;
        private Integer approvalStepIndex;
        private String approvalGrantedBy;
        private String cancelledBy;
        private String lastErrorCode;
        private String lastError;
        private long version;

        Builder(Run run) {
            this.runId = run.runId;
            this.playbookId = run.playbookId;
            this.triggeredBy = run.triggeredBy;
            this.environment = run.environment;
            this.createdAt = run.createdAt;
            this.status = run.status;
            this.variables = run.variables;
            this.startedAt = run.startedAt;
            this.completedAt = run.completedAt;
            this.deadline = run.deadline;
            this.pausedBy = run.pausedBy;
            this.pauseReason = run.pauseReason;
            this.pausedAt = run.pausedAt;
            this.resumedBy = run.resumedBy;
            this.resumedAt = run.resumedAt;
            this.approvalStepIndex = run.approvalStepIndex;
            this.approvalGrantedBy = run.approvalGrantedBy;
            this.cancelledBy = run.cancelledBy;
            this.lastErrorCode = run.lastErrorCode;
            this.lastError = run.lastError;
            this.version = run.version;
        }

        public Builder status(RunStatus status) {
            this.status = status;
            return this;
        }

        public Builder variables(ObjectNode variables) {
            this.variables = variables;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder deadline(Instant deadline) {
            this.deadline = deadline;
            return this;
        }

        public Builder paused(String pausedBy, String reason, Instant at) {
            this.pausedBy = pausedBy;
            this.pauseReason = reason;
            this.pausedAt = at;
            return this;
        }

        public Builder resumed(String resumedBy, Instant at) {
            this.resumedBy = resumedBy;
            this.resumedAt = at;
            return this;
        }

        public Builder approvalStepIndex(Integer approvalStepIndex) {
            this.approvalStepIndex = approvalStepIndex;
            return this;
        }

        public Builder approvalGrantedBy(String approvalGrantedBy) {
            this.approvalGrantedBy = approvalGrantedBy;
            return this;
        }

        public Builder cancelledBy(String cancelledBy) {
            this.cancelledBy = cancelledBy;
            return this;
        }

        public Builder error(String errorCode, String error) {
            this.lastErrorCode = errorCode;
            this.lastError = error;
            return this;
        }

        public Builder incrementVersion() {
            this.version++;
            return this;
        }

        public Run build() {
            return new Run(
                runId, playbookId, status, triggeredBy, environment, variables,
                createdAt, startedAt, completedAt, deadline,
                pausedBy, pauseReason, pausedAt, resumedBy, resumedAt,
                approvalStepIndex, approvalGrantedBy, cancelledBy,
                lastErrorCode, lastError,
                version
            );
        }
    }
}
