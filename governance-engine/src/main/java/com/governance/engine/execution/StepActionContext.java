package com.governance.engine.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.UUID;

/**
 * Context handed to a step action handler for one attempt.
 */
public class StepActionContext {

    private final UUID runId;
    private final String playbookId;
    private final String stepName;
    private final int attemptNumber;
    private final String environment;
    private final JsonNode params;
    private final JsonNode variables;
    private final String idempotencyKeyHash;
    private final ObjectMapper objectMapper;

    public StepActionContext(
            UUID runId,
            String playbookId,
            String stepName,
            int attemptNumber,
            String environment,
            JsonNode params,
            JsonNode variables,
            String idempotencyKeyHash,
            ObjectMapper objectMapper) {
        this.runId = runId;
        this.playbookId = playbookId;
        this.stepName = stepName;
        this.attemptNumber = attemptNumber;
        this.environment = environment;
        this.params = params;
        this.variables = variables;
        this.idempotencyKeyHash = idempotencyKeyHash;
        this.objectMapper = objectMapper;
    }

    public UUID getRunId() {
        return runId;
    }

    public String getPlaybookId() {
        return playbookId;
    }

    public String getStepName() {
        return stepName;
    }

    public int getAttemptNumber() {
        return attemptNumber;
    }

    public String getEnvironment() {
        return environment;
    }

    /**
     * Step parameters with {@code ${...}} references already substituted.
     */
    public JsonNode getParams() {
        return params;
    }

    public <T> T getParams(Class<T> type) {
        return objectMapper.convertValue(params, type);
    }

    /**
     * Snapshot of the run variables; changes are not written back.
     */
    public JsonNode getVariables() {
        return variables;
    }

    /**
     * Hash of the idempotency key admitted by the policy gate, null for ungoverned steps.
     * Pass it along on external calls so the far side can deduplicate.
     */
    public String getIdempotencyKeyHash() {
        return idempotencyKeyHash;
    }

    public JsonNode toJsonNode(Object result) {
        return objectMapper.valueToTree(result);
    }
}
