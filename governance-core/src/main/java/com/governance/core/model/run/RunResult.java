package com.governance.core.model.run;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * A run together with its ordered step results.
 */
public record RunResult(
    Run run,
    List<StepRun> steps
) {
    public RunResult {
        steps = List.copyOf(steps);
    }

    public RunStatus status() {
        return run.status();
    }

    public JsonNode output() {
        return run.variables();
    }

    public long count(StepStatus status) {
        return steps.stream().filter(step -> step.status() == status).count();
    }

    public Summary summary() {
        return new Summary(
            steps.size(),
            count(StepStatus.SUCCEEDED),
            count(StepStatus.FAILED),
            count(StepStatus.SKIPPED),
            count(StepStatus.PENDING) + count(StepStatus.RUNNING)
        );
    }

    public record Summary(int total, long succeeded, long failed, long skipped, long pending) {
    }
}
