package com.governance.core.model.run;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered list of steps executed by one run.
 */
public record PlaybookDefinition(
    String playbookId,
    String name,
    String description,
    List<StepDefinition> steps,
    Duration timeout,
    boolean continueOnError
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(300_000);

    public PlaybookDefinition {
        if (playbookId == null || playbookId.isBlank()) {
            throw new IllegalArgumentException("playbookId is required");
        }
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("Playbook " + playbookId + " has no steps");
        }
        Set<String> names = new HashSet<>();
        for (StepDefinition step : steps) {
            if (!names.add(step.name())) {
                throw new IllegalArgumentException(
                    "Playbook " + playbookId + " has duplicate step name: " + step.name());
            }
        }
        steps = List.copyOf(steps);
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            timeout = DEFAULT_TIMEOUT;
        }
    }

    public boolean continueOnError(StepDefinition step) {
        return step.continueOnError() != null ? step.continueOnError() : continueOnError;
    }
}
