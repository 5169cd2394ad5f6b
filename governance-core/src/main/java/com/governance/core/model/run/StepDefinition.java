package com.governance.core.model.run;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * One step of a playbook.
 *
 * @param action          registered action name, e.g. {@code github.createIssue}
 * @param params          parameters; string values may contain {@code ${path}} references
 * @param condition       optional guard; the step is skipped when it evaluates false
 * @param assign          optional variable name receiving the step output
 * @param continueOnError null means "use the playbook default"
 * @param governance      null for ungoverned (read-only) steps
 */
public record StepDefinition(
    String name,
    String action,
    JsonNode params,
    String condition,
    String assign,
    RetryPolicy retryPolicy,
    Boolean continueOnError,
    GovernedAction governance
) {
    public StepDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Step name is required");
        }
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("Step " + name + " requires an action");
        }
        if (params == null || params.isNull()) {
            params = JsonNodeFactory.instance.objectNode();
        }
        if (retryPolicy == null) {
            retryPolicy = RetryPolicy.noRetry();
        }
    }

    public boolean isGoverned() {
        return governance != null;
    }

    public static StepDefinition of(String name, String action, JsonNode params) {
        return new StepDefinition(name, action, params, null, null, null, null, null);
    }
}
