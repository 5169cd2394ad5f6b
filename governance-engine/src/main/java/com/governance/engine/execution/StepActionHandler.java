package com.governance.engine.execution;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * An external capability invoked by a playbook step, e.g. a tool call against a code host.
 * The engine holds no lock while a handler runs.
 */
@FunctionalInterface
public interface StepActionHandler {

    /**
     * @param context resolved parameters and run details
     * @return the step output, assigned to a run variable when the step names one
     * @throws StepActionException if the action fails
     */
    JsonNode execute(StepActionContext context) throws StepActionException;
}
