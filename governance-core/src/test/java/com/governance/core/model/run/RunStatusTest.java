package com.governance.core.model.run;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RunStatusTest {

    @Test
    void isTerminal_shouldIdentifyTerminalStatuses() {
        assertTrue(RunStatus.COMPLETED.isTerminal());
        assertTrue(RunStatus.FAILED.isTerminal());
        assertTrue(RunStatus.CANCELLED.isTerminal());

        assertFalse(RunStatus.PENDING.isTerminal());
        assertFalse(RunStatus.RUNNING.isTerminal());
        assertFalse(RunStatus.PAUSED.isTerminal());
    }

    @Test
    void canTransitionTo_fromRunning_shouldAllowPauseAndFinish() {
        assertTrue(RunStatus.RUNNING.canTransitionTo(RunStatus.PAUSED));
        assertTrue(RunStatus.RUNNING.canTransitionTo(RunStatus.COMPLETED));
        assertTrue(RunStatus.RUNNING.canTransitionTo(RunStatus.FAILED));
        assertTrue(RunStatus.RUNNING.canTransitionTo(RunStatus.CANCELLED));

        assertFalse(RunStatus.RUNNING.canTransitionTo(RunStatus.PENDING));
    }

    @Test
    void canTransitionTo_fromPaused_shouldOnlyAllowRunning() {
        assertTrue(RunStatus.PAUSED.canTransitionTo(RunStatus.RUNNING));

        assertFalse(RunStatus.PAUSED.canTransitionTo(RunStatus.COMPLETED));
        assertFalse(RunStatus.PAUSED.canTransitionTo(RunStatus.FAILED));
        assertFalse(RunStatus.PAUSED.canTransitionTo(RunStatus.CANCELLED));
    }

    @Test
    void canTransitionTo_fromTerminalStatuses_shouldNotAllowAny() {
        for (RunStatus terminal : new RunStatus[]{RunStatus.COMPLETED, RunStatus.FAILED, RunStatus.CANCELLED}) {
            for (RunStatus target : RunStatus.values()) {
                assertFalse(terminal.canTransitionTo(target), terminal + " -> " + target);
            }
        }
    }

    @Test
    void stepStatus_shouldAllowRetryAndApprovalParking() {
        assertTrue(StepStatus.RUNNING.canTransitionTo(StepStatus.RUNNING));
        assertTrue(StepStatus.RUNNING.canTransitionTo(StepStatus.PENDING));
        assertTrue(StepStatus.PENDING.canTransitionTo(StepStatus.SKIPPED));

        assertFalse(StepStatus.SUCCEEDED.canTransitionTo(StepStatus.RUNNING));
        assertFalse(StepStatus.PENDING.canTransitionTo(StepStatus.SUCCEEDED));
    }
}
