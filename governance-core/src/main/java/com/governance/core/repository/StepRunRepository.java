package com.governance.core.repository;

import com.governance.core.model.run.StepRun;
import com.governance.core.model.run.StepStatus;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence for step results of a run.
 */
public interface StepRunRepository {

    void insertAll(List<StepRun> steps);

    /**
     * Replace the stored step if its status still equals {@code expectedStatus}.
     *
     * @return false if another writer changed the step first
     */
    boolean transition(StepRun updated, StepStatus expectedStatus);

    Optional<StepRun> find(UUID runId, int stepIndex);

    /**
     * Ordered by step index.
     */
    List<StepRun> findByRun(UUID runId);
}
