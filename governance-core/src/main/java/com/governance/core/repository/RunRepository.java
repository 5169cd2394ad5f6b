package com.governance.core.repository;

import com.governance.core.model.run.Run;
import com.governance.core.model.run.RunStatus;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence for playbook runs with optimistic locking on {@link Run#version()}.
 */
public interface RunRepository {

    /**
     * @throws com.governance.core.exception.DuplicateRecordException if the runId exists
     */
    void insert(Run run);

    /**
     * Replace the stored run if its version is {@code run.version() - 1}.
     *
     * @throws com.governance.core.exception.OptimisticLockException if the stored version differs
     */
    void update(Run run);

    Optional<Run> findById(UUID runId);

    List<Run> findByStatus(RunStatus status, int limit);
}
