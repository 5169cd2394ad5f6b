package com.governance.engine.persistence;

import com.governance.core.exception.DuplicateRecordException;
import com.governance.core.exception.OptimisticLockException;
import com.governance.core.model.run.Run;
import com.governance.core.model.run.RunStatus;
import com.governance.core.repository.RunRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory run store with the same version check as the JDBC adapter.
 */
public class InMemoryRunRepository implements RunRepository {

    private final Map<UUID, Run> runs = new ConcurrentHashMap<>();

    @Override
    public void insert(Run run) {
        if (runs.putIfAbsent(run.runId(), run) != null) {
            throw new DuplicateRecordException("Run", run.runId().toString());
        }
    }

    @Override
    public void update(Run run) {
        long expected = run.version() - 1;
        runs.compute(run.runId(), (id, current) -> {
            if (current == null || current.version() != expected) {
                throw new OptimisticLockException("Run", id.toString(), expected);
            }
            return run;
        });
    }

    @Override
    public Optional<Run> findById(UUID runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    @Override
    public List<Run> findByStatus(RunStatus status, int limit) {
        return runs.values().stream()
            .filter(r -> r.status() == status)
            .sorted(Comparator.comparing(Run::createdAt))
            .limit(limit)
            .toList();
    }
}
