package com.governance.engine.persistence;

import com.governance.core.model.run.StepRun;
import com.governance.core.model.run.StepStatus;
import com.governance.core.repository.StepRunRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory step store; transitions are compare-and-set on the stored status.
 */
public class InMemoryStepRunRepository implements StepRunRepository {

    private final Map<UUID, Map<Integer, StepRun>> steps = new ConcurrentHashMap<>();

    @Override
    public void insertAll(List<StepRun> stepRuns) {
        for (StepRun step : stepRuns) {
            steps.computeIfAbsent(step.runId(), id -> new ConcurrentHashMap<>())
                .putIfAbsent(step.stepIndex(), step);
        }
    }

    @Override
    public boolean transition(StepRun updated, StepStatus expectedStatus) {
        Map<Integer, StepRun> byIndex = steps.get(updated.runId());
        if (byIndex == null) {
            return false;
        }
        AtomicBoolean applied = new AtomicBoolean(false);
        byIndex.computeIfPresent(updated.stepIndex(), (index, current) -> {
            if (current.status() != expectedStatus) {
                return current;
            }
            applied.set(true);
            return updated;
        });
        return applied.get();
    }

    @Override
    public Optional<StepRun> find(UUID runId, int stepIndex) {
        return Optional.ofNullable(steps.getOrDefault(runId, Map.of()).get(stepIndex));
    }

    @Override
    public List<StepRun> findByRun(UUID runId) {
        return steps.getOrDefault(runId, Map.of()).values().stream()
            .sorted(Comparator.comparingInt(StepRun::stepIndex))
            .toList();
    }
}
