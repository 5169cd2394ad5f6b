package com.governance.engine.persistence;

import com.governance.core.model.policy.ExecutionRecord;
import com.governance.core.repository.ExecutionRecordRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * In-memory audit trail. Single-process only; uniqueness is enforced under one monitor.
 */
public class InMemoryExecutionRecordRepository implements ExecutionRecordRepository {

    private final List<ExecutionRecord> records = new ArrayList<>();
    private final Map<String, ExecutionRecord> byRequestId = new HashMap<>();
    private final Set<AdmissionSlot> admissionSlots = new HashSet<>();

    @Override
    public synchronized boolean insertIfAbsent(ExecutionRecord record) {
        if (byRequestId.containsKey(record.requestId())) {
            return false;
        }
        if (record.isAllowed()) {
            AdmissionSlot slot = new AdmissionSlot(
                record.actionType(), record.targetIdentifier(), record.admissionSequence());
            if (!admissionSlots.add(slot)) {
                return false;
            }
        }
        records.add(record);
        byRequestId.put(record.requestId(), record);
        return true;
    }

    @Override
    public synchronized long countAllowedSince(String actionType, String targetIdentifier, Instant since) {
        return allowed(actionType, targetIdentifier)
            .filter(r -> !r.createdAt().isBefore(since))
            .count();
    }

    @Override
    public synchronized Optional<ExecutionRecord> findOldestAllowedSince(String actionType, String targetIdentifier,
                                                                         Instant since) {
        return allowed(actionType, targetIdentifier)
            .filter(r -> !r.createdAt().isBefore(since))
            .min(Comparator.comparing(ExecutionRecord::createdAt));
    }

    @Override
    public synchronized Optional<ExecutionRecord> findLastAllowed(String actionType, String targetIdentifier) {
        return allowed(actionType, targetIdentifier)
            .max(Comparator.comparing(ExecutionRecord::createdAt));
    }

    @Override
    public synchronized long countAllowed(String actionType, String targetIdentifier) {
        return allowed(actionType, targetIdentifier).count();
    }

    @Override
    public synchronized Optional<ExecutionRecord> findByRequestId(String requestId) {
        return Optional.ofNullable(byRequestId.get(requestId));
    }

    @Override
    public synchronized List<ExecutionRecord> findByTarget(String actionType, String targetIdentifier, int limit) {
        return records.stream()
            .filter(r -> r.actionType().equals(actionType) && r.targetIdentifier().equals(targetIdentifier))
            .sorted(Comparator.comparing(ExecutionRecord::createdAt).reversed())
            .limit(limit)
            .toList();
    }

    private Stream<ExecutionRecord> allowed(String actionType, String targetIdentifier) {
        return records.stream()
            .filter(ExecutionRecord::isAllowed)
            .filter(r -> r.actionType().equals(actionType) && r.targetIdentifier().equals(targetIdentifier));
    }

    private record AdmissionSlot(String actionType, String targetIdentifier, Long sequence) {
    }
}
