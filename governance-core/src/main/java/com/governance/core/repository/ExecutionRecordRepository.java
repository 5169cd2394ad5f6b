package com.governance.core.repository;

import com.governance.core.model.policy.ExecutionRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only audit trail of governed action attempts.
 *
 * Uniqueness:
 * - requestId
 * - (actionType, targetIdentifier, admissionSequence) for allowed records
 */
public interface ExecutionRecordRepository {

    /**
     * Append a record unless one with the same requestId, or an allowed record with the same
     * admission slot, already exists.
     *
     * @return true if this call wrote the record, false if another writer got there first
     * @throws com.governance.core.exception.PersistenceException if the store is unavailable
     */
    boolean insertIfAbsent(ExecutionRecord record);

    /**
     * Number of allowed records for the action and target created at or after {@code since}.
     */
    long countAllowedSince(String actionType, String targetIdentifier, Instant since);

    /**
     * Oldest allowed record inside the window, used to compute when the window frees a slot.
     */
    Optional<ExecutionRecord> findOldestAllowedSince(String actionType, String targetIdentifier, Instant since);

    Optional<ExecutionRecord> findLastAllowed(String actionType, String targetIdentifier);

    /**
     * Total allowed records for the action and target; the next admission sequence.
     */
    long countAllowed(String actionType, String targetIdentifier);

    Optional<ExecutionRecord> findByRequestId(String requestId);

    /**
     * Most recent records first.
     */
    List<ExecutionRecord> findByTarget(String actionType, String targetIdentifier, int limit);
}
