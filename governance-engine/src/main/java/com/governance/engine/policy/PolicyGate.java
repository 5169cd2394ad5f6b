package com.governance.engine.policy;

import com.fasterxml.jackson.databind.JsonNode;
import com.governance.core.exception.GovernanceException;
import com.governance.core.exception.PersistenceException;
import com.governance.core.model.policy.Decision;
import com.governance.core.model.policy.DenialReason;
import com.governance.core.model.policy.ExecutionRecord;
import com.governance.core.model.policy.PolicyDecision;
import com.governance.core.model.policy.PolicyEvaluationContext;
import com.governance.core.repository.ExecutionRecordRepository;
import com.governance.engine.logging.LoggingContext;
import com.governance.engine.metrics.GovernanceMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Evaluates a governed action and appends the attempt to the audit trail.
 *
 * Admission is first-writer-wins: an allowed record claims the admission slot the evaluator
 * counted for its action and target, and the store rejects a second claim of the same slot.
 * The loser, like a replay of an already recorded requestId, gets {@link GateResult.Outcome#DUPLICATE}.
 */
public class PolicyGate {

    private static final Logger log = LoggerFactory.getLogger(PolicyGate.class);

    private final PolicyEvaluator evaluator;
    private final ExecutionRecordRepository records;
    private final Clock clock;
    private final GovernanceMetrics metrics;

    public PolicyGate(PolicyEvaluator evaluator, ExecutionRecordRepository records,
                      Clock clock, GovernanceMetrics metrics) {
        this.evaluator = evaluator;
        this.records = records;
        this.clock = clock;
        this.metrics = metrics;
    }

    public PolicyEvaluator evaluator() {
        return evaluator;
    }

    /**
     * @throws PersistenceException if the audit row cannot be written; the action must not run
     */
    public GateResult evaluateAndRecord(PolicyEvaluationContext context) {
        try (var ctx = LoggingContext.forPolicy(context.actionType(), context.requestId())) {
            Optional<ExecutionRecord> replay = findByRequestId(context.requestId());
            if (replay.isPresent()) {
                log.info("Request {} already processed with decision {}", context.requestId(), replay.get().decision());
                metrics.duplicateAdmission(context.actionType());
                return new GateResult(GateResult.Outcome.DUPLICATE, toDecision(replay.get()), replay.get());
            }

            PolicyDecision decision = evaluator.evaluate(context);
            String fingerprint = IdempotencyKeys.actionFingerprint(
                context.actionType(), context.targetIdentifier(), context.actionContext());

            Long admissionSequence = decision.allow() ? admissionSequence(decision) : null;
            ExecutionRecord record;
            boolean inserted;
            try {
                record = ExecutionRecord.of(context, decision, fingerprint, admissionSequence, clock.instant());
                inserted = records.insertIfAbsent(record);
            } catch (GovernanceException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Failed to record decision for {}", context.actionType(), e);
                throw new PersistenceException("record execution for " + context.actionType(), e);
            }

            if (!inserted) {
                log.info("Action {} on {} already processed or pending (key hash {})",
                    context.actionType(), context.targetIdentifier(), decision.idempotencyKeyHash());
                metrics.duplicateAdmission(context.actionType());
                return new GateResult(GateResult.Outcome.DUPLICATE, decision,
                    findByRequestId(context.requestId()).orElse(null));
            }
            return new GateResult(GateResult.Outcome.RECORDED, decision, record);
        }
    }

    /**
     * Most recent audit rows for an action on a target.
     */
    public List<ExecutionRecord> history(String actionType, String targetIdentifier, int limit) {
        return records.findByTarget(actionType, targetIdentifier, limit);
    }

    private Optional<ExecutionRecord> findByRequestId(String requestId) {
        try {
            return records.findByRequestId(requestId);
        } catch (GovernanceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PersistenceException("look up request " + requestId, e);
        }
    }

    private static long admissionSequence(PolicyDecision decision) {
        JsonNode sequence = decision.enforcementData().get(PolicyEvaluator.ADMISSION_SEQUENCE);
        if (sequence == null || !sequence.canConvertToLong()) {
            throw new IllegalStateException("Allowed decision for " + decision.policyName() + " carries no admission sequence");
        }
        return sequence.asLong();
    }

    private static PolicyDecision toDecision(ExecutionRecord record) {
        return new PolicyDecision(
            record.decision(),
            record.reasonCode(),
            record.reason(),
            record.nextAllowedAt(),
            record.decision() == Decision.DENIED && record.reasonCode() == DenialReason.APPROVAL_REQUIRED,
            record.idempotencyKey(),
            record.idempotencyKeyHash(),
            record.policyName(),
            record.enforcementData()
        );
    }
}
