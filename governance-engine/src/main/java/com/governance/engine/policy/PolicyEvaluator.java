package com.governance.engine.policy;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.governance.core.exception.GovernanceException;
import com.governance.core.exception.PersistenceException;
import com.governance.core.model.policy.DenialReason;
import com.governance.core.model.policy.ExecutionRecord;
import com.governance.core.model.policy.PolicyAction;
import com.governance.core.model.policy.PolicyDecision;
import com.governance.core.model.policy.PolicyEvaluationContext;
import com.governance.core.model.policy.RateWindow;
import com.governance.core.repository.ExecutionRecordRepository;
import com.governance.engine.metrics.GovernanceMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a governed action may run now.
 *
 * Checks, in order: policy exists, environment, approval, rate window, cooldown.
 * The first failing check decides. Evaluation only reads the audit trail;
 * recording the attempt is {@link PolicyGate}'s job.
 */
public class PolicyEvaluator {

    private static final Logger log = LoggerFactory.getLogger(PolicyEvaluator.class);

    static final Set<String> IMPLICIT_ENVIRONMENTS = Set.of("staging", "development");

    /** Enforcement data field holding the admission slot an allowed decision may claim. */
    public static final String ADMISSION_SEQUENCE = "admissionSequence";

    private final PolicyCatalog catalog;
    private final ExecutionRecordRepository records;
    private final Clock clock;
    private final GovernanceMetrics metrics;

    public PolicyEvaluator(PolicyCatalog catalog, ExecutionRecordRepository records,
                           Clock clock, GovernanceMetrics metrics) {
        this.catalog = catalog;
        this.records = records;
        this.clock = clock;
        this.metrics = metrics;
    }

    public PolicyCatalog catalog() {
        return catalog;
    }

    /**
     * @throws PersistenceException if the audit trail cannot be read; never an implicit allow
     */
    public PolicyDecision evaluate(PolicyEvaluationContext context) {
        PolicyDecision decision = decide(context);
        metrics.policyDecision(context.actionType(), decision);
        if (decision.allow()) {
            log.info("Policy {} allowed {} on {}", decision.policyName(), context.actionType(), context.targetIdentifier());
        } else {
            log.info("Policy denied {} on {}: {} ({})", context.actionType(), context.targetIdentifier(),
                decision.reasonCode(), decision.reason());
        }
        return decision;
    }

    private PolicyDecision decide(PolicyEvaluationContext context) {
        Optional<PolicyAction> found = catalog.find(context.actionType());
        if (found.isEmpty()) {
            return PolicyDecision.denied(DenialReason.NO_POLICY_DEFINED,
                "No policy defined for action type " + context.actionType(),
                null, "", IdempotencyKeys.hash(""), null, null);
        }

        PolicyAction policy = found.get();
        String key = IdempotencyKeys.generate(policy.idempotencyKeyTemplate(), context.actionContext());
        String keyHash = IdempotencyKeys.hash(key);
        ObjectNode data = JsonNodeFactory.instance.objectNode();
        data.put("catalogVersion", catalog.version());
        data.put("catalogHash", catalog.contentHash());

        String environment = normalize(context.deploymentEnv());
        data.put("environment", environment);
        if (!environmentPermitted(policy, environment)) {
            policy.allowedEnvironments().stream().sorted().forEach(data.putArray("allowedEnvironments")::add);
            return PolicyDecision.denied(DenialReason.ENVIRONMENT_NOT_PERMITTED,
                String.format("Environment %s is not permitted for %s",
                    environment == null ? "(unspecified)" : environment, policy.actionType()),
                null, key, keyHash, policy.actionType(), data);
        }

        if (policy.requiresApproval() && !context.hasApproval()) {
            return PolicyDecision.denied(DenialReason.APPROVAL_REQUIRED,
                "Action " + policy.actionType() + " requires human approval",
                null, key, keyHash, policy.actionType(), data);
        }
        if (context.hasApproval()) {
            data.put("approvalFingerprint", context.approvalFingerprint());
        }

        Instant now = clock.instant();
        try {
            // Read before the window so a concurrent admission either shows up in the window or takes this slot.
            long admissionSequence = records.countAllowed(policy.actionType(), context.targetIdentifier());
            data.put(ADMISSION_SEQUENCE, admissionSequence);

            if (policy.hasRateLimit()) {
                RateWindow window = policy.rateLimit();
                Instant windowStart = now.minus(window.window());
                long used = records.countAllowedSince(policy.actionType(), context.targetIdentifier(), windowStart);
                data.put("windowSeconds", window.windowSeconds());
                data.put("maxRunsPerWindow", window.maxRunsPerWindow());
                data.put("executionsInWindow", used);
                if (used >= window.maxRunsPerWindow()) {
                    Instant nextAllowedAt = records
                        .findOldestAllowedSince(policy.actionType(), context.targetIdentifier(), windowStart)
                        .map(oldest -> oldest.createdAt().plus(window.window()))
                        .orElse(now.plus(window.window()));
                    return PolicyDecision.denied(DenialReason.RATE_LIMIT_EXCEEDED,
                        String.format("Rate limit of %d per %ds reached for %s",
                            window.maxRunsPerWindow(), window.windowSeconds(), context.targetIdentifier()),
                        nextAllowedAt, key, keyHash, policy.actionType(), data);
                }
            }

            if (policy.hasCooldown()) {
                data.put("cooldownSeconds", policy.cooldownSeconds());
                Optional<ExecutionRecord> last = records.findLastAllowed(policy.actionType(), context.targetIdentifier());
                if (last.isPresent()) {
                    Instant cooledAt = last.get().createdAt().plus(policy.cooldown());
                    if (cooledAt.isAfter(now)) {
                        return PolicyDecision.denied(DenialReason.COOLDOWN_ACTIVE,
                            String.format("Cooldown of %ds active for %s", policy.cooldownSeconds(),
                                context.targetIdentifier()),
                            cooledAt, key, keyHash, policy.actionType(), data);
                    }
                }
            }
        } catch (GovernanceException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Audit trail unavailable while evaluating {}", context.actionType(), e);
            throw new PersistenceException("read execution history for " + context.actionType(), e);
        }

        return PolicyDecision.allowed("All policy checks passed", key, keyHash, policy.actionType(), data);
    }

    /**
     * An absent environment is permitted only for policies that allow a non-production environment.
     */
    static boolean environmentPermitted(PolicyAction policy, String environment) {
        if (environment == null) {
            return policy.allowedEnvironments().stream().anyMatch(IMPLICIT_ENVIRONMENTS::contains);
        }
        return policy.allowsEnvironment(environment);
    }

    private static String normalize(String environment) {
        if (environment == null || environment.isBlank()) {
            return null;
        }
        return environment.trim().toLowerCase(Locale.ROOT);
    }
}
