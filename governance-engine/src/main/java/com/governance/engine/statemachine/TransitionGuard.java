package com.governance.engine.statemachine;

import com.governance.core.model.statemachine.Evidence;
import com.governance.core.model.statemachine.PreconditionResult;
import com.governance.core.model.statemachine.StateDefinition;
import com.governance.core.model.statemachine.TransitionDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Answers "may this item move from A to B with this evidence?" in one call,
 * with a stable reason code when the answer is no.
 */
public class TransitionGuard {

    private static final Logger log = LoggerFactory.getLogger(TransitionGuard.class);

    private final StateMachineSpec spec;

    public TransitionGuard(StateMachineSpec spec) {
        this.spec = spec;
    }

    public StateMachineSpec spec() {
        return spec;
    }

    public TransitionVerdict evaluate(String from, String to, Evidence evidence) {
        Optional<StateDefinition> source = spec.findState(from);
        if (source.isEmpty() || spec.findState(to).isEmpty()) {
            return TransitionVerdict.reject(TransitionVerdict.Code.UNKNOWN_STATE,
                String.format("Unknown state in transition %s -> %s", from, to), null, List.of());
        }
        if (source.get().terminal()) {
            return TransitionVerdict.reject(TransitionVerdict.Code.TERMINAL_STATE,
                String.format("State %s is terminal", from), null, List.of());
        }
        if (!spec.isTransitionAllowed(from, to)) {
            return TransitionVerdict.reject(TransitionVerdict.Code.NOT_A_SUCCESSOR,
                String.format("%s is not a successor of %s", to, from), null, List.of());
        }

        Optional<TransitionDefinition> transition = spec.getTransition(from, to);
        if (transition.isEmpty()) {
            return TransitionVerdict.reject(TransitionVerdict.Code.TRANSITION_UNSPECIFIED,
                String.format("No transition defined for %s -> %s", from, to), null, List.of());
        }

        PreconditionResult preconditions = spec.checkPreconditions(transition.get(), evidence);
        if (!preconditions.met()) {
            log.debug("Transition {} blocked, missing {}", transition.get().name(), preconditions.missing());
            return TransitionVerdict.reject(TransitionVerdict.Code.PRECONDITIONS_UNMET,
                String.format("Missing required evidence for %s: %s", transition.get().name(), preconditions.missing()),
                transition.get(), preconditions.missing());
        }
        return TransitionVerdict.allow(transition.get());
    }

    /**
     * As {@link #evaluate}, and additionally the transition must be automatic and triggered
     * by the named evidence.
     */
    public TransitionVerdict evaluateAutomatic(String from, String to, String trigger, Evidence evidence) {
        TransitionVerdict verdict = evaluate(from, to, evidence);
        if (!verdict.allowed()) {
            return verdict;
        }
        if (!verdict.transition().isTriggeredBy(trigger)) {
            return TransitionVerdict.reject(TransitionVerdict.Code.AUTO_TRANSITION_NOT_PERMITTED,
                String.format("Transition %s does not fire automatically on %s", verdict.transition().name(), trigger),
                verdict.transition(), List.of());
        }
        return verdict;
    }
}
