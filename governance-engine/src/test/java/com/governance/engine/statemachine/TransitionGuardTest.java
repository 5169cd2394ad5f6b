package com.governance.engine.statemachine;

import com.governance.core.model.statemachine.Evidence;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TransitionGuardTest {

    private static TransitionGuard guard;

    @BeforeAll
    static void load() {
        guard = new TransitionGuard(new StateMachineSpecLoader().loadDefault());
    }

    @Test
    void evaluate_withAllRequiredEvidence_shouldAllow() {
        TransitionVerdict verdict = guard.evaluate("CREATED", "SPEC_READY",
            Evidence.of(Map.of("spec_complete", true, "draft_valid", true)));

        assertThat(verdict.allowed()).isTrue();
        assertThat(verdict.code()).isEqualTo(TransitionVerdict.Code.TRANSITION_ALLOWED);
        assertThat(verdict.transition().name()).isEqualTo("CREATED_TO_SPEC_READY");
    }

    @Test
    void evaluate_missingEvidence_shouldListWhatIsMissing() {
        TransitionVerdict verdict = guard.evaluate("CREATED", "SPEC_READY", Evidence.of(Map.of("spec_complete", true)));

        assertThat(verdict.allowed()).isFalse();
        assertThat(verdict.code()).isEqualTo(TransitionVerdict.Code.PRECONDITIONS_UNMET);
        assertThat(verdict.missingPreconditions()).containsExactly("draft_valid");
    }

    @Test
    void evaluate_unknownState() {
        assertThat(guard.evaluate("CREATED", "LIMBO", Evidence.none()).code())
            .isEqualTo(TransitionVerdict.Code.UNKNOWN_STATE);
        assertThat(guard.evaluate("LIMBO", "CREATED", Evidence.none()).code())
            .isEqualTo(TransitionVerdict.Code.UNKNOWN_STATE);
    }

    @Test
    void evaluate_fromTerminalState() {
        assertThat(guard.evaluate("DONE", "CREATED", Evidence.none()).code())
            .isEqualTo(TransitionVerdict.Code.TERMINAL_STATE);
    }

    @Test
    void evaluate_skippingStates_shouldBeRejected() {
        TransitionVerdict verdict = guard.evaluate("CREATED", "DONE", Evidence.of(Map.of("pr_merged", true)));

        assertThat(verdict.code()).isEqualTo(TransitionVerdict.Code.NOT_A_SUCCESSOR);
        assertThat(verdict.transition()).isNull();
    }

    @Test
    void evaluate_resumeFromHoldToCreated_shouldRequireApproval() {
        assertThat(guard.evaluate("HOLD", "CREATED", Evidence.none()).code())
            .isEqualTo(TransitionVerdict.Code.PRECONDITIONS_UNMET);

        TransitionVerdict verdict = guard.evaluate("HOLD", "CREATED", Evidence.of(Map.of("human_approval", true)));

        assertThat(verdict.allowed()).isTrue();
        assertThat(verdict.transition().name()).isEqualTo("HOLD_TO_CREATED");
    }

    @Test
    void evaluate_successorWithoutTransitionDefinition() {
        TransitionGuard partial = new TransitionGuard(
            new StateMachineSpecLoader().load("classpath:fixtures/state-machine/successor-without-transition"));

        assertThat(partial.evaluate("OPEN", "REVIEW", Evidence.none()).code())
            .isEqualTo(TransitionVerdict.Code.TRANSITION_UNSPECIFIED);
    }

    @Test
    void evaluateAutomatic_onDeclaredTrigger_shouldAllow() {
        TransitionVerdict verdict = guard.evaluateAutomatic("MERGE_READY", "DONE", "pr_merged",
            Evidence.of(Map.of("pr_merged", true)));

        assertThat(verdict.allowed()).isTrue();
    }

    @Test
    void evaluateAutomatic_manualTransition_shouldBeRejected() {
        TransitionVerdict verdict = guard.evaluateAutomatic("VERIFIED", "MERGE_READY", "review_approved",
            Evidence.of(Map.of("review_approved", true, "ci_passed", true)));

        assertThat(verdict.allowed()).isFalse();
        assertThat(verdict.code()).isEqualTo(TransitionVerdict.Code.AUTO_TRANSITION_NOT_PERMITTED);
    }

    @Test
    void evaluateAutomatic_structuralRejectionWins() {
        assertThat(guard.evaluateAutomatic("MERGE_READY", "DONE", "pr_merged", Evidence.none()).code())
            .isEqualTo(TransitionVerdict.Code.PRECONDITIONS_UNMET);
    }
}
