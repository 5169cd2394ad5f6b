package com.governance.core.model.statemachine;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Known evidence and precondition tags.
 * Tags outside this set resolve to {@link #UNRECOGNIZED} and are matched by their raw name.
 */
public enum EvidenceKind {
    DRAFT_VALID("draft_valid"),
    SPEC_COMPLETE("spec_complete"),
    BRANCH_CREATED("branch_created"),
    PR_OPENED("pr_opened"),
    CI_PASSED("ci_passed"),
    REVIEW_APPROVED("review_approved"),
    VERIFICATION_PASSED("verification_passed"),
    PR_MERGED("pr_merged"),
    DEPLOYMENT_OBSERVED("deployment_observed"),
    HOLD_REASON_RECORDED("hold_reason_recorded"),
    HUMAN_APPROVAL("human_approval"),
    KILL_REASON_RECORDED("kill_reason_recorded"),
    UNRECOGNIZED("unrecognized");

    private static final Map<String, EvidenceKind> BY_TAG = Arrays.stream(values())
        .filter(kind -> kind != UNRECOGNIZED)
        .collect(Collectors.toUnmodifiableMap(EvidenceKind::tag, Function.identity()));

    private final String tag;

    EvidenceKind(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static EvidenceKind fromTag(String tag) {
        if (tag == null) {
            return UNRECOGNIZED;
        }
        return BY_TAG.getOrDefault(tag.trim(), UNRECOGNIZED);
    }

    public boolean isRecognized() {
        return this != UNRECOGNIZED;
    }
}
