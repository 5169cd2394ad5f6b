package com.governance.core.model.statemachine;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class EvidenceTest {

    @Test
    void isPresent_onlyTrueValuesCount() {
        Map<String, Boolean> raw = new HashMap<>();
        raw.put("ci_passed", true);
        raw.put("review_approved", false);
        raw.put("pr_opened", null);

        Evidence evidence = Evidence.of(raw);

        assertThat(evidence.isPresent(EvidenceKind.CI_PASSED)).isTrue();
        assertThat(evidence.isPresent(EvidenceKind.REVIEW_APPROVED)).isFalse();
        assertThat(evidence.isPresent(EvidenceKind.PR_OPENED)).isFalse();
        assertThat(evidence.isPresent("spec_complete")).isFalse();
    }

    @Test
    void unrecognizedTags_areKeptUnderRawName() {
        Evidence evidence = Evidence.of(Map.of("security_scan_clean", true, "ci_passed", true));

        assertThat(evidence.unrecognizedTags()).containsExactly("security_scan_clean");
        assertThat(evidence.isPresent("security_scan_clean")).isTrue();
        assertThat(EvidenceKind.fromTag("security_scan_clean")).isEqualTo(EvidenceKind.UNRECOGNIZED);
    }

    @Test
    void stateCategory_shouldParseKebabCase() {
        assertThat(StateCategory.fromTag("special-hold")).isEqualTo(StateCategory.SPECIAL_HOLD);
        assertThat(StateCategory.fromTag("in-progress")).isEqualTo(StateCategory.IN_PROGRESS);
    }
}
