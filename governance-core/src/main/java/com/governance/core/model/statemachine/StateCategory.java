package com.governance.core.model.statemachine;

import java.util.Locale;

/**
 * Coarse grouping of lifecycle states.
 */
public enum StateCategory {
    INITIAL,
    READY,
    IN_PROGRESS,
    VERIFICATION,
    MERGE_PENDING,
    TERMINAL,
    SPECIAL_HOLD;

    /**
     * Parse the kebab-case form used in specification files ({@code special-hold}).
     */
    public static StateCategory fromTag(String tag) {
        if (tag == null) {
            throw new IllegalArgumentException("State category is required");
        }
        return valueOf(tag.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
