package com.governance.core.model.statemachine;

import java.util.Locale;

/**
 * Where an external status signal was read from. Each source has its own lookup table.
 */
public enum ExternalSource {
    PROJECT_STATUS,
    LABEL,
    PR_STATUS;

    public static ExternalSource fromTag(String tag) {
        return valueOf(tag.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
