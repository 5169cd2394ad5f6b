package com.governance.core.model.statemachine;

import java.util.Locale;

/**
 * Direction of a lifecycle transition.
 */
public enum TransitionKind {
    FORWARD,
    BACKWARD,
    PAUSE,
    RESUME,
    TERMINATE;

    public static TransitionKind fromTag(String tag) {
        if (tag == null) {
            return FORWARD;
        }
        return valueOf(tag.trim().toUpperCase(Locale.ROOT));
    }
}
