package com.governance.core.model.statemachine;

import java.util.Locale;

public enum SideEffectKind {
    LABEL,
    COMMENT,
    TIMELINE_EVENT,
    NOTIFICATION,
    UNRECOGNIZED;

    public static SideEffectKind fromTag(String tag) {
        if (tag == null) {
            return UNRECOGNIZED;
        }
        String normalized = tag.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (SideEffectKind kind : values()) {
            if (kind.name().equals(normalized)) {
                return kind;
            }
        }
        return UNRECOGNIZED;
    }
}
