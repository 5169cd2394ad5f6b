package com.governance.core.model.policy;

public enum Decision {
    ALLOWED,
    DENIED
}
