package com.governance.engine.policy;

import com.governance.core.model.policy.PolicyAction;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable set of action policies, keyed by action type.
 */
public final class PolicyCatalog {

    private final String version;
    private final String contentHash;
    private final Map<String, PolicyAction> actions;

    public PolicyCatalog(String version, String contentHash, Map<String, PolicyAction> actions) {
        this.version = version;
        this.contentHash = contentHash;
        this.actions = Map.copyOf(actions);
    }

    public Optional<PolicyAction> find(String actionType) {
        return Optional.ofNullable(actionType).map(actions::get);
    }

    public Collection<PolicyAction> actions() {
        return actions.values();
    }

    public String version() {
        return version;
    }

    /**
     * SHA-256 of the catalog content, recorded with decisions so audits can tell
     * which rules were in force.
     */
    public String contentHash() {
        return contentHash;
    }
}
