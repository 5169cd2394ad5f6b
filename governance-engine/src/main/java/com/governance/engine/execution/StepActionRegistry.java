package com.governance.engine.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Action name to handler lookup.
 */
public class StepActionRegistry {

    private static final Logger log = LoggerFactory.getLogger(StepActionRegistry.class);

    /** Returns the resolved params unchanged. */
    public static final String ECHO = "core.echo";

    private final Map<String, StepActionHandler> handlers = new ConcurrentHashMap<>();

    public static StepActionRegistry withBuiltins() {
        StepActionRegistry registry = new StepActionRegistry();
        registry.register(ECHO, StepActionContext::getParams);
        return registry;
    }

    public StepActionRegistry register(String action, StepActionHandler handler) {
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("Action name is required");
        }
        StepActionHandler previous = handlers.put(action, handler);
        if (previous != null) {
            log.warn("Replaced handler for action {}", action);
        } else {
            log.debug("Registered handler for action {}", action);
        }
        return this;
    }

    public Optional<StepActionHandler> find(String action) {
        return Optional.ofNullable(handlers.get(action));
    }

    public Set<String> actions() {
        return new TreeSet<>(handlers.keySet());
    }
}
