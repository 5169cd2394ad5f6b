package com.governance.engine.execution;

import com.governance.core.exception.NotFoundException;
import com.governance.core.model.run.PlaybookDefinition;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable set of playbooks known to this process.
 */
public class PlaybookRegistry {

    private final Map<String, PlaybookDefinition> playbooks;

    public PlaybookRegistry(Map<String, PlaybookDefinition> playbooks) {
        this.playbooks = Collections.unmodifiableMap(new TreeMap<>(playbooks));
    }

    public static PlaybookRegistry empty() {
        return new PlaybookRegistry(Map.of());
    }

    public Optional<PlaybookDefinition> find(String playbookId) {
        return Optional.ofNullable(playbooks.get(playbookId));
    }

    public PlaybookDefinition get(String playbookId) {
        return find(playbookId).orElseThrow(() -> new NotFoundException("Playbook", playbookId));
    }

    public Collection<PlaybookDefinition> all() {
        return playbooks.values();
    }
}
