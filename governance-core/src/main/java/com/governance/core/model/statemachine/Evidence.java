package com.governance.core.model.statemachine;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evidence supplied for a transition: tag to boolean.
 * Absent tags count as not present. Unrecognized tags are kept under their raw name.
 */
public final class Evidence {

    private static final Evidence NONE = new Evidence(Map.of());

    private final Map<String, Boolean> tags;

    private Evidence(Map<String, Boolean> tags) {
        this.tags = tags;
    }

    public static Evidence none() {
        return NONE;
    }

    public static Evidence of(Map<String, Boolean> tags) {
        if (tags == null || tags.isEmpty()) {
            return NONE;
        }
        Map<String, Boolean> copy = new LinkedHashMap<>();
        tags.forEach((tag, value) -> {
            if (tag != null) {
                copy.put(tag.trim(), Boolean.TRUE.equals(value));
            }
        });
        return new Evidence(Map.copyOf(copy));
    }

    public boolean isPresent(String tag) {
        return Boolean.TRUE.equals(tags.get(tag));
    }

    public boolean isPresent(EvidenceKind kind) {
        return kind.isRecognized() && isPresent(kind.tag());
    }

    public List<String> unrecognizedTags() {
        return tags.keySet().stream()
            .filter(tag -> !EvidenceKind.fromTag(tag).isRecognized())
            .sorted()
            .toList();
    }

    public Map<String, Boolean> asMap() {
        return tags;
    }

    @Override
    public String toString() {
        return "Evidence" + tags;
    }
}
