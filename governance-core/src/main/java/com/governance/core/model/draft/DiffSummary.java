package com.governance.core.model.draft;

import java.util.List;

/**
 * What a patch changed. Field names are sorted; items keep the order they were found in.
 */
public record DiffSummary(
    List<String> changedFields,
    List<String> addedItems,
    List<String> removedItems
) {
    public DiffSummary {
        changedFields = List.copyOf(changedFields);
        addedItems = List.copyOf(addedItems);
        removedItems = List.copyOf(removedItems);
    }
}
