package com.governance.core.model.draft;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Structured draft of a work item, edited through patches before it is published.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IssueDraft(
    String issueDraftVersion,
    String title,
    String body,
    String type,
    String canonicalId,
    List<String> labels,
    List<String> dependsOn,
    String priority,
    Kpi kpi,
    List<String> acceptanceCriteria,
    Verify verify,
    Guards guards
) {
    public static final String CURRENT_VERSION = "1.0";

    public IssueDraft {
        labels = labels == null ? List.of() : List.copyOf(labels);
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        acceptanceCriteria = acceptanceCriteria == null ? List.of() : List.copyOf(acceptanceCriteria);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Kpi(Double dcu, String intent) {
    }

    public record Verify(List<String> commands, List<String> expected) {
        public Verify {
            commands = commands == null ? List.of() : List.copyOf(commands);
            expected = expected == null ? List.of() : List.copyOf(expected);
        }
    }

    public record Guards(String env, Boolean prodBlocked) {
    }
}
