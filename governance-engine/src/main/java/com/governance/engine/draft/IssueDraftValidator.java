package com.governance.engine.draft;

import com.governance.core.model.draft.IssueDraft;
import com.governance.core.model.draft.ValidationError;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Structural checks on an {@link IssueDraft}. Every string and list is bounded.
 */
public final class IssueDraftValidator {

    public static final String REQUIRED = "REQUIRED";
    public static final String TOO_SHORT = "TOO_SHORT";
    public static final String TOO_LONG = "TOO_LONG";
    public static final String TOO_FEW = "TOO_FEW";
    public static final String TOO_MANY = "TOO_MANY";
    public static final String INVALID_FORMAT = "INVALID_FORMAT";
    public static final String INVALID_VALUE = "INVALID_VALUE";

    static final Pattern CANONICAL_ID = Pattern.compile("^(I\\d{3}|E\\d+\\.\\d+|CID:(I\\d{3}|E\\d+\\.\\d+|TBD))$");

    private static final Set<String> TYPES = Set.of("epic", "issue");
    private static final Set<String> PRIORITIES = Set.of("P0", "P1", "P2");
    private static final Set<String> GUARD_ENVIRONMENTS = Set.of("staging", "development");
    private static final Set<Double> DCU_VALUES = Set.of(0.5, 1.0, 2.0);

    private IssueDraftValidator() {
    }

    /**
     * @return problems sorted by path; empty when the draft is valid
     */
    public static List<ValidationError> validate(IssueDraft draft) {
        List<ValidationError> errors = new ArrayList<>();

        if (!IssueDraft.CURRENT_VERSION.equals(draft.issueDraftVersion())) {
            errors.add(new ValidationError(INVALID_VALUE, "/issueDraftVersion",
                "Unsupported draft version: " + draft.issueDraftVersion()));
        }
        string(errors, "/title", draft.title(), 1, 200);
        string(errors, "/body", draft.body(), 10, 10_000);
        oneOf(errors, "/type", draft.type(), TYPES);
        canonicalId(errors, "/canonicalId", draft.canonicalId());
        oneOf(errors, "/priority", draft.priority(), PRIORITIES);

        count(errors, "/labels", draft.labels(), 0, 50);
        for (int i = 0; i < draft.labels().size(); i++) {
            string(errors, "/labels/" + i, draft.labels().get(i), 1, 100);
        }
        count(errors, "/dependsOn", draft.dependsOn(), 0, 20);
        for (int i = 0; i < draft.dependsOn().size(); i++) {
            canonicalId(errors, "/dependsOn/" + i, draft.dependsOn().get(i));
        }
        count(errors, "/acceptanceCriteria", draft.acceptanceCriteria(), 1, 20);
        for (int i = 0; i < draft.acceptanceCriteria().size(); i++) {
            string(errors, "/acceptanceCriteria/" + i, draft.acceptanceCriteria().get(i), 1, 1000);
        }

        if (draft.kpi() != null) {
            if (draft.kpi().dcu() != null && !DCU_VALUES.contains(draft.kpi().dcu())) {
                errors.add(new ValidationError(INVALID_VALUE, "/kpi/dcu", "dcu must be one of 0.5, 1, 2"));
            }
            if (draft.kpi().intent() != null && draft.kpi().intent().length() > 200) {
                errors.add(new ValidationError(TOO_LONG, "/kpi/intent", "must not exceed 200 characters"));
            }
        }

        if (draft.verify() == null) {
            errors.add(new ValidationError(REQUIRED, "/verify", "verify is required"));
        } else {
            stringList(errors, "/verify/commands", draft.verify().commands());
            stringList(errors, "/verify/expected", draft.verify().expected());
        }

        if (draft.guards() == null) {
            errors.add(new ValidationError(REQUIRED, "/guards", "guards is required"));
        } else {
            oneOf(errors, "/guards/env", draft.guards().env(), GUARD_ENVIRONMENTS);
            if (!Boolean.TRUE.equals(draft.guards().prodBlocked())) {
                errors.add(new ValidationError(INVALID_VALUE, "/guards/prodBlocked", "prodBlocked must be true"));
            }
        }

        errors.sort(Comparator.comparing(ValidationError::path));
        return errors;
    }

    private static void stringList(List<ValidationError> errors, String path, List<String> values) {
        count(errors, path, values, 1, 10);
        for (int i = 0; i < values.size(); i++) {
            string(errors, path + "/" + i, values.get(i), 1, 500);
        }
    }

    private static void string(List<ValidationError> errors, String path, String value, int min, int max) {
        if (value == null) {
            errors.add(new ValidationError(REQUIRED, path, "value is required"));
        } else if (value.length() < min) {
            errors.add(new ValidationError(min == 1 ? REQUIRED : TOO_SHORT, path,
                "must be at least " + min + " characters"));
        } else if (value.length() > max) {
            errors.add(new ValidationError(TOO_LONG, path, "must not exceed " + max + " characters"));
        }
    }

    private static void count(List<ValidationError> errors, String path, List<?> values, int min, int max) {
        if (values.size() < min) {
            errors.add(new ValidationError(TOO_FEW, path, "at least " + min + " item(s) required"));
        } else if (values.size() > max) {
            errors.add(new ValidationError(TOO_MANY, path, "at most " + max + " items allowed"));
        }
    }

    private static void oneOf(List<ValidationError> errors, String path, String value, Set<String> allowed) {
        if (value == null) {
            errors.add(new ValidationError(REQUIRED, path, "value is required"));
        } else if (!allowed.contains(value)) {
            errors.add(new ValidationError(INVALID_VALUE, path, "must be one of " + allowed.stream().sorted().toList()));
        }
    }

    private static void canonicalId(List<ValidationError> errors, String path, String value) {
        if (value == null || value.isEmpty()) {
            errors.add(new ValidationError(REQUIRED, path, "canonical id is required"));
        } else if (value.length() > 50) {
            errors.add(new ValidationError(TOO_LONG, path, "must not exceed 50 characters"));
        } else if (!CANONICAL_ID.matcher(value).matches()) {
            errors.add(new ValidationError(INVALID_FORMAT, path,
                "must look like I123, E1.2 or CID:<I123|E1.2|TBD>"));
        }
    }
}
