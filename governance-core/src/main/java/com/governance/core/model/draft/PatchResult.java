package com.governance.core.model.draft;

import java.util.List;

/**
 * Outcome of applying a patch. A failed result carries no draft: patches are all-or-nothing.
 */
public record PatchResult(
    boolean success,
    IssueDraft draft,
    String beforeHash,
    String afterHash,
    String patchHash,
    DiffSummary diffSummary,
    String errorCode,
    String message,
    List<ValidationError> errors
) {
    public static final String PATCH_FIELD_NOT_ALLOWED = "PATCH_FIELD_NOT_ALLOWED";
    public static final String PATCH_INVALID_VALUE = "PATCH_INVALID_VALUE";
    public static final String PATCH_INDEX_OUT_OF_RANGE = "PATCH_INDEX_OUT_OF_RANGE";
    public static final String DRAFT_INVALID = "DRAFT_INVALID";
    public static final String DRAFT_HASH_MISMATCH = "DRAFT_HASH_MISMATCH";

    public PatchResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static PatchResult applied(IssueDraft draft, String beforeHash, String afterHash,
                                      String patchHash, DiffSummary diffSummary) {
        return new PatchResult(true, draft, beforeHash, afterHash, patchHash, diffSummary,
            null, null, List.of());
    }

    public static PatchResult rejected(String errorCode, String message, List<ValidationError> errors) {
        return new PatchResult(false, null, null, null, null, null, errorCode, message, errors);
    }
}
