package com.governance.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.governance.core.model.draft.IssueDraft;
import com.governance.core.model.draft.PatchResult;
import com.governance.core.model.draft.ValidationError;
import com.governance.engine.draft.IssueDraftValidator;
import com.governance.engine.draft.PatchApplier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Draft editing: validation, content hashes and patches. Nothing is stored; the caller keeps the draft.
 */
@RestController
@RequestMapping("/api/v1/drafts")
public class DraftController {

    private final PatchApplier patchApplier;

    public DraftController(PatchApplier patchApplier) {
        this.patchApplier = patchApplier;
    }

    @PostMapping("/validate")
    public ResponseEntity<ValidationResponse> validate(@RequestBody IssueDraft draft) {
        List<ValidationError> errors = IssueDraftValidator.validate(draft);
        return ResponseEntity.ok(new ValidationResponse(errors.isEmpty(), PatchApplier.hash(draft), errors));
    }

    /**
     * Apply a patch. A stale {@code expectedHash} is a conflict; any other rejection is unprocessable.
     */
    @PostMapping("/patch")
    public ResponseEntity<PatchResult> patch(@RequestBody PatchRequest request) {
        if (request.draft() == null) {
            throw new IllegalArgumentException("draft is required");
        }
        PatchResult result = patchApplier.applyPatch(request.draft(), request.patch(), request.expectedHash());
        if (result.success()) {
            return ResponseEntity.ok(result);
        }
        HttpStatus status = PatchResult.DRAFT_HASH_MISMATCH.equals(result.errorCode())
            ? HttpStatus.CONFLICT
            : HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(result);
    }

    // ========== DTOs ==========

    public record PatchRequest(IssueDraft draft, JsonNode patch, String expectedHash) {}

    public record ValidationResponse(boolean valid, String hash, List<ValidationError> errors) {}
}
