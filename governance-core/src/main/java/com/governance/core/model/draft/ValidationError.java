package com.governance.core.model.draft;

/**
 * A single problem found in a patch or draft, addressed by JSON-pointer-like path.
 */
public record ValidationError(String code, String path, String message) {
}
