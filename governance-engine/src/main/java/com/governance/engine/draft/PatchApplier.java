package com.governance.engine.draft;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.governance.core.model.draft.DiffSummary;
import com.governance.core.model.draft.IssueDraft;
import com.governance.core.model.draft.PatchResult;
import com.governance.core.model.draft.ValidationError;
import com.governance.engine.json.CanonicalJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Applies field-level patches to issue drafts.
 *
 * A patch is all-or-nothing and a pure function of (draft, patch): the same patch on the same
 * draft always yields the same {@code afterHash}. Labels and dependencies are deduplicated and
 * sorted after every patch; acceptance criteria and verify lists keep their order.
 *
 * <pre>
 * { "title": "New title",
 *   "labels": { "op": "append", "values": ["prio:high"] },
 *   "acceptanceCriteria": { "op": "replaceByIndex", "index": 0, "value": "Tests pass" } }
 * </pre>
 */
public class PatchApplier {

    private static final Logger log = LoggerFactory.getLogger(PatchApplier.class);

    public static final Set<String> PATCHABLE_FIELDS = Set.of(
        "title", "body", "type", "canonicalId", "labels", "dependsOn", "priority",
        "kpi", "acceptanceCriteria", "verify", "guards");

    private static final Set<String> TEXT_FIELDS = Set.of("title", "body", "type", "canonicalId", "priority");
    private static final Set<String> LIST_FIELDS = Set.of("labels", "dependsOn", "acceptanceCriteria");

    private final ObjectMapper mapper = CanonicalJson.mapper();

    public static String hash(IssueDraft draft) {
        return CanonicalJson.hash(draft);
    }

    /**
     * Applies the patch only if the draft still has the hash the caller last saw.
     */
    public PatchResult applyPatch(IssueDraft draft, JsonNode patch, String expectedHash) {
        String currentHash = hash(draft);
        if (expectedHash != null && !expectedHash.equals(currentHash)) {
            log.info("Rejected patch: draft hash {} does not match expected {}", currentHash, expectedHash);
            return PatchResult.rejected(PatchResult.DRAFT_HASH_MISMATCH,
                "Draft changed since it was read (expected " + expectedHash + ", found " + currentHash + ")",
                List.of());
        }
        return applyPatch(draft, patch);
    }

    public PatchResult applyPatch(IssueDraft draft, JsonNode patch) {
        if (patch == null || !patch.isObject()) {
            return reject(PatchResult.PATCH_INVALID_VALUE, "", "Patch must be a JSON object");
        }

        List<ValidationError> notAllowed = new ArrayList<>();
        patch.fieldNames().forEachRemaining(field -> {
            if (!PATCHABLE_FIELDS.contains(field)) {
                notAllowed.add(new ValidationError(PatchResult.PATCH_FIELD_NOT_ALLOWED, "/" + field,
                    "Field is not patchable: " + field));
            }
        });
        if (!notAllowed.isEmpty()) {
            return PatchResult.rejected(PatchResult.PATCH_FIELD_NOT_ALLOWED,
                "Patch contains " + notAllowed.size() + " field(s) that are not patchable", notAllowed);
        }

        ObjectNode before = mapper.valueToTree(draft);
        ObjectNode working = before.deepCopy();
        try {
            Iterator<Map.Entry<String, JsonNode>> fields = patch.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                apply(working, field.getKey(), field.getValue());
            }
        } catch (PatchRejected e) {
            return reject(e.code, e.path, e.getMessage());
        }

        IssueDraft patched;
        try {
            patched = mapper.treeToValue(working, IssueDraft.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return reject(PatchResult.PATCH_INVALID_VALUE, "", "Patched draft cannot be read: " + e.getMessage());
        }

        IssueDraft normalized = normalize(patched);
        List<ValidationError> errors = IssueDraftValidator.validate(normalized);
        if (!errors.isEmpty()) {
            log.debug("Patched draft {} is invalid: {}", normalized.canonicalId(), errors);
            return PatchResult.rejected(PatchResult.DRAFT_INVALID,
                "Patched draft fails validation with " + errors.size() + " problem(s)", errors);
        }

        String beforeHash = hash(draft);
        String afterHash = hash(normalized);
        DiffSummary diff = diff(before, mapper.valueToTree(normalized));
        log.info("Applied patch to draft {}: changed {}", normalized.canonicalId(), diff.changedFields());
        return PatchResult.applied(normalized, beforeHash, afterHash, CanonicalJson.hash(patch), diff);
    }

    /**
     * Trims text, deduplicates and sorts labels and dependencies.
     */
    public static IssueDraft normalize(IssueDraft draft) {
        IssueDraft.Verify verify = draft.verify() == null ? null
            : new IssueDraft.Verify(trimAll(draft.verify().commands()), trimAll(draft.verify().expected()));
        return new IssueDraft(
            draft.issueDraftVersion(),
            trim(draft.title()),
            trim(draft.body()),
            trim(draft.type()),
            trim(draft.canonicalId()),
            sortedUnique(draft.labels()),
            sortedUnique(draft.dependsOn()),
            trim(draft.priority()),
            draft.kpi(),
            trimAll(draft.acceptanceCriteria()),
            verify,
            draft.guards()
        );
    }

    private void apply(ObjectNode working, String field, JsonNode value) {
        String path = "/" + field;
        if (TEXT_FIELDS.contains(field)) {
            if (!value.isTextual()) {
                throw new PatchRejected(PatchResult.PATCH_INVALID_VALUE, path, field + " must be a string");
            }
            working.set(field, value);
        } else if (LIST_FIELDS.contains(field)) {
            working.set(field, applyList(field, working.path(field), value));
        } else if ("kpi".equals(field) && value.isNull()) {
            working.remove(field);
        } else {
            if (!value.isObject()) {
                throw new PatchRejected(PatchResult.PATCH_INVALID_VALUE, path, field + " must be an object");
            }
            working.set(field, value);
        }
    }

    private ArrayNode applyList(String field, JsonNode current, JsonNode value) {
        String path = "/" + field;
        if (value.isArray()) {
            return toArray(strings(path, value));
        }
        if (!value.isObject() || !value.path("op").isTextual()) {
            throw new PatchRejected(PatchResult.PATCH_INVALID_VALUE, path,
                field + " must be an array or an operation object");
        }

        List<String> items = new ArrayList<>();
        current.forEach(item -> items.add(item.asText()));
        String op = value.get("op").textValue();
        switch (op) {
            case "append" -> items.addAll(strings(path + "/values", value.path("values")));
            case "remove" -> items.removeAll(new LinkedHashSet<>(strings(path + "/values", value.path("values"))));
            case "replaceAll" -> {
                items.clear();
                items.addAll(strings(path + "/values", value.path("values")));
            }
            case "replaceByIndex" -> {
                JsonNode index = value.get("index");
                JsonNode replacement = value.get("value");
                if (index == null || !index.isIntegralNumber()) {
                    throw new PatchRejected(PatchResult.PATCH_INVALID_VALUE, path + "/index", "index must be an integer");
                }
                if (replacement == null || !replacement.isTextual()) {
                    throw new PatchRejected(PatchResult.PATCH_INVALID_VALUE, path + "/value", "value must be a string");
                }
                int at = index.asInt();
                if (at < 0 || at >= items.size()) {
                    throw new PatchRejected(PatchResult.PATCH_INDEX_OUT_OF_RANGE, path + "/index",
                        "index " + at + " is out of range for " + field + " of size " + items.size());
                }
                items.set(at, replacement.textValue());
            }
            default -> throw new PatchRejected(PatchResult.PATCH_INVALID_VALUE, path + "/op", "unknown operation: " + op);
        }
        return toArray(items);
    }

    private static List<String> strings(String path, JsonNode node) {
        if (!node.isArray()) {
            throw new PatchRejected(PatchResult.PATCH_INVALID_VALUE, path, "expected an array of strings");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isTextual()) {
                throw new PatchRejected(PatchResult.PATCH_INVALID_VALUE, path, "expected an array of strings");
            }
            values.add(item.textValue());
        }
        return values;
    }

    private ArrayNode toArray(List<String> values) {
        ArrayNode array = mapper.createArrayNode();
        values.forEach(array::add);
        return array;
    }

    private static DiffSummary diff(JsonNode before, JsonNode after) {
        List<String> changed = new ArrayList<>();
        List<String> added = new ArrayList<>();
        List<String> removed = new ArrayList<>();
        for (String field : new TreeSet<>(PATCHABLE_FIELDS)) {
            if (!Objects.equals(before.get(field), after.get(field))) {
                changed.add(field);
            }
            if (LIST_FIELDS.contains(field)) {
                List<String> beforeItems = new ArrayList<>();
                List<String> afterItems = new ArrayList<>();
                before.path(field).forEach(item -> beforeItems.add(item.asText()));
                after.path(field).forEach(item -> afterItems.add(item.asText()));
                afterItems.stream().filter(item -> !beforeItems.contains(item)).forEach(item -> added.add(field + "/" + item));
                beforeItems.stream().filter(item -> !afterItems.contains(item)).forEach(item -> removed.add(field + "/" + item));
            }
        }
        return new DiffSummary(changed, added, removed);
    }

    private static String trim(String value) {
        return value == null ? null : value.trim();
    }

    private static List<String> trimAll(List<String> values) {
        return values.stream().map(String::trim).toList();
    }

    private static List<String> sortedUnique(List<String> values) {
        return new TreeSet<>(values.stream().map(String::trim).filter(value -> !value.isEmpty()).toList())
            .stream().toList();
    }

    private static PatchResult reject(String code, String path, String message) {
        return PatchResult.rejected(code, message, List.of(new ValidationError(code, path.isEmpty() ? "/" : path, message)));
    }

    private static final class PatchRejected extends RuntimeException {
        private final String code;
        private final String path;

        PatchRejected(String code, String path, String message) {
            super(message);
            this.code = code;
            this.path = path;
        }
    }
}
