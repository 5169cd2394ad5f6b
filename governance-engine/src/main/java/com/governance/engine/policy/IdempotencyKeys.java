package com.governance.engine.policy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.governance.engine.json.CanonicalJson;

import java.util.List;
import java.util.StringJoiner;

/**
 * Deterministic idempotency keys for governed actions.
 *
 * <pre>
 * template [repo, owner, prNumber] + {owner: "acme", repo: "web", prNumber: 123}
 *   -> "owner=acme::prNumber=123::repo=web"
 * </pre>
 */
public final class IdempotencyKeys {

    static final String SEPARATOR = "::";

    private IdempotencyKeys() {
    }

    /**
     * Template fields are sorted; fields missing from the context are skipped.
     * Strings are used raw, other scalars by their JSON text, objects and arrays as canonical JSON.
     */
    public static String generate(List<String> template, JsonNode actionContext) {
        StringJoiner joiner = new StringJoiner(SEPARATOR);
        template.stream().sorted().distinct().forEach(field -> {
            JsonNode value = actionContext == null ? null : actionContext.get(field);
            if (value == null || value.isNull() || value.isMissingNode()) {
                return;
            }
            joiner.add(field + "=" + render(value));
        });
        return joiner.toString();
    }

    public static String hash(String key) {
        return CanonicalJson.sha256Hex(key);
    }

    /**
     * Content fingerprint of the action itself, independent of the policy's key template.
     */
    public static String actionFingerprint(String actionType, String targetIdentifier, JsonNode params) {
        ObjectNode fingerprint = JsonNodeFactory.instance.objectNode();
        fingerprint.put("actionType", actionType);
        fingerprint.put("target", targetIdentifier);
        fingerprint.set("params", params == null ? JsonNodeFactory.instance.objectNode() : params);
        return CanonicalJson.hash(fingerprint);
    }

    private static String render(JsonNode value) {
        if (value.isTextual()) {
            return value.asText();
        }
        if (value.isContainerNode()) {
            return CanonicalJson.write(value);
        }
        return value.toString();
    }
}
