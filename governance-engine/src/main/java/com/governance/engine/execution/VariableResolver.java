package com.governance.engine.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.Iterator;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code ${path}} references against run variables.
 *
 * Paths use dots and array indices, e.g. {@code input.issue.labels[0].name}. A string that is exactly one
 * reference takes the referenced value with its JSON type; references embedded in longer text are
 * rendered as text. Unresolved references are left verbatim.
 */
public final class VariableResolver {

    static final Pattern REFERENCE = Pattern.compile("\\$\\{([^}]+)}");
    private static final Pattern INDEX = Pattern.compile("\\[(\\d+)]");

    private VariableResolver() {
    }

    public static JsonNode resolve(JsonNode value, JsonNode variables) {
        if (value == null || value.isNull()) {
            return value;
        }
        if (value.isTextual()) {
            return resolveText(value.textValue(), variables);
        }
        if (value.isArray()) {
            ArrayNode result = JsonNodeFactory.instance.arrayNode();
            value.forEach(item -> result.add(resolve(item, variables)));
            return result;
        }
        if (value.isObject()) {
            ObjectNode result = JsonNodeFactory.instance.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                result.set(field.getKey(), resolve(field.getValue(), variables));
            }
            return result;
        }
        return value;
    }

    /**
     * Substitutes every resolvable reference in a template, always producing text.
     */
    public static String substitute(String template, JsonNode variables) {
        if (template == null) {
            return null;
        }
        Matcher matcher = REFERENCE.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            JsonNode resolved = lookup(matcher.group(1).trim(), variables);
            String replacement = resolved == null ? matcher.group() : render(resolved);
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /**
     * @return the node at the path, or null when any segment is missing
     */
    public static JsonNode lookup(String path, JsonNode variables) {
        if (variables == null || path == null || path.isBlank()) {
            return null;
        }
        String normalized = INDEX.matcher(path).replaceAll(".$1");
        JsonNode current = variables;
        for (String part : normalized.split("\\.")) {
            if (current == null || current.isNull() || current.isMissingNode()) {
                return null;
            }
            if (current.isArray() && isIndex(part)) {
                current = current.get(Integer.parseInt(part));
            } else {
                current = current.get(part);
            }
        }
        return current == null || current.isMissingNode() ? null : current;
    }

    static String render(JsonNode node) {
        return node.isValueNode() ? node.asText() : node.toString();
    }

    private static JsonNode resolveText(String text, JsonNode variables) {
        Matcher whole = REFERENCE.matcher(text);
        if (whole.matches()) {
            JsonNode resolved = lookup(whole.group(1).trim(), variables);
            return resolved == null ? TextNode.valueOf(text) : resolved.deepCopy();
        }
        return TextNode.valueOf(substitute(text, variables));
    }

    private static boolean isIndex(String part) {
        return !part.isEmpty() && part.chars().allMatch(Character::isDigit);
    }
}
