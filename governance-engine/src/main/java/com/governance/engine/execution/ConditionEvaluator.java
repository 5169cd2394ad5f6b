package com.governance.engine.execution;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Evaluates step {@code if} expressions against run variables.
 *
 * Supported forms: {@code true}, {@code false}, a bare {@code ${path}} (true when the value is present
 * and truthy), and one binary comparison with {@code == != === !== >= <= > <}. Comparisons are numeric
 * when both sides parse as numbers and textual otherwise. Anything left unresolved evaluates to false.
 */
public final class ConditionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ConditionEvaluator.class);

    // Longest operators first so "===" is not read as "==".
    private static final List<String> OPERATORS = List.of("===", "!==", "==", "!=", ">=", "<=", ">", "<");

    private ConditionEvaluator() {
    }

    public static boolean evaluate(String condition, JsonNode variables) {
        if (condition == null || condition.isBlank()) {
            return true;
        }
        String trimmed = condition.trim();

        Matcher bare = VariableResolver.REFERENCE.matcher(trimmed);
        if (bare.matches()) {
            boolean result = isTruthy(VariableResolver.lookup(bare.group(1).trim(), variables));
            log.debug("Condition {} -> {}", condition, result);
            return result;
        }

        String substituted = VariableResolver.substitute(trimmed, variables).trim();
        if (substituted.equals("true")) {
            return true;
        }
        if (substituted.equals("false")) {
            return false;
        }
        if (substituted.contains("${")) {
            log.debug("Condition {} has unresolved variables, evaluating as false", condition);
            return false;
        }

        for (String operator : OPERATORS) {
            int at = substituted.indexOf(operator);
            if (at >= 0) {
                String left = unquote(substituted.substring(0, at));
                String right = unquote(substituted.substring(at + operator.length()));
                boolean result = compare(left, operator, right);
                log.debug("Condition {} -> '{}' {} '{}' -> {}", condition, left, operator, right, result);
                return result;
            }
        }

        return !substituted.isEmpty() && !substituted.equals("null") && !substituted.equals("undefined");
    }

    private static boolean compare(String left, String operator, String right) {
        BigDecimal leftNumber = toNumber(left);
        BigDecimal rightNumber = toNumber(right);
        if (leftNumber != null && rightNumber != null) {
            int cmp = leftNumber.compareTo(rightNumber);
            return switch (operator) {
                case "==", "===" -> cmp == 0;
                case "!=", "!==" -> cmp != 0;
                case ">" -> cmp > 0;
                case "<" -> cmp < 0;
                case ">=" -> cmp >= 0;
                case "<=" -> cmp <= 0;
                default -> false;
            };
        }
        return switch (operator) {
            case "==", "===" -> left.equals(right);
            case "!=", "!==" -> !left.equals(right);
            case ">" -> left.compareTo(right) > 0;
            case "<" -> left.compareTo(right) < 0;
            case ">=" -> left.compareTo(right) >= 0;
            case "<=" -> left.compareTo(right) <= 0;
            default -> false;
        };
    }

    private static String unquote(String operand) {
        String value = operand.trim();
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '\'' || first == '"') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }

    private static BigDecimal toNumber(String value) {
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean isTruthy(JsonNode value) {
        if (value == null || value.isNull()) {
            return false;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isNumber()) {
            return value.doubleValue() != 0.0;
        }
        if (value.isTextual()) {
            return !value.textValue().isEmpty();
        }
        return true;
    }
}
