package com.medwatch.anomaly.engine.rules.condition;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.regex.Pattern;

/**
 * Operators of a field comparison.
 *
 * Loose equality compares numbers numerically and numeric text as numbers, everything else
 * by text. Strict equality also requires the same JSON node type. Ordering operators need
 * two numbers or two strings and are false otherwise, as are all operators on a missing field
 * except the inequalities.
 */
public enum ComparisonOperator {
    EQ("=="),
    STRICT_EQ("==="),
    NE("!="),
    STRICT_NE("!=="),
    GT(">"),
    GTE(">="),
    LT("<"),
    LTE("<="),
    CONTAINS("contains"),
    STARTS_WITH("startsWith"),
    ENDS_WITH("endsWith"),
    REGEX("regex");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    @JsonValue
    public String symbol() {
        return symbol;
    }

    @JsonCreator
    public static ComparisonOperator fromSymbol(String value) {
        if (value == null) return null;
        for (ComparisonOperator op : values()) {
            if (op.symbol.equals(value) || op.name().equalsIgnoreCase(value)) {
                return op;
            }
        }
        if ("matches".equals(value)) return REGEX;
        throw new IllegalArgumentException("Unknown comparison operator: " + value);
    }

    /**
     * The operator that gives the same result with its operands swapped, or null when none exists.
     */
    public ComparisonOperator mirrored() {
        switch (this) {
            case GT: return LT;
            case GTE: return LTE;
            case LT: return GT;
            case LTE: return GTE;
            case EQ:
            case STRICT_EQ:
            case NE:
            case STRICT_NE:
                return this;
            default:
                return null;
        }
    }

    public boolean apply(JsonNode left, JsonNode right) {
        boolean leftAbsent = isAbsent(left);
        boolean rightAbsent = isAbsent(right);

        switch (this) {
            case EQ:
                return looseEquals(left, right, leftAbsent, rightAbsent);
            case NE:
                return !looseEquals(left, right, leftAbsent, rightAbsent);
            case STRICT_EQ:
                return strictEquals(left, right, leftAbsent, rightAbsent);
            case STRICT_NE:
                return !strictEquals(left, right, leftAbsent, rightAbsent);
            default:
                break;
        }

        if (leftAbsent || rightAbsent) return false;

        switch (this) {
            case GT:
            case GTE:
            case LT:
            case LTE:
                return ordered(left, right);
            case CONTAINS:
                if (left.isArray()) {
                    for (JsonNode element : left) {
                        if (looseEquals(element, right, false, false)) return true;
                    }
                    return false;
                }
                return left.asText().contains(right.asText());
            case STARTS_WITH: return left.asText().startsWith(right.asText());
            case ENDS_WITH: return left.asText().endsWith(right.asText());
            case REGEX: return Pattern.compile(right.asText()).matcher(left.asText()).find();
            default:
                throw new IllegalStateException("Unhandled operator " + this);
        }
    }

    private static boolean isAbsent(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull();
    }

    private static boolean looseEquals(JsonNode left, JsonNode right, boolean leftAbsent, boolean rightAbsent) {
        if (leftAbsent || rightAbsent) return leftAbsent && rightAbsent;
        Double l = numeric(left);
        Double r = numeric(right);
        if (l != null && r != null) return l.doubleValue() == r.doubleValue();
        if (left.isContainerNode() || right.isContainerNode()) return left.equals(right);
        return left.asText().equals(right.asText());
    }

    private static boolean strictEquals(JsonNode left, JsonNode right, boolean leftAbsent, boolean rightAbsent) {
        if (leftAbsent || rightAbsent) return leftAbsent && rightAbsent;
        if (left.isNumber() && right.isNumber()) return left.asDouble() == right.asDouble();
        return left.getNodeType() == right.getNodeType() && left.equals(right);
    }

    private boolean ordered(JsonNode left, JsonNode right) {
        int cmp;
        Double l = numeric(left);
        Double r = numeric(right);
        if (l != null && r != null) {
            cmp = Double.compare(l, r);
        } else if (left.isTextual() && right.isTextual()) {
            cmp = left.asText().compareTo(right.asText());
        } else {
            return false;
        }
        switch (this) {
            case GT: return cmp > 0;
            case GTE: return cmp >= 0;
            case LT: return cmp < 0;
            default: return cmp <= 0;
        }
    }

    private static Double numeric(JsonNode node) {
        if (node.isNumber()) return node.asDouble();
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
