package com.medwatch.anomaly.engine.rules.condition;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.medwatch.anomaly.engine.rules.RuleContext;
import com.medwatch.anomaly.exception.InvalidRuleException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compares a field against a literal value or against another field.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComparisonCondition implements RuleCondition {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private String field;
    private ComparisonOperator operator;
    private Object value;

    /** When set, the right-hand side is read from this field instead of {@link #value}. */
    private String valueField;

    public static ComparisonCondition of(String field, ComparisonOperator operator, Object value) {
        return ComparisonCondition.builder().field(field).operator(operator).value(value).build();
    }

    @Override
    public boolean matches(RuleContext context) {
        JsonNode left = context.resolve(field);
        JsonNode right = valueField != null ? context.resolve(valueField) : MAPPER.valueToTree(value);
        return operator.apply(left, right);
    }

    @Override
    public void validate() {
        if (field == null || field.isBlank()) {
            throw new InvalidRuleException("Comparison is missing a field");
        }
        if (operator == null) {
            throw new InvalidRuleException("Comparison on '" + field + "' is missing an operator");
        }
        if (operator == ComparisonOperator.REGEX && valueField == null) {
            try {
                Pattern.compile(String.valueOf(value));
            } catch (PatternSyntaxException e) {
                throw new InvalidRuleException("Invalid regex for '" + field + "': " + e.getDescription(), e);
            }
        }
    }
}
