package com.medwatch.anomaly.engine.rules.condition;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.medwatch.anomaly.engine.rules.RuleContext;

/**
 * Predicate over a rule context. Declarative forms are read from JSON by their {@code type}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ComparisonCondition.class, name = "comparison"),
        @JsonSubTypes.Type(value = LogicalCondition.class, name = "logical"),
        @JsonSubTypes.Type(value = NotCondition.class, name = "not"),
        @JsonSubTypes.Type(value = ExpressionCondition.class, name = "expression")
})
public interface RuleCondition {

    boolean matches(RuleContext context);

    /**
     * Check the condition is well formed. Called once when the rule is registered.
     *
     * @throws com.medwatch.anomaly.exception.InvalidRuleException if it is not
     */
    default void validate() {
    }
}
