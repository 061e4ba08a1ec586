package com.medwatch.anomaly.engine.rules.condition;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.medwatch.anomaly.engine.rules.RuleContext;
import com.medwatch.anomaly.exception.InvalidRuleException;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A condition written as text, e.g. {@code currentStock <= criticalThreshold && contextual.criticalMedicine}.
 * The text is compiled by {@link ConditionExpressionParser} into comparison and logical nodes,
 * it is never executed as code.
 */
@Getter
@Setter
@NoArgsConstructor
public class ExpressionCondition implements RuleCondition {

    private String expression;

    @JsonIgnore
    private volatile RuleCondition compiled;

    public ExpressionCondition(String expression) {
        this.expression = expression;
    }

    @Override
    public boolean matches(RuleContext context) {
        return compiled().matches(context);
    }

    @Override
    public void validate() {
        if (expression == null || expression.isBlank()) {
            throw new InvalidRuleException("Expression condition is empty");
        }
        compiled();
    }

    private RuleCondition compiled() {
        RuleCondition result = compiled;
        if (result == null) {
            result = ConditionExpressionParser.parse(expression);
            compiled = result;
        }
        return result;
    }

    @Override
    public String toString() {
        return expression;
    }
}
