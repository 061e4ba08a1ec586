package com.medwatch.anomaly.engine.rules.condition;

import com.medwatch.anomaly.engine.rules.RuleContext;
import com.medwatch.anomaly.exception.InvalidRuleException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LogicalCondition implements RuleCondition {

    private LogicalOperator operator;

    @Builder.Default
    private List<RuleCondition> conditions = new ArrayList<>();

    public static LogicalCondition and(RuleCondition... conditions) {
        return new LogicalCondition(LogicalOperator.AND, new ArrayList<>(List.of(conditions)));
    }

    public static LogicalCondition or(RuleCondition... conditions) {
        return new LogicalCondition(LogicalOperator.OR, new ArrayList<>(List.of(conditions)));
    }

    @Override
    public boolean matches(RuleContext context) {
        if (operator == LogicalOperator.AND) {
            for (RuleCondition condition : conditions) {
                if (!condition.matches(context)) return false;
            }
            return true;
        }
        for (RuleCondition condition : conditions) {
            if (condition.matches(context)) return true;
        }
        return false;
    }

    @Override
    public void validate() {
        if (operator == null) {
            throw new InvalidRuleException("Logical condition is missing an operator");
        }
        if (conditions == null || conditions.isEmpty()) {
            throw new InvalidRuleException(operator + " condition has no operands");
        }
        for (RuleCondition condition : conditions) {
            if (condition == null) {
                throw new InvalidRuleException(operator + " condition has a null operand");
            }
            condition.validate();
        }
    }
}
