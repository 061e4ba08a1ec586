package com.medwatch.anomaly.engine.rules.condition;

import com.medwatch.anomaly.engine.rules.RuleContext;
import com.medwatch.anomaly.exception.InvalidRuleException;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class NotCondition implements RuleCondition {

    private RuleCondition condition;

    @Override
    public boolean matches(RuleContext context) {
        return !condition.matches(context);
    }

    @Override
    public void validate() {
        if (condition == null) {
            throw new InvalidRuleException("NOT condition has no operand");
        }
        condition.validate();
    }
}
