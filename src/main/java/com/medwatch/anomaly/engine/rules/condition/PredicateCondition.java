package com.medwatch.anomaly.engine.rules.condition;

import com.medwatch.anomaly.engine.rules.RuleContext;

import java.util.function.Predicate;

/**
 * Condition backed by Java code. Used by the built-in rule sets.
 */
public class PredicateCondition implements RuleCondition {

    private final String description;
    private final Predicate<RuleContext> predicate;

    public PredicateCondition(String description, Predicate<RuleContext> predicate) {
        this.description = description;
        this.predicate = predicate;
    }

    public static PredicateCondition of(String description, Predicate<RuleContext> predicate) {
        return new PredicateCondition(description, predicate);
    }

    @Override
    public boolean matches(RuleContext context) {
        return predicate.test(context);
    }

    @Override
    public String toString() {
        return description;
    }
}
