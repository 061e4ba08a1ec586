package com.medwatch.anomaly.engine.rules;

import com.medwatch.anomaly.model.AnomalyDetails;

/**
 * Produces the anomaly details for a rule whose condition matched.
 */
@FunctionalInterface
public interface RuleAction {

    AnomalyDetails apply(RuleContext context);
}
