package com.medwatch.anomaly.engine.rules;

import java.util.List;

/**
 * A group of built-in rules registered with the engine at startup.
 */
public interface RuleSet {

    String getName();

    List<DetectionRule> getRules();
}
