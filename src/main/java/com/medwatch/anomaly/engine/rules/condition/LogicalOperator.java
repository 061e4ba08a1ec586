package com.medwatch.anomaly.engine.rules.condition;

public enum LogicalOperator {
    AND,
    OR
}
