package com.medwatch.anomaly.engine.rules;

import com.medwatch.anomaly.model.RuleStats;

/**
 * Run-time counters of one rule. All access is synchronized on the instance.
 */
class RuleStatistics {

    private long executions;
    private long matches;
    private double averageExecutionTimeMs;
    private Long lastExecuted;

    synchronized void record(double elapsedMs, boolean matched, long timestamp) {
        executions++;
        if (matched) matches++;
        averageExecutionTimeMs = (averageExecutionTimeMs * (executions - 1) + elapsedMs) / executions;
        lastExecuted = timestamp;
    }

    private double successRate() {
        return executions == 0 ? 0.0 : (double) matches / executions * 100.0;
    }

    synchronized RuleStats snapshot(DetectionRule rule, boolean enabled) {
        return RuleStats.builder()
                .ruleId(rule.getId())
                .name(rule.getName())
                .category(rule.getCategory())
                .severity(rule.getSeverity())
                .enabled(enabled)
                .executions(executions)
                .matches(matches)
                .averageExecutionTimeMs(averageExecutionTimeMs)
                .lastExecuted(lastExecuted)
                .successRate(successRate())
                .build();
    }
}
