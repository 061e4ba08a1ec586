package com.medwatch.anomaly.exception;

public class RuleEvaluationException extends MedWatchException {

    public RuleEvaluationException(String ruleId, Throwable cause) {
        super("RULE_EVALUATION_FAILED", "Rule " + ruleId + " failed: " + cause.getMessage(), cause);
    }

    public RuleEvaluationException(String message) {
        super("RULE_EVALUATION_FAILED", message);
    }
}
