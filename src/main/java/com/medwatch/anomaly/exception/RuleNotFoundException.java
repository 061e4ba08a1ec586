package com.medwatch.anomaly.exception;

public class RuleNotFoundException extends NotFoundException {

    public RuleNotFoundException(String id) {
        super("RULE_NOT_FOUND", "Rule not found: " + id);
    }
}
