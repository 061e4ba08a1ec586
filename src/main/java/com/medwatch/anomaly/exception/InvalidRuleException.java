package com.medwatch.anomaly.exception;

public class InvalidRuleException extends MedWatchException {

    public InvalidRuleException(String message) {
        super("INVALID_RULE", message);
    }

    public InvalidRuleException(String message, Throwable cause) {
        super("INVALID_RULE", message, cause);
    }
}
