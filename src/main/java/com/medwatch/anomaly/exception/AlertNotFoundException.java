package com.medwatch.anomaly.exception;

public class AlertNotFoundException extends NotFoundException {

    public AlertNotFoundException(String id) {
        super("ALERT_NOT_FOUND", "Alert not found: " + id);
    }
}
