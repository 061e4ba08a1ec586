package com.medwatch.anomaly.exception;

public class AnomalyNotFoundException extends NotFoundException {

    public AnomalyNotFoundException(String id) {
        super("ANOMALY_NOT_FOUND", "Anomaly not found: " + id);
    }
}
