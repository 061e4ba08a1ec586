package com.medwatch.anomaly.exception;

public abstract class NotFoundException extends MedWatchException {

    protected NotFoundException(String errorCode, String message) {
        super(errorCode, message);
    }
}
