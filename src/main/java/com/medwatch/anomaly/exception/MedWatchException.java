package com.medwatch.anomaly.exception;

import lombok.Getter;

@Getter
public abstract class MedWatchException extends RuntimeException {

    private final String errorCode;

    protected MedWatchException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected MedWatchException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
