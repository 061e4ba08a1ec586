package com.medwatch.anomaly.exception;

public class ScorerException extends MedWatchException {

    public ScorerException(String modelId, Throwable cause) {
        super("SCORER_FAILED", "Scorer " + modelId + " failed: " + cause.getMessage(), cause);
    }
}
