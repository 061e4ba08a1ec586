package com.medwatch.anomaly.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class DataPointValidationException extends MedWatchException {

    private final List<String> errors;

    public DataPointValidationException(String dataPointId, List<String> errors) {
        super("INVALID_DATA_POINT", "Invalid data point " + dataPointId + ": " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }
}
