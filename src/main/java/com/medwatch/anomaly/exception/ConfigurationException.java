package com.medwatch.anomaly.exception;

public class ConfigurationException extends MedWatchException {

    public ConfigurationException(String message) {
        super("CONFIGURATION_ERROR", message);
    }
}
