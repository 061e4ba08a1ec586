package com.medwatch.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DetectionMethod {
    RULE_BASED("rule-based"),
    ML_BASED("ml-based");

    private final String label;

    DetectionMethod(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static DetectionMethod fromLabel(String value) {
        for (DetectionMethod method : values()) {
            if (method.label.equalsIgnoreCase(value) || method.name().equalsIgnoreCase(value)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown detection method: " + value);
    }
}
