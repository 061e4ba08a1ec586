package com.medwatch.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Confidence banding with inclusive lower bounds: 0.9 critical, 0.7 high, 0.5 medium.
     */
    public static Severity fromConfidence(double confidence) {
        if (confidence >= 0.9) return CRITICAL;
        if (confidence >= 0.7) return HIGH;
        if (confidence >= 0.5) return MEDIUM;
        return LOW;
    }

    /**
     * Confidence assigned to a rule-based detection of this severity.
     */
    public double ruleConfidence() {
        switch (this) {
            case CRITICAL: return 1.0;
            case HIGH: return 0.8;
            default: return 0.6;
        }
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Severity fromLabel(String value) {
        if (value == null) return null;
        return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
