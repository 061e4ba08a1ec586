package com.medwatch.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AnomalyStatus {
    DETECTED,
    INVESTIGATING,
    RESOLVED,
    FALSE_POSITIVE;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    @JsonCreator
    public static AnomalyStatus fromLabel(String value) {
        if (value == null) return null;
        return AnomalyStatus.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
