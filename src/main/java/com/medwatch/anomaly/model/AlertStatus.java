package com.medwatch.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AlertStatus {
    PENDING,
    PROCESSING,
    SENT,
    FAILED,
    ESCALATED,
    ACKNOWLEDGED;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AlertStatus fromLabel(String value) {
        if (value == null) return null;
        return AlertStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
