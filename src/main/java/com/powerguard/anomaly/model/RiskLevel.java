package com.powerguard.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Closed-left brackets on the normalized score: boundary values belong to the higher tier.
     */
    public static RiskLevel fromScore(double score) {
        if (score >= 0.75) return CRITICAL;
        if (score >= 0.50) return HIGH;
        if (score >= 0.25) return MEDIUM;
        return LOW;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RiskLevel fromLabel(String label) {
        return valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
