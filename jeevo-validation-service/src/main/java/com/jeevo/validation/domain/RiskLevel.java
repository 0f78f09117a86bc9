package com.jeevo.validation.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Risk tier of a validated answer. Ordinal order is severity order.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isAtLeast(RiskLevel other) {
        return compareTo(other) >= 0;
    }

    @JsonCreator
    public static RiskLevel fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Risk level is required");
        }
        return RiskLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
