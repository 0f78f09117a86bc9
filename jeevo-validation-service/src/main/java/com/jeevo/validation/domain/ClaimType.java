package com.jeevo.validation.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ClaimType {
    SYMPTOM,
    TREATMENT,
    PREVENTION,
    WARNING,
    EMERGENCY,
    DIAGNOSIS,
    GENERAL_INFO;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Warning and emergency claims always go to a human. */
    public boolean requiresHumanReview() {
        return this == WARNING || this == EMERGENCY;
    }

    @JsonCreator
    public static ClaimType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Claim type is required");
        }
        return ClaimType.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_'));
    }
}
