package com.jeevo.validation.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Why a validation asked for human review.
 */
public enum EscalationTrigger {
    EMERGENCY_KEYWORDS,
    DANGEROUS_MEDICATION_COMBINATION,
    HIGH_RISK_LOW_CONFIDENCE,
    DANGEROUS_ADVICE_PATTERN,
    VERY_LOW_CONFIDENCE,
    CONTRADICTIONS_DETECTED,
    LOW_ACCURACY_RESPONSE,
    VALIDATION_ERROR;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
