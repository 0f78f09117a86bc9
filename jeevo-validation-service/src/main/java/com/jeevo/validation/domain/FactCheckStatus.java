package com.jeevo.validation.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FactCheckStatus {
    VERIFIED,
    CONTRADICTED,
    CONCERNING,
    UNVERIFIABLE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
