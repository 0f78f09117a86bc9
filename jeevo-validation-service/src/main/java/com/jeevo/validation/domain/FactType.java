package com.jeevo.validation.domain;

import java.util.Locale;

public enum FactType {
    SYMPTOM,
    TREATMENT,
    PREVENTION;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static FactType fromValue(String value) {
        return FactType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
