package com.jeevo.validation.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The ten chat languages, keyed by ISO 639-1 code.
 */
public enum Language {
    ENGLISH("en"),
    HINDI("hi"),
    MARATHI("mr"),
    GUJARATI("gu"),
    BENGALI("bn"),
    TAMIL("ta"),
    TELUGU("te"),
    KANNADA("kn"),
    MALAYALAM("ml"),
    PUNJABI("pa");

    private final String code;

    Language(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Unknown or blank codes resolve to English so a reply is never left without a language.
     */
    @JsonCreator
    public static Language fromCode(String code) {
        if (code == null || code.isBlank()) return ENGLISH;
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (Language language : values()) {
            if (language.code.equals(normalized) || language.name().equalsIgnoreCase(normalized)) {
                return language;
            }
        }
        return ENGLISH;
    }
}
