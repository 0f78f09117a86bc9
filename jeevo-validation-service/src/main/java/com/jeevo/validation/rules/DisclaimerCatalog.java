package com.jeevo.validation.rules;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jeevo.validation.domain.Language;
import com.jeevo.validation.domain.RiskLevel;

import java.io.IOException;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.Map;

/**
 * Default disclaimer texts per risk level and language, loaded from {@code rules/default-disclaimers.json}.
 */
public final class DisclaimerCatalog {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<RiskLevel, Map<Language, String>> texts;

    public DisclaimerCatalog(Map<RiskLevel, Map<Language, String>> texts) {
        Map<RiskLevel, Map<Language, String>> copy = new EnumMap<>(RiskLevel.class);
        texts.forEach((risk, byLanguage) -> copy.put(risk, Map.copyOf(byLanguage)));
        for (RiskLevel risk : RiskLevel.values()) {
            Map<Language, String> byLanguage = copy.get(risk);
            if (byLanguage == null || !byLanguage.containsKey(Language.ENGLISH)) {
                throw new IllegalStateException("Missing English default disclaimer for risk level " + risk.value());
            }
        }
        this.texts = copy;
    }

    public static DisclaimerCatalog load(InputStream in) throws IOException {
        return new DisclaimerCatalog(MAPPER.readValue(in, new TypeReference<Map<RiskLevel, Map<Language, String>>>() {}));
    }

    /**
     * Falls back to English when the language has no default text.
     */
    public String defaultText(RiskLevel risk, Language language) {
        Map<Language, String> byLanguage = texts.get(risk);
        String text = byLanguage.get(language);
        return text != null ? text : byLanguage.get(Language.ENGLISH);
    }

    public boolean hasTranslation(RiskLevel risk, Language language) {
        return texts.get(risk).containsKey(language);
    }
}
