package com.jeevo.validation.rules;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jeevo.validation.domain.ClaimType;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keyword tables and the medication/population table that drive the heuristic stages
 * and the fallback claim extractor. Loaded once from {@code rules/validation-rules.json}.
 */
public record ValidationRules(
        List<String> emergencyKeywords,
        List<String> emergencyDangerPatterns,
        List<String> appropriateResponseMarkers,
        List<String> highRiskKeywords,
        List<String> medicalConditions,
        List<String> goodPracticePhrases,
        List<String> dangerousAdvicePhrases,
        List<DangerousCombination> dangerousCombinations,
        Map<ClaimType, List<String>> claimKeywords
) {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    public ValidationRules {
        emergencyKeywords = copy(emergencyKeywords);
        emergencyDangerPatterns = copy(emergencyDangerPatterns);
        appropriateResponseMarkers = copy(appropriateResponseMarkers);
        highRiskKeywords = copy(highRiskKeywords);
        medicalConditions = copy(medicalConditions);
        goodPracticePhrases = copy(goodPracticePhrases);
        dangerousAdvicePhrases = copy(dangerousAdvicePhrases);
        dangerousCombinations = dangerousCombinations == null ? List.of() : List.copyOf(dangerousCombinations);
        // bucket order decides which claim type wins a shared sentence
        Map<ClaimType, List<String>> ordered = new LinkedHashMap<>();
        if (claimKeywords != null) {
            claimKeywords.forEach((type, words) -> ordered.put(type, copy(words)));
        }
        claimKeywords = Collections.unmodifiableMap(ordered);
    }

    public static ValidationRules load(InputStream in) throws IOException {
        ValidationRules rules = MAPPER.readValue(in, ValidationRules.class);
        if (rules.emergencyKeywords().isEmpty()) {
            throw new IllegalStateException("Validation rules define no emergency keywords");
        }
        return rules;
    }

    private static List<String> copy(List<String> values) {
        return values == null ? List.of() : List.copyOf(values);
    }
}
