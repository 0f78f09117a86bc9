package com.jeevo.validation.orchestrator;

import com.jeevo.validation.rules.DangerousCombination;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Everything the keyword stages found in one (query, response) pair.
 */
public record HeuristicSignals(
        double baselineConfidence,
        List<String> emergencyInQuery,
        List<String> emergencyInResponse,
        List<String> dangerPatterns,
        List<String> appropriateMarkers,
        List<DangerousCombination> dangerousCombinations,
        List<String> highRiskKeywords,
        List<String> medicalConditions,
        List<String> goodPracticePhrases,
        List<String> dangerousAdvicePhrases
) {

    /** Emergency terms the response introduced on its own. */
    public List<String> unsolicitedEmergencies() {
        return emergencyInResponse.stream()
                .filter(keyword -> !emergencyInQuery.contains(keyword))
                .toList();
    }

    public List<String> allEmergencyKeywords() {
        Set<String> all = new LinkedHashSet<>(emergencyInQuery);
        all.addAll(emergencyInResponse);
        return List.copyOf(all);
    }

    public boolean hasEmergency() {
        return !emergencyInQuery.isEmpty() || !emergencyInResponse.isEmpty();
    }

    public boolean hasMedicalTopic() {
        return !highRiskKeywords.isEmpty() || !medicalConditions.isEmpty();
    }
}
