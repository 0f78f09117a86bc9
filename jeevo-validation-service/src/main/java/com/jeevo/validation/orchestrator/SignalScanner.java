package com.jeevo.validation.orchestrator;

import com.jeevo.validation.rules.DangerousCombination;
import com.jeevo.validation.rules.KeywordMatcher;
import com.jeevo.validation.rules.ValidationRules;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiles the keyword tables once and scans each (query, response) pair into {@link HeuristicSignals}.
 */
@Component
public class SignalScanner {

    private final KeywordMatcher emergency;
    private final KeywordMatcher dangerPatterns;
    private final KeywordMatcher appropriateMarkers;
    private final KeywordMatcher highRisk;
    private final KeywordMatcher conditions;
    private final KeywordMatcher goodPractice;
    private final KeywordMatcher dangerousAdvice;
    private final List<CombinationMatcher> combinations;

    private record CombinationMatcher(DangerousCombination combination,
                                      KeywordMatcher medication,
                                      KeywordMatcher population) {}

    public SignalScanner(ValidationRules rules) {
        this.emergency = KeywordMatcher.of(rules.emergencyKeywords());
        this.dangerPatterns = KeywordMatcher.of(rules.emergencyDangerPatterns());
        this.appropriateMarkers = KeywordMatcher.of(rules.appropriateResponseMarkers());
        this.highRisk = KeywordMatcher.of(rules.highRiskKeywords());
        this.conditions = KeywordMatcher.of(rules.medicalConditions());
        this.goodPractice = KeywordMatcher.of(rules.goodPracticePhrases());
        this.dangerousAdvice = KeywordMatcher.of(rules.dangerousAdvicePhrases());
        this.combinations = rules.dangerousCombinations().stream()
                .map(c -> new CombinationMatcher(c,
                        KeywordMatcher.of(c.medicationTerms()),
                        KeywordMatcher.of(c.populationTerms(), c.populationPatterns())))
                .toList();
    }

    /**
     * Emergency terms are read from both texts, population and topic terms from the query,
     * and advice phrases from the response.
     */
    public HeuristicSignals scan(String query, String response, double baselineConfidence) {
        List<DangerousCombination> matched = new ArrayList<>();
        for (CombinationMatcher matcher : combinations) {
            if (matcher.medication().matchesAny(response) && matcher.population().matchesAny(query)) {
                matched.add(matcher.combination());
            }
        }

        return new HeuristicSignals(
                baselineConfidence,
                emergency.findAll(query),
                emergency.findAll(response),
                dangerPatterns.findAll(response),
                appropriateMarkers.findAll(response),
                List.copyOf(matched),
                highRisk.findAll(query),
                conditions.findAll(query),
                goodPractice.findAll(response),
                dangerousAdvice.findAll(response)
        );
    }
}
