package com.jeevo.validation.knowledge;

import com.jeevo.validation.domain.FactType;
import com.jeevo.validation.knowledge.MedicalKnowledgeRepository.Contraindication;
import com.jeevo.validation.knowledge.MedicalKnowledgeRepository.MedicalCondition;
import com.jeevo.validation.knowledge.MedicalKnowledgeRepository.MedicalFact;
import com.jeevo.validation.rules.KeywordMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Checks single claims against the facts of the knowledge base.
 * A claim matches a fact when either text contains the other on word boundaries.
 */
@Component
public class FactChecker {

    private static final Logger log = LoggerFactory.getLogger(FactChecker.class);

    static final double DEFAULT_FACT_CONFIDENCE = 0.8;

    private final MedicalKnowledgeRepository knowledge;

    public FactChecker(MedicalKnowledgeRepository knowledge) {
        this.knowledge = knowledge;
    }

    public record FactMatch(boolean verified, double confidence, List<MedicalFact> matches) {
        static FactMatch none() {
            return new FactMatch(false, 0.0, List.of());
        }
    }

    public record ContraindicationCheck(boolean flagged, List<String> reasons) {
        static ContraindicationCheck clear() {
            return new ContraindicationCheck(false, List.of());
        }
    }

    public FactMatch checkSymptom(String claimText, String conditionId) {
        return match(claimText, knowledge.findFacts(FactType.SYMPTOM, conditionId));
    }

    public FactMatch checkTreatment(String claimText, String conditionId) {
        return match(claimText, knowledge.findFacts(FactType.TREATMENT, conditionId));
    }

    /**
     * Prevention claims are also accepted when they restate a documented treatment (rest, hydration).
     */
    public FactMatch checkPrevention(String claimText, String conditionId) {
        List<MedicalFact> candidates = new ArrayList<>(knowledge.findFacts(FactType.PREVENTION, conditionId));
        candidates.addAll(knowledge.findFacts(FactType.TREATMENT, conditionId));
        return match(claimText, candidates);
    }

    public ContraindicationCheck checkContraindications(String treatment, String conditionId) {
        return checkContraindications(treatment, conditionId, null);
    }

    /**
     * Population-scoped entries fire only when the population is named in the treatment text
     * or in the patient context.
     */
    public ContraindicationCheck checkContraindications(String treatment, String conditionId, String patientContext) {
        if (treatment == null || treatment.isBlank()) return ContraindicationCheck.clear();
        Optional<MedicalCondition> condition = knowledge.findCondition(conditionId);
        if (condition.isEmpty()) {
            log.debug("No contraindications for unknown condition {}", conditionId);
            return ContraindicationCheck.clear();
        }

        List<String> reasons = new ArrayList<>();
        for (Contraindication entry : condition.get().contraindications()) {
            boolean substanceNamed = entry.substances().stream()
                    .anyMatch(s -> KeywordMatcher.containsTerm(treatment, s));
            if (!substanceNamed) continue;
            if (entry.isPopulationScoped() && !populationNamed(entry, treatment, patientContext)) continue;
            reasons.add(condition.get().name() + ": " + entry.description());
        }
        return reasons.isEmpty() ? ContraindicationCheck.clear() : new ContraindicationCheck(true, List.copyOf(reasons));
    }

    private static boolean populationNamed(Contraindication entry, String treatment, String patientContext) {
        return entry.populationTerms().stream().anyMatch(term ->
                KeywordMatcher.containsTerm(treatment, term) || KeywordMatcher.containsTerm(patientContext, term));
    }

    private FactMatch match(String claimText, List<MedicalFact> facts) {
        if (claimText == null || claimText.isBlank()) return FactMatch.none();
        List<MedicalFact> matched = facts.stream()
                .filter(f -> KeywordMatcher.containsTerm(claimText, f.text()) || KeywordMatcher.containsTerm(f.text(), claimText))
                .toList();
        if (matched.isEmpty()) return FactMatch.none();
        double confidence = matched.stream()
                .mapToDouble(f -> f.confidence() != null ? f.confidence() : DEFAULT_FACT_CONFIDENCE)
                .average()
                .orElse(0.0);
        return new FactMatch(true, confidence, matched);
    }
}
