package com.jeevo.validation.semantic;

import com.jeevo.validation.domain.ClaimType;
import com.jeevo.validation.domain.FactCheckStatus;
import com.jeevo.validation.domain.RiskLevel;
import com.jeevo.validation.dto.SemanticDtos.ExtractedClaim;
import com.jeevo.validation.dto.SemanticDtos.FactCheckResult;
import com.jeevo.validation.dto.SemanticDtos.QualityMetrics;
import com.jeevo.validation.dto.SemanticDtos.SemanticReport;
import com.jeevo.validation.dto.SemanticDtos.SemanticScores;
import com.jeevo.validation.exception.KnowledgeLookupException;
import com.jeevo.validation.knowledge.FactChecker;
import com.jeevo.validation.knowledge.FactChecker.ContraindicationCheck;
import com.jeevo.validation.knowledge.FactChecker.FactMatch;
import com.jeevo.validation.knowledge.MedicalKnowledgeRepository;
import com.jeevo.validation.knowledge.MedicalKnowledgeRepository.MedicalCondition;
import com.jeevo.validation.knowledge.MedicalKnowledgeRepository.MedicalFact;
import com.jeevo.validation.knowledge.MedicalKnowledgeRepository.MedicalSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.function.BiFunction;
import java.util.function.BooleanSupplier;

/**
 * Extracts the claims of an answer, fact-checks each one and aggregates the outcome.
 */
@Service
public class SemanticValidator {

    private static final Logger log = LoggerFactory.getLogger(SemanticValidator.class);

    static final double CONCERNING_CONFIDENCE = 0.5;
    static final double CONTRADICTED_CONFIDENCE = 0.9;
    static final double UNVERIFIED_CONFIDENCE = 0.2;
    static final double UNSUPPORTED_TYPE_CONFIDENCE = 0.3;
    static final int CONCERNING_HIGH_RISK_COUNT = 3;

    private final ClaimExtractor extractor;
    private final FactChecker factChecker;
    private final MedicalKnowledgeRepository knowledge;

    public SemanticValidator(ClaimExtractor extractor, FactChecker factChecker, MedicalKnowledgeRepository knowledge) {
        this.extractor = extractor;
        this.factChecker = factChecker;
        this.knowledge = knowledge;
    }

    public SemanticReport validate(String query, String response) {
        return validate(query, response, () -> false);
    }

    /**
     * @throws CancellationException when {@code cancelled} reports true during extraction or between claims
     */
    public SemanticReport validate(String query, String response, BooleanSupplier cancelled) {
        List<ExtractedClaim> claims = extractor.extract(response, cancelled);
        if (claims.isEmpty()) {
            log.debug("No testable claims extracted");
            return new SemanticReport(List.of(), List.of(), new QualityMetrics(0, 0, 0, 0, 0),
                    new SemanticScores(0.5, 0.3, 0.5, 0.5), RiskLevel.LOW, false, List.of(), List.of());
        }

        List<String> conditionIds = mentionedConditionIds(query);
        List<FactCheckResult> checks = new ArrayList<>();
        for (ExtractedClaim claim : claims) {
            if (cancelled.getAsBoolean()) {
                throw new CancellationException("Semantic validation cancelled");
            }
            checks.add(check(claim, query, conditionIds));
        }
        return aggregate(claims, checks);
    }

    FactCheckResult check(ExtractedClaim claim, String query, List<String> conditionIds) {
        ClaimType type = claim.type();
        if (type.requiresHumanReview()) {
            return result(claim, FactCheckStatus.CONCERNING, CONCERNING_CONFIDENCE, List.of(),
                    "Warning and emergency claims require expert review");
        }

        try {
            return switch (type) {
                case TREATMENT -> checkTreatment(claim, query, conditionIds);
                case SYMPTOM -> verifyOrUnverifiable(claim, conditionIds, factChecker::checkSymptom);
                case PREVENTION -> verifyOrUnverifiable(claim, conditionIds, factChecker::checkPrevention);
                default -> result(claim, FactCheckStatus.UNVERIFIABLE, UNSUPPORTED_TYPE_CONFIDENCE, List.of(),
                        "No fact type for claim type " + type.value());
            };
        } catch (KnowledgeLookupException e) {
            log.warn("Knowledge lookup failed for claim '{}': {}", claim.text(), e.getMessage());
            return result(claim, FactCheckStatus.UNVERIFIABLE, 0.0, List.of(), "Knowledge base unavailable");
        }
    }

    private FactCheckResult checkTreatment(ExtractedClaim claim, String query, List<String> conditionIds) {
        List<String> reasons = new ArrayList<>();
        for (String conditionId : conditionIds) {
            ContraindicationCheck contraindications =
                    factChecker.checkContraindications(claim.text(), conditionId, query);
            reasons.addAll(contraindications.reasons());
        }
        if (!reasons.isEmpty()) {
            return result(claim, FactCheckStatus.CONTRADICTED, CONTRADICTED_CONFIDENCE, List.of(),
                    String.join("; ", reasons));
        }
        return verifyOrUnverifiable(claim, conditionIds, factChecker::checkTreatment);
    }

    /**
     * Checks against the conditions named in the query first, then against the whole knowledge base.
     */
    private FactCheckResult verifyOrUnverifiable(ExtractedClaim claim, List<String> conditionIds,
                                                 BiFunction<String, String, FactMatch> checker) {
        List<String> scopes = new ArrayList<>(conditionIds);
        scopes.add(null);
        for (String conditionId : scopes) {
            FactMatch match = checker.apply(claim.text(), conditionId);
            if (match.verified()) {
                return result(claim, FactCheckStatus.VERIFIED, match.confidence(), match.matches(),
                        conditionId == null ? "Matched knowledge base" : "Matched facts for " + conditionId);
            }
        }
        return result(claim, FactCheckStatus.UNVERIFIABLE, UNVERIFIED_CONFIDENCE, List.of(),
                "No matching fact");
    }

    private SemanticReport aggregate(List<ExtractedClaim> claims, List<FactCheckResult> checks) {
        int total = checks.size();
        int verified = 0;
        int contradicted = 0;
        int concerning = 0;
        int unverifiable = 0;
        List<String> triggers = new ArrayList<>();
        for (FactCheckResult check : checks) {
            switch (check.status()) {
                case VERIFIED -> verified++;
                case CONTRADICTED -> {
                    contradicted++;
                    triggers.add("Contradicted claim: " + check.claim());
                }
                case CONCERNING -> {
                    concerning++;
                    triggers.add("Concerning claim: " + check.claim());
                }
                case UNVERIFIABLE -> unverifiable++;
            }
        }

        double accuracy = (double) verified / total;
        double completeness = 1.0 - (double) unverifiable / total;
        double appropriateness = contradicted > 0
                ? Math.max(0.0, 0.7 - (double) contradicted / total * 0.5)
                : 0.8;

        RiskLevel risk = RiskLevel.LOW;
        boolean escalate = false;
        if (contradicted > 0 || concerning >= CONCERNING_HIGH_RISK_COUNT) {
            risk = RiskLevel.HIGH;
            escalate = true;
        } else if (concerning > 0) {
            risk = RiskLevel.MEDIUM;
            escalate = true;
        } else if (unverifiable > total * 0.5) {
            risk = RiskLevel.MEDIUM;
        }

        log.info("Semantic check: claims={} verified={} contradicted={} concerning={} unverifiable={}",
                total, verified, contradicted, concerning, unverifiable);

        return new SemanticReport(
                List.copyOf(claims),
                List.copyOf(checks),
                new QualityMetrics(total, verified, contradicted, unverifiable, concerning),
                new SemanticScores(accuracy, completeness, accuracy, appropriateness),
                risk,
                escalate,
                List.copyOf(triggers),
                sourcesUsed(checks)
        );
    }

    private List<String> sourcesUsed(List<FactCheckResult> checks) {
        Set<String> sourceIds = new LinkedHashSet<>();
        checks.forEach(check -> sourceIds.addAll(check.sourceIds()));
        if (sourceIds.isEmpty()) return List.of();
        try {
            return knowledge.sources().stream()
                    .filter(source -> sourceIds.contains(source.id()))
                    .map(MedicalSource::name)
                    .toList();
        } catch (KnowledgeLookupException e) {
            log.warn("Could not resolve source names: {}", e.getMessage());
            return List.copyOf(sourceIds);
        }
    }

    private List<String> mentionedConditionIds(String query) {
        try {
            return knowledge.findConditionsMentionedIn(query).stream()
                    .map(MedicalCondition::id)
                    .toList();
        } catch (KnowledgeLookupException e) {
            log.warn("Condition lookup failed, checking claims without scope: {}", e.getMessage());
            return List.of();
        }
    }

    private static FactCheckResult result(ExtractedClaim claim, FactCheckStatus status, double confidence,
                                          List<MedicalFact> matches, String details) {
        return new FactCheckResult(
                claim.text(),
                claim.type(),
                status,
                confidence,
                matches.stream().map(MedicalFact::id).toList(),
                matches.stream().map(MedicalFact::sourceId).distinct().toList(),
                details
        );
    }
}
