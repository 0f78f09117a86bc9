package com.jeevo.validation.orchestrator;

import com.jeevo.validation.domain.EscalationTrigger;
import com.jeevo.validation.domain.FactCheckStatus;
import com.jeevo.validation.domain.RiskLevel;
import com.jeevo.validation.dto.SemanticDtos.SemanticReport;
import com.jeevo.validation.dto.ValidationDtos.ValidationResult;
import com.jeevo.validation.dto.ValidationDtos.ValidationScores;
import com.jeevo.validation.orchestrator.RuleLadder.Decision;
import com.jeevo.validation.rules.DangerousCombination;
import com.jeevo.validation.semantic.SemanticValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.BooleanSupplier;

import static com.jeevo.validation.config.AsyncConfig.VALIDATION_EXECUTOR;

/**
 * Entry point of answer validation: keyword ladder first, then the optional semantic stage.
 * Any unexpected failure yields a high-risk, escalated result instead of an exception.
 */
@Service
public class ValidationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ValidationOrchestrator.class);

    static final String VALIDATION_ERROR_RULE = "validation_error";
    static final double ACCURACY_FLOOR = 0.5;
    static final double ACCURACY_APPROVAL = 0.7;

    private final SignalScanner scanner;
    private final RuleLadder ladder;
    private final SemanticValidator semanticValidator;
    private final Executor executor;
    private final boolean semanticEnabled;

    @Autowired
    public ValidationOrchestrator(SignalScanner scanner,
                                  SemanticValidator semanticValidator,
                                  @Qualifier(VALIDATION_EXECUTOR) Executor executor,
                                  @Value("${jeevo.validation.semantic-enabled:true}") boolean semanticEnabled) {
        this(scanner, StandardRules.ladder(), semanticValidator, executor, semanticEnabled);
    }

    ValidationOrchestrator(SignalScanner scanner, RuleLadder ladder, SemanticValidator semanticValidator,
                           Executor executor, boolean semanticEnabled) {
        this.scanner = scanner;
        this.ladder = ladder;
        this.semanticValidator = semanticValidator;
        this.executor = executor;
        this.semanticEnabled = semanticEnabled;
    }

    public List<String> ruleNames() {
        return ladder.ruleNames();
    }

    public ValidationResult validate(String userQuery, String botResponse, double baselineConfidence, boolean useSemantic) {
        return validate(userQuery, botResponse, baselineConfidence, useSemantic, () -> false);
    }

    /**
     * @param cancelled polled between stages; once true the call ends with {@link CancellationException}
     */
    public ValidationResult validate(String userQuery, String botResponse, double baselineConfidence,
                                     boolean useSemantic, BooleanSupplier cancelled) {
        long start = System.nanoTime();
        try {
            checkCancelled(cancelled);
            if (Double.isNaN(baselineConfidence) || baselineConfidence < 0.0 || baselineConfidence > 1.0) {
                throw new IllegalArgumentException("Baseline confidence must be within [0, 1]: " + baselineConfidence);
            }
            String query = userQuery == null ? "" : userQuery;
            String response = botResponse == null ? "" : botResponse;

            HeuristicSignals signals = scanner.scan(query, response, baselineConfidence);
            Decision decision = ladder.evaluate(signals);
            Draft draft = new Draft(decision, signals);

            if (useSemantic && semanticEnabled && !decision.verdict().definitive()) {
                checkCancelled(cancelled);
                applySemantic(draft, query, response, cancelled);
            }

            checkCancelled(cancelled);
            ValidationResult result = draft.toResult();
            log.info("Validation: risk={} escalate={} trigger={} rule={} semantic={} in {} ms",
                    result.riskLevel().value(), result.requiresEscalation(),
                    result.escalationTrigger() == null ? "-" : result.escalationTrigger().value(),
                    result.matchedRule(), result.semanticApplied(), (System.nanoTime() - start) / 1_000_000);
            return result;
        } catch (CancellationException e) {
            log.debug("Validation cancelled");
            throw e;
        } catch (Exception e) {
            log.error("Validation failed, escalating as a precaution", e);
            return failClosed(e.getMessage());
        }
    }

    /**
     * Runs {@link #validate} on the validation executor. Cancelling the returned future stops the
     * work at the next stage boundary and no result is produced.
     */
    public CompletableFuture<ValidationResult> validateAsync(String userQuery, String botResponse,
                                                             double baselineConfidence, boolean useSemantic) {
        CompletableFuture<ValidationResult> future = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                if (future.isCancelled()) return;
                try {
                    future.complete(validate(userQuery, botResponse, baselineConfidence, useSemantic, future::isCancelled));
                } catch (CancellationException e) {
                    future.cancel(false);
                } catch (RuntimeException e) {
                    future.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Validation executor saturated: {}", e.getMessage());
            future.completeExceptionally(e);
        }
        return future;
    }

    public static ValidationResult failClosed(String reason) {
        return new ValidationResult(
                RiskLevel.HIGH,
                0.0,
                true,
                EscalationTrigger.VALIDATION_ERROR,
                "Validation error: " + (reason == null ? "unknown" : reason),
                VALIDATION_ERROR_RULE,
                false,
                false,
                List.of(),
                List.of(),
                List.of(),
                List.of(),
                List.of(),
                null,
                List.of()
        );
    }

    private void applySemantic(Draft draft, String query, String response, BooleanSupplier cancelled) {
        SemanticReport report;
        try {
            report = semanticValidator.validate(query, response, cancelled);
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Semantic stage failed, keeping heuristic verdict: {}", e.getMessage());
            return;
        }

        draft.semanticApplied = true;
        draft.verifiedClaims.addAll(report.claimsWithStatus(FactCheckStatus.VERIFIED));
        draft.contradictedClaims.addAll(report.contradictionDetails());
        draft.sourcesUsed = report.sourcesUsed();
        draft.scores = new ValidationScores(report.scores().accuracy(), report.scores().appropriateness(),
                report.scores().semanticConfidence());

        double accuracy = report.scores().accuracy();
        if (report.metrics().contradictedClaims() > 0) {
            draft.risk = RiskLevel.HIGH;
            draft.escalate = true;
            draft.trigger = EscalationTrigger.CONTRADICTIONS_DETECTED;
            draft.answerApproved = false;
            draft.message = "Contradicted claims: " + String.join("; ", report.contradictionDetails());
        } else if (accuracy < ACCURACY_FLOOR) {
            draft.risk = RiskLevel.HIGH;
            draft.escalate = true;
            draft.trigger = EscalationTrigger.LOW_ACCURACY_RESPONSE;
            draft.message = "Low accuracy against medical sources (" + format(accuracy) + ")";
        } else if (accuracy > ACCURACY_APPROVAL && report.metrics().verifiedClaims() > 0) {
            draft.risk = RiskLevel.LOW;
            draft.escalate = false;
            draft.trigger = null;
            draft.answerApproved = true;
            draft.message = "Claims verified against medical sources (" + format(accuracy) + ")";
        }
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    private static void checkCancelled(BooleanSupplier cancelled) {
        if (cancelled.getAsBoolean()) {
            throw new CancellationException("Validation cancelled");
        }
    }

    /** Mutable working copy of a verdict while the stages run. */
    private static final class Draft {
        private final String matchedRule;
        private final double confidence;
        private final HeuristicSignals signals;
        private RiskLevel risk;
        private boolean escalate;
        private EscalationTrigger trigger;
        private String message;
        private boolean answerApproved;
        private boolean semanticApplied;
        private final List<String> verifiedClaims = new ArrayList<>();
        private final List<String> contradictedClaims = new ArrayList<>();
        private ValidationScores scores;
        private List<String> sourcesUsed = List.of();

        private Draft(Decision decision, HeuristicSignals signals) {
            Verdict verdict = decision.verdict();
            this.matchedRule = decision.ruleName();
            this.signals = signals;
            this.risk = verdict.risk();
            this.escalate = verdict.escalate();
            this.trigger = verdict.trigger();
            this.message = verdict.message();
            this.answerApproved = verdict.answerApproved();
            this.confidence = verdict.trigger() == EscalationTrigger.EMERGENCY_KEYWORDS ? 1.0 : signals.baselineConfidence();
            signals.dangerousCombinations().stream()
                    .map(DangerousCombination::describe)
                    .forEach(contradictedClaims::add);
        }

        private ValidationResult toResult() {
            return new ValidationResult(
                    risk,
                    confidence,
                    escalate,
                    trigger,
                    message,
                    matchedRule,
                    answerApproved,
                    semanticApplied,
                    signals.allEmergencyKeywords(),
                    signals.highRiskKeywords(),
                    signals.medicalConditions(),
                    List.copyOf(verifiedClaims),
                    List.copyOf(contradictedClaims),
                    scores,
                    sourcesUsed
            );
        }
    }
}
