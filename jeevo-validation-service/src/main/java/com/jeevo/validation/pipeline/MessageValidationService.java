package com.jeevo.validation.pipeline;

import com.jeevo.validation.domain.Language;
import com.jeevo.validation.domain.RiskLevel;
import com.jeevo.validation.disclaimer.DisclaimerSelector;
import com.jeevo.validation.dto.ValidationDtos.ReplyRequest;
import com.jeevo.validation.dto.ValidationDtos.ValidatedReply;
import com.jeevo.validation.dto.ValidationDtos.ValidationResult;
import com.jeevo.validation.escalation.EscalationManager;
import com.jeevo.validation.escalation.EscalationManager.OpenCaseCommand;
import com.jeevo.validation.orchestrator.ValidationOrchestrator;
import com.jeevo.validation.persistence.Disclaimer;
import com.jeevo.validation.persistence.EscalatedCase;
import com.jeevo.validation.persistence.ResponseValidation;
import com.jeevo.validation.persistence.ResponseValidationRepository;
import com.jeevo.validation.rules.DisclaimerCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one bot answer through validation and acts on the verdict: audit record, disclaimer,
 * escalation case, and the delivery decision. Only the validation itself is bounded by
 * {@code jeevo.validation.timeout-ms}; the follow-up steps each fail independently.
 */
@Service
public class MessageValidationService {

    private static final Logger log = LoggerFactory.getLogger(MessageValidationService.class);

    static final int MAX_AUDIT_PAGE = 200;

    private final ValidationOrchestrator orchestrator;
    private final ResponseValidationRepository validations;
    private final DisclaimerSelector disclaimers;
    private final DisclaimerCatalog catalog;
    private final EscalationManager escalations;
    private final long timeoutMs;
    private final int maxEscalationAttempts;

    public MessageValidationService(ValidationOrchestrator orchestrator,
                                    ResponseValidationRepository validations,
                                    DisclaimerSelector disclaimers,
                                    DisclaimerCatalog catalog,
                                    EscalationManager escalations,
                                    @Value("${jeevo.validation.timeout-ms:10000}") long timeoutMs,
                                    @Value("${jeevo.escalation.max-attempts:2}") int maxEscalationAttempts) {
        this.orchestrator = orchestrator;
        this.validations = validations;
        this.disclaimers = disclaimers;
        this.catalog = catalog;
        this.escalations = escalations;
        this.timeoutMs = timeoutMs;
        this.maxEscalationAttempts = Math.max(1, maxEscalationAttempts);
    }

    public ValidatedReply process(ReplyRequest request) {
        Language language = request.language() == null ? Language.ENGLISH : request.language();
        ValidationResult result = awaitVerdict(request);

        ResponseValidation audit = toAuditRecord(request, language, result);
        Long validationId = persist(audit);

        Disclaimer disclaimer = null;
        if (result.riskLevel() != RiskLevel.LOW) {
            disclaimer = attachDisclaimer(request, language, result);
        }

        Long escalationId = null;
        if (result.requiresEscalation()) {
            escalationId = openCase(request, result, validationId);
            audit.setEscalationFailed(escalationId == null);
        }

        audit.setDisclaimerId(disclaimer == null ? null : disclaimer.getId());
        audit.setEscalationId(escalationId);
        validationId = persist(audit);

        String disclaimerText = disclaimer == null
                ? (result.riskLevel() == RiskLevel.LOW ? null : catalog.defaultText(result.riskLevel(), language))
                : disclaimer.getContent();
        boolean deferred = !result.answerApproved();
        String deliverable = deferred
                ? (disclaimerText == null ? catalog.defaultText(result.riskLevel(), language) : disclaimerText)
                : join(request.botResponse(), disclaimerText);

        log.info("Reply {} for user {}: risk={} deferred={} validation={} case={}",
                request.messageId(), request.userId(), result.riskLevel().value(), deferred, validationId, escalationId);
        return new ValidatedReply(deliverable, deferred, validationId,
                escalationId, disclaimer == null ? null : disclaimer.getId(), result);
    }

    public ResponseValidation getValidation(Long id) {
        return validations.findById(id)
                .orElseThrow(() -> new IllegalArgumentException("Unknown validation: " + id));
    }

    /**
     * Audit query for dashboards. A message id takes precedence over the other filters;
     * otherwise results fall in {@code [from, to]}, newest first.
     */
    public List<ResponseValidation> findValidations(String userId, String messageId, Instant from, Instant to, int limit) {
        if (messageId != null && !messageId.isBlank()) {
            return validations.findByMessageIdOrderByCreatedAtDesc(messageId);
        }
        Instant start = from == null ? Instant.EPOCH : from;
        Instant end = to == null ? Instant.now() : to;
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("'from' must not be after 'to'");
        }
        PageRequest page = PageRequest.of(0, clamp(limit));
        if (userId != null && !userId.isBlank()) {
            return validations.findByUserIdAndCreatedAtBetweenOrderByCreatedAtDesc(userId, start, end, page);
        }
        return validations.findByCreatedAtBetweenOrderByCreatedAtDesc(start, end, page);
    }

    public List<ResponseValidation> escalationCandidates(int limit) {
        return validations.findByRequiresEscalationTrueOrderByCreatedAtDesc(PageRequest.of(0, clamp(limit)));
    }

    private ValidationResult awaitVerdict(ReplyRequest request) {
        CompletableFuture<ValidationResult> future = orchestrator.validateAsync(
                request.userQuery(), request.botResponse(), request.baselineConfidence(), request.useSemantic());
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // the worker polls the future and aborts an in-flight LLM exchange
            future.cancel(true);
            log.warn("Validation of message {} timed out after {} ms", request.messageId(), timeoutMs);
            return ValidationOrchestrator.failClosed("timed out after " + timeoutMs + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("Validation of message {} failed: {}", request.messageId(), cause.getMessage());
            return ValidationOrchestrator.failClosed(cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return ValidationOrchestrator.failClosed("interrupted");
        }
    }

    private Long persist(ResponseValidation audit) {
        try {
            return validations.save(audit).getId();
        } catch (RuntimeException e) {
            log.error("Failed to store validation audit for message {}: {}", audit.getMessageId(), e.getMessage());
            return audit.getId();
        }
    }

    private Disclaimer attachDisclaimer(ReplyRequest request, Language language, ValidationResult result) {
        Disclaimer disclaimer;
        try {
            disclaimer = disclaimers.getDisclaimer(result.riskLevel(), language);
        } catch (RuntimeException e) {
            log.error("No disclaimer for {}/{}, using built-in text: {}",
                    result.riskLevel().value(), language.code(), e.getMessage());
            return null;
        }
        Map<String, String> context = new LinkedHashMap<>();
        context.put("risk_level", result.riskLevel().value());
        context.put("language", language.code());
        context.put("deferred", String.valueOf(!result.answerApproved()));
        if (result.escalationTrigger() != null) {
            context.put("trigger", result.escalationTrigger().value());
        }
        disclaimers.trackShown(request.userId(), disclaimer.getId(), context, request.messageId());
        return disclaimer;
    }

    /**
     * @return the case id, or null when every attempt failed
     */
    private Long openCase(ReplyRequest request, ValidationResult result, Long validationId) {
        Set<String> keywords = new LinkedHashSet<>(result.emergencyKeywordsDetected());
        keywords.addAll(result.highRiskKeywordsDetected());
        OpenCaseCommand command = new OpenCaseCommand(
                request.userId(),
                request.userQuery(),
                request.botResponse(),
                result.riskLevel(),
                result.validationMessage(),
                new ArrayList<>(keywords),
                validationId);

        for (int attempt = 1; attempt <= maxEscalationAttempts; attempt++) {
            try {
                EscalatedCase opened = escalations.openCase(command);
                return opened.getId();
            } catch (RuntimeException e) {
                log.warn("Opening case for validation {} failed (attempt {}/{}): {}",
                        validationId, attempt, maxEscalationAttempts, e.getMessage());
            }
        }
        log.error("Escalation lost for validation {} (user {}, trigger {})", validationId, request.userId(),
                result.escalationTrigger() == null ? "-" : result.escalationTrigger().value());
        return null;
    }

    private static ResponseValidation toAuditRecord(ReplyRequest request, Language language, ValidationResult result) {
        ResponseValidation audit = new ResponseValidation();
        audit.setUserId(request.userId());
        audit.setMessageId(request.messageId());
        audit.setLanguage(language);
        audit.setUserQuery(request.userQuery());
        audit.setBotResponse(request.botResponse());
        audit.setRiskLevel(result.riskLevel());
        audit.setConfidenceScore(result.confidenceScore());
        audit.setRequiresEscalation(result.requiresEscalation());
        audit.setEscalationTrigger(result.escalationTrigger());
        audit.setValidationMessage(result.validationMessage());
        audit.setMatchedRule(result.matchedRule());
        audit.setAnswerApproved(result.answerApproved());
        audit.setSemanticApplied(result.semanticApplied());
        audit.setEmergencyKeywords(new ArrayList<>(result.emergencyKeywordsDetected()));
        audit.setHighRiskKeywords(new ArrayList<>(result.highRiskKeywordsDetected()));
        audit.setVerifiedClaims(new ArrayList<>(result.verifiedClaims()));
        audit.setContradictedClaims(new ArrayList<>(result.contradictedClaims()));
        audit.setSourcesUsed(new ArrayList<>(result.sourcesUsed()));
        if (result.scores() != null) {
            audit.setAccuracyScore(result.scores().accuracy());
            audit.setAppropriatenessScore(result.scores().appropriateness());
            audit.setSemanticConfidence(result.scores().semanticConfidence());
        }
        return audit;
    }

    private static String join(String answer, String disclaimer) {
        String body = answer == null ? "" : answer;
        return disclaimer == null ? body : body + "\n\n" + disclaimer;
    }

    private static int clamp(int limit) {
        return Math.max(1, Math.min(limit, MAX_AUDIT_PAGE));
    }
}
