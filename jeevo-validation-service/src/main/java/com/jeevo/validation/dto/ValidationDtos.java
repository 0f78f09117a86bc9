package com.jeevo.validation.dto;

import com.jeevo.validation.domain.EscalationTrigger;
import com.jeevo.validation.domain.Language;
import com.jeevo.validation.domain.RiskLevel;

import java.util.List;

public final class ValidationDtos {

    public record ValidationScores(
            double accuracy,
            double appropriateness,
            double semanticConfidence
    ) {}

    /**
     * Final verdict for one (query, answer) pair. {@code scores} is null when the semantic stage did not run.
     */
    public record ValidationResult(
            RiskLevel riskLevel,
            double confidenceScore,
            boolean requiresEscalation,
            EscalationTrigger escalationTrigger,
            String validationMessage,
            String matchedRule,
            boolean answerApproved,
            boolean semanticApplied,
            List<String> emergencyKeywordsDetected,
            List<String> highRiskKeywordsDetected,
            List<String> medicalConditionsDetected,
            List<String> verifiedClaims,
            List<String> contradictedClaims,
            ValidationScores scores,
            List<String> sourcesUsed
    ) {}

    /** One bot answer to check before it is sent. */
    public record ReplyRequest(
            String userId,
            String messageId,
            String userQuery,
            String botResponse,
            double baselineConfidence,
            Language language,
            boolean useSemantic
    ) {}

    /**
     * What the caller should send. When {@code deferred} is true the answer was withheld and
     * {@code deliverableText} holds only the disclaimer.
     */
    public record ValidatedReply(
            String deliverableText,
            boolean deferred,
            Long validationId,
            Long escalationId,
            Long disclaimerId,
            ValidationResult result
    ) {}

    private ValidationDtos() {}
}
