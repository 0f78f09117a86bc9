package com.jeevo.validation.dto;

import com.jeevo.validation.domain.ClaimType;
import com.jeevo.validation.domain.FactCheckStatus;
import com.jeevo.validation.domain.RiskLevel;

import java.util.List;

public final class SemanticDtos {

    public record ExtractedClaim(
            String text,
            ClaimType type,
            boolean testable,
            double confidence
    ) {}

    public record FactCheckResult(
            String claim,
            ClaimType claimType,
            FactCheckStatus status,
            double confidence,
            List<String> matchedFactIds,
            List<String> sourceIds,
            String details
    ) {}

    public record QualityMetrics(
            int totalClaims,
            int verifiedClaims,
            int contradictedClaims,
            int unverifiableClaims,
            int concerningClaims
    ) {}

    public record SemanticScores(
            double semanticConfidence,
            double completeness,
            double accuracy,
            double appropriateness
    ) {}

    public record SemanticReport(
            List<ExtractedClaim> claims,
            List<FactCheckResult> factChecks,
            QualityMetrics metrics,
            SemanticScores scores,
            RiskLevel risk,
            boolean requiresEscalation,
            List<String> triggers,
            List<String> sourcesUsed
    ) {
        public List<String> claimsWithStatus(FactCheckStatus status) {
            return factChecks.stream()
                    .filter(check -> check.status() == status)
                    .map(FactCheckResult::claim)
                    .toList();
        }

        /** Contradicted claims with the contraindication behind each one. */
        public List<String> contradictionDetails() {
            return factChecks.stream()
                    .filter(check -> check.status() == FactCheckStatus.CONTRADICTED)
                    .map(check -> check.details() == null || check.details().isBlank()
                            ? check.claim()
                            : check.claim() + " (" + check.details() + ")")
                    .toList();
        }
    }

    private SemanticDtos() {}
}
