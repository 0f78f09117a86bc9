package com.jeevo.validation.dto;

import com.jeevo.validation.knowledge.MedicalKnowledgeRepository.MedicalCondition;
import com.jeevo.validation.knowledge.MedicalKnowledgeRepository.MedicalFact;

import java.util.List;

public final class ApiDtos {

    /**
     * Body of {@code POST /api/v1/validations}. Omitted confidence means fully confident,
     * omitted language means English, omitted semantic flag means the semantic stage runs.
     */
    public record ValidateReplyRequest(
            String userId,
            String messageId,
            String userQuery,
            String botResponse,
            Double baselineConfidence,
            String language,
            Boolean useSemantic
    ) {}

    public record CaseNotesRequest(String notes) {}

    public record ExpertRequest(String name, String phoneNumber, String specialization) {}

    public record AvailabilityRequest(boolean available) {}

    public record DisclaimerOverrideRequest(
            String riskLevel,
            String language,
            String content,
            Integer priority
    ) {}

    public record ConditionDetail(MedicalCondition condition, List<MedicalFact> facts) {}

    private ApiDtos() {}
}
