package com.jeevo.validation.persistence;

import com.jeevo.validation.domain.EscalationTrigger;
import com.jeevo.validation.domain.Language;
import com.jeevo.validation.domain.RiskLevel;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Audit record of one validated reply.
 */
@Entity
@Table(
        name = "response_validations",
        indexes = {
                @Index(name = "idx_rv_user_created", columnList = "user_id,created_at"),
                @Index(name = "idx_rv_message", columnList = "message_id"),
                @Index(name = "idx_rv_created", columnList = "created_at"),
                @Index(name = "idx_rv_escalation", columnList = "requires_escalation,created_at")
        }
)
@Getter
@Setter
public class ResponseValidation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", length = 64, nullable = false)
    private String userId;

    @Column(name = "message_id", length = 128)
    private String messageId;

    @Enumerated(EnumType.STRING)
    @Column(name = "language", length = 16)
    private Language language;

    @Lob
    @Column(name = "user_query")
    private String userQuery;

    @Lob
    @Column(name = "bot_response")
    private String botResponse;

    @Enumerated(EnumType.STRING)
    @Column(name = "risk_level", length = 16, nullable = false)
    private RiskLevel riskLevel;

    @Column(name = "confidence_score", nullable = false)
    private double confidenceScore;

    @Column(name = "requires_escalation", nullable = false)
    private boolean requiresEscalation;

    @Enumerated(EnumType.STRING)
    @Column(name = "escalation_trigger", length = 48)
    private EscalationTrigger escalationTrigger;

    @Lob
    @Column(name = "validation_message")
    private String validationMessage;

    @Column(name = "matched_rule", length = 64)
    private String matchedRule;

    @Column(name = "answer_approved", nullable = false)
    private boolean answerApproved;

    @Column(name = "semantic_applied", nullable = false)
    private boolean semanticApplied;

    @Lob
    @Convert(converter = StringListConverter.class)
    @Column(name = "emergency_keywords")
    private List<String> emergencyKeywords = new ArrayList<>();

    @Lob
    @Convert(converter = StringListConverter.class)
    @Column(name = "high_risk_keywords")
    private List<String> highRiskKeywords = new ArrayList<>();

    @Lob
    @Convert(converter = StringListConverter.class)
    @Column(name = "verified_claims")
    private List<String> verifiedClaims = new ArrayList<>();

    @Lob
    @Convert(converter = StringListConverter.class)
    @Column(name = "contradicted_claims")
    private List<String> contradictedClaims = new ArrayList<>();

    @Lob
    @Convert(converter = StringListConverter.class)
    @Column(name = "sources_used")
    private List<String> sourcesUsed = new ArrayList<>();

    @Column(name = "accuracy_score")
    private Double accuracyScore;

    @Column(name = "appropriateness_score")
    private Double appropriatenessScore;

    @Column(name = "semantic_confidence")
    private Double semanticConfidence;

    @Column(name = "disclaimer_id")
    private Long disclaimerId;

    @Column(name = "escalation_id")
    private Long escalationId;

    @Column(name = "escalation_failed", nullable = false)
    private boolean escalationFailed;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    void prePersist() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }
}
