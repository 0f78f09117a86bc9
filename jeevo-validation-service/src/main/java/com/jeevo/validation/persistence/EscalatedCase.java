package com.jeevo.validation.persistence;

import com.jeevo.validation.domain.CaseStatus;
import com.jeevo.validation.domain.RiskLevel;
import com.jeevo.validation.exception.InvalidCaseTransitionException;
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
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Human-review ticket. Status only moves forward; see {@link CaseStatus#canTransitionTo}.
 */
@Entity
@Table(
        name = "escalated_cases",
        indexes = {
                @Index(name = "idx_case_expert_status", columnList = "assigned_expert_id,status"),
                @Index(name = "idx_case_user", columnList = "user_id,created_at"),
                @Index(name = "idx_case_validation", columnList = "validation_id")
        }
)
@Getter
@Setter
public class EscalatedCase {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Version
    private Long version;

    @Column(name = "user_id", length = 64, nullable = false)
    private String userId;

    @Column(name = "validation_id")
    private Long validationId;

    @Lob
    @Column(name = "user_query")
    private String userQuery;

    @Lob
    @Column(name = "bot_response")
    private String botResponse;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", length = 16, nullable = false)
    private RiskLevel severity;

    @Lob
    @Column(name = "reason")
    private String reason;

    @Lob
    @Convert(converter = StringListConverter.class)
    @Column(name = "keywords_triggered")
    private List<String> keywordsTriggered = new ArrayList<>();

    @Column(name = "assigned_expert_id")
    private Long assignedExpertId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 16, nullable = false)
    @Setter(AccessLevel.NONE)
    private CaseStatus status = CaseStatus.OPEN;

    @Lob
    @Column(name = "expert_notes")
    private String expertNotes;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    /**
     * Moves the case forward and stamps the matching timestamp.
     *
     * @throws InvalidCaseTransitionException when the move is not allowed from the current status
     */
    public void transitionTo(CaseStatus target, Instant at) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidCaseTransitionException(id, status, target);
        }
        switch (target) {
            case IN_PROGRESS -> startedAt = at;
            case RESOLVED -> resolvedAt = at;
            case CLOSED -> closedAt = at;
            default -> { }
        }
        status = target;
    }

    @PrePersist
    void prePersist() {
        Instant now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
    }

    @PreUpdate
    void preUpdate() {
        this.updatedAt = Instant.now();
    }
}
