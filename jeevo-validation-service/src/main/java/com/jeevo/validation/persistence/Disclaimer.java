package com.jeevo.validation.persistence;

import com.jeevo.validation.domain.Language;
import com.jeevo.validation.domain.RiskLevel;
import jakarta.persistence.Column;
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
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * Localized disclaimer text. At most one row is active per (risk level, language):
 * {@code active_key} holds {@code RISK:lang} while active and null otherwise, under a unique constraint.
 */
@Entity
@Table(
        name = "disclaimers",
        indexes = @Index(name = "idx_disclaimer_lookup", columnList = "risk_level,language,active,priority")
)
@Getter
@Setter
public class Disclaimer {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "risk_level", length = 16, nullable = false)
    private RiskLevel riskLevel;

    @Enumerated(EnumType.STRING)
    @Column(name = "language", length = 16, nullable = false)
    private Language language;

    @Lob
    @Column(name = "content", nullable = false)
    private String content;

    @Column(name = "priority", nullable = false)
    private int priority = 1;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Setter(AccessLevel.NONE)
    @Column(name = "active_key", length = 32, unique = true)
    private String activeKey;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static String activeKey(RiskLevel riskLevel, Language language) {
        return riskLevel.name() + ":" + language.code();
    }

    @PrePersist
    void prePersist() {
        Instant now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
        syncActiveKey();
    }

    @PreUpdate
    void preUpdate() {
        this.updatedAt = Instant.now();
        syncActiveKey();
    }

    private void syncActiveKey() {
        this.activeKey = active ? activeKey(riskLevel, language) : null;
    }
}
