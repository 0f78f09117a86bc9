package com.jeevo.validation.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Append-only proof that a user was shown a disclaimer.
 */
@Entity
@Table(
        name = "disclaimer_tracking",
        indexes = {
                @Index(name = "idx_dt_user_shown", columnList = "user_id,shown_at"),
                @Index(name = "idx_dt_message", columnList = "message_id")
        }
)
@Getter
@Setter
public class DisclaimerTracking {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", length = 64, nullable = false)
    private String userId;

    @Column(name = "disclaimer_id", nullable = false)
    private Long disclaimerId;

    @Column(name = "message_id", length = 128)
    private String messageId;

    @Convert(converter = StringMapConverter.class)
    @Column(name = "context", length = 4096)
    private Map<String, String> context = new LinkedHashMap<>();

    @Column(name = "shown_at", nullable = false)
    private Instant shownAt;

    @PrePersist
    void prePersist() {
        if (this.shownAt == null) {
            this.shownAt = Instant.now();
        }
    }
}
