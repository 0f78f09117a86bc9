package com.jeevo.validation.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Escalated case lifecycle. Status only moves forward: open, then in_progress, then resolved or closed.
 */
public enum CaseStatus {
    OPEN,
    IN_PROGRESS,
    RESOLVED,
    CLOSED;

    public static final Set<CaseStatus> PENDING = EnumSet.of(OPEN, IN_PROGRESS);

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == RESOLVED || this == CLOSED;
    }

    public boolean canTransitionTo(CaseStatus target) {
        return switch (this) {
            case OPEN -> target == IN_PROGRESS || target == RESOLVED || target == CLOSED;
            case IN_PROGRESS -> target == RESOLVED || target == CLOSED;
            case RESOLVED, CLOSED -> false;
        };
    }
}
