package com.jeevo.validation.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CaseStatusTest {

    @Test
    void statusOnlyMovesForward() {
        assertThat(CaseStatus.OPEN.canTransitionTo(CaseStatus.IN_PROGRESS)).isTrue();
        assertThat(CaseStatus.OPEN.canTransitionTo(CaseStatus.RESOLVED)).isTrue();
        assertThat(CaseStatus.OPEN.canTransitionTo(CaseStatus.CLOSED)).isTrue();
        assertThat(CaseStatus.IN_PROGRESS.canTransitionTo(CaseStatus.RESOLVED)).isTrue();
        assertThat(CaseStatus.IN_PROGRESS.canTransitionTo(CaseStatus.CLOSED)).isTrue();

        assertThat(CaseStatus.IN_PROGRESS.canTransitionTo(CaseStatus.OPEN)).isFalse();
        assertThat(CaseStatus.OPEN.canTransitionTo(CaseStatus.OPEN)).isFalse();
        for (CaseStatus target : CaseStatus.values()) {
            assertThat(CaseStatus.RESOLVED.canTransitionTo(target)).isFalse();
            assertThat(CaseStatus.CLOSED.canTransitionTo(target)).isFalse();
        }
    }

    @Test
    void pendingMeansOpenOrInProgress() {
        assertThat(CaseStatus.PENDING).containsExactlyInAnyOrder(CaseStatus.OPEN, CaseStatus.IN_PROGRESS);
        assertThat(CaseStatus.RESOLVED.isTerminal()).isTrue();
        assertThat(CaseStatus.OPEN.isTerminal()).isFalse();
    }

    @Test
    void enumsParseFromWireValues() {
        assertThat(RiskLevel.fromValue(" High ")).isEqualTo(RiskLevel.HIGH);
        assertThat(RiskLevel.CRITICAL.isAtLeast(RiskLevel.HIGH)).isTrue();
        assertThat(ClaimType.fromValue("general-info")).isEqualTo(ClaimType.GENERAL_INFO);
        assertThat(Language.fromCode("ta")).isEqualTo(Language.TAMIL);
        assertThat(Language.fromCode("xx")).isEqualTo(Language.ENGLISH);
    }
}
