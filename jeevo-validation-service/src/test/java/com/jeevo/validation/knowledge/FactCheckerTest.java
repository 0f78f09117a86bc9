package com.jeevo.validation.knowledge;

import com.jeevo.validation.Fixtures;
import com.jeevo.validation.knowledge.FactChecker.ContraindicationCheck;
import com.jeevo.validation.knowledge.FactChecker.FactMatch;
import com.jeevo.validation.knowledge.MedicalKnowledgeRepository.MedicalFact;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FactCheckerTest {

    private static FactChecker checker;

    @BeforeAll
    static void load() {
        checker = new FactChecker(Fixtures.knowledge());
    }

    @Test
    void treatmentClaim_matchingFactText_isVerifiedWithDefaultConfidence() {
        FactMatch match = checker.checkTreatment("Give ORS after every loose stool", "diarrhea");

        assertThat(match.verified()).isTrue();
        assertThat(match.confidence()).isEqualTo(FactChecker.DEFAULT_FACT_CONFIDENCE);
        assertThat(match.matches()).extracting(MedicalFact::sourceId).containsExactlyInAnyOrder("WHO", "MOH_INDIA");
    }

    @Test
    void curatedConfidence_isAveraged() {
        FactMatch match = checker.checkPrevention("sleep under insecticide-treated bed nets", "malaria");

        assertThat(match.verified()).isTrue();
        // "insecticide-treated bed nets" (0.95) plus three sourced "treated bed nets" facts (0.8)
        assertThat(match.confidence()).isCloseTo((0.95 + 0.8 * 3) / 4, within(1e-9));
    }

    @Test
    void shortClaimContainedInFact_alsoMatches() {
        FactMatch match = checker.checkSymptom("night sweats", "tuberculosis");

        assertThat(match.verified()).isTrue();
    }

    @Test
    void unrelatedClaim_isNotVerified() {
        FactMatch match = checker.checkSymptom("blue fingernails", "fever");

        assertThat(match.verified()).isFalse();
        assertThat(match.confidence()).isZero();
        assertThat(match.matches()).isEmpty();
    }

    @Test
    void claimScopedToOtherCondition_isNotVerified() {
        assertThat(checker.checkTreatment("take metformin daily", "fever").verified()).isFalse();
        assertThat(checker.checkTreatment("take metformin daily", "diabetes").verified()).isTrue();
        assertThat(checker.checkTreatment("take metformin daily", null).verified()).isTrue();
    }

    @Test
    void contraindication_withoutPopulation_firesOnSubstance() {
        ContraindicationCheck check = checker.checkContraindications("take ibuprofen for pain", "dengue");

        assertThat(check.flagged()).isTrue();
        assertThat(check.reasons()).containsExactly("Dengue Fever: aspirin and NSAIDs in dengue (bleeding risk)");
    }

    @Test
    void populationScopedContraindication_needsPopulationInContext() {
        assertThat(checker.checkContraindications("give aspirin", "fever").flagged()).isFalse();
        assertThat(checker.checkContraindications("give aspirin", "fever", "my child has fever").flagged()).isTrue();
        assertThat(checker.checkContraindications("give aspirin to the baby", "fever").flagged()).isTrue();
    }

    @Test
    void unknownConditionOrBlankTreatment_isClear() {
        assertThat(checker.checkContraindications("aspirin", "unknown").flagged()).isFalse();
        assertThat(checker.checkContraindications(" ", "dengue").flagged()).isFalse();
    }
}
