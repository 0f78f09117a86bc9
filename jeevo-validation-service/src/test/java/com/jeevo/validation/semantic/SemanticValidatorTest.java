package com.jeevo.validation.semantic;

import com.jeevo.validation.Fixtures;
import com.jeevo.validation.domain.ClaimType;
import com.jeevo.validation.domain.FactCheckStatus;
import com.jeevo.validation.domain.RiskLevel;
import com.jeevo.validation.dto.SemanticDtos.ExtractedClaim;
import com.jeevo.validation.dto.SemanticDtos.FactCheckResult;
import com.jeevo.validation.dto.SemanticDtos.SemanticReport;
import com.jeevo.validation.exception.KnowledgeLookupException;
import com.jeevo.validation.knowledge.FactChecker;
import com.jeevo.validation.knowledge.MedicalKnowledgeRepository;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SemanticValidatorTest {

    private static ClaimExtractor extractor;
    private static SemanticValidator validator;

    @BeforeAll
    static void setUp() {
        MedicalKnowledgeRepository knowledge = Fixtures.knowledge();
        extractor = new ClaimExtractor(Fixtures.llmClient(null), Fixtures.rules());
        validator = new SemanticValidator(extractor, new FactChecker(knowledge), knowledge);
    }

    @Test
    void verifiedClaims_giveFullAccuracyAndLowRisk() {
        SemanticReport report = validator.validate("I have mild headache", "Rest and drink water");

        assertThat(report.metrics().totalClaims()).isEqualTo(2);
        assertThat(report.metrics().verifiedClaims()).isEqualTo(2);
        assertThat(report.scores().accuracy()).isEqualTo(1.0);
        assertThat(report.scores().semanticConfidence()).isEqualTo(1.0);
        assertThat(report.scores().completeness()).isEqualTo(1.0);
        assertThat(report.scores().appropriateness()).isEqualTo(0.8);
        assertThat(report.risk()).isEqualTo(RiskLevel.LOW);
        assertThat(report.requiresEscalation()).isFalse();
        assertThat(report.factChecks()).allSatisfy(check -> assertThat(check.matchedFactIds()).isNotEmpty());
    }

    @Test
    void noClaims_meansLowCompletenessAndNoEscalation() {
        SemanticReport report = validator.validate("hello", "Hello there, how are you?");

        assertThat(report.claims()).isEmpty();
        assertThat(report.scores().completeness()).isEqualTo(0.3);
        assertThat(report.risk()).isEqualTo(RiskLevel.LOW);
        assertThat(report.requiresEscalation()).isFalse();
    }

    @Test
    void warningClaims_areConcerningAndEscalated() {
        SemanticReport report = validator.validate("I feel weak", "This is serious, seek help.");

        assertThat(report.factChecks()).extracting(FactCheckResult::status)
                .containsOnly(FactCheckStatus.CONCERNING);
        assertThat(report.metrics().concerningClaims()).isEqualTo(2);
        assertThat(report.risk()).isEqualTo(RiskLevel.MEDIUM);
        assertThat(report.requiresEscalation()).isTrue();
    }

    @Test
    void threeConcerningClaims_areHighRisk() {
        SemanticReport report = validator.validate("I feel weak", "This is serious, it is dangerous, go immediately.");

        assertThat(report.metrics().concerningClaims()).isEqualTo(3);
        assertThat(report.risk()).isEqualTo(RiskLevel.HIGH);
        assertThat(report.requiresEscalation()).isTrue();
    }

    @Test
    void mostlyUnverifiable_isMediumWithoutEscalation() {
        SemanticReport report = validator.validate("what helps?", "Take homeopathic pills daily.");

        assertThat(report.metrics().unverifiableClaims()).isEqualTo(1);
        assertThat(report.scores().accuracy()).isZero();
        assertThat(report.risk()).isEqualTo(RiskLevel.MEDIUM);
        assertThat(report.requiresEscalation()).isFalse();
    }

    @Test
    void contraindicatedTreatment_isContradicted() {
        SemanticReport report = validator.validate("I have dengue", "Take ibuprofen for the pain.");

        assertThat(report.metrics().contradictedClaims()).isEqualTo(2);
        assertThat(report.contradictionDetails())
                .allSatisfy(detail -> assertThat(detail).contains("Dengue Fever: aspirin and NSAIDs in dengue"));
        assertThat(report.risk()).isEqualTo(RiskLevel.HIGH);
        assertThat(report.requiresEscalation()).isTrue();
        assertThat(report.scores().appropriateness()).isLessThan(0.7);
    }

    @Test
    void unsupportedClaimType_isUnverifiable() {
        FactCheckResult result = validator.check(
                new ExtractedClaim("Looks like a viral infection", ClaimType.DIAGNOSIS, true, 0.8), "", List.of());

        assertThat(result.status()).isEqualTo(FactCheckStatus.UNVERIFIABLE);
        assertThat(result.confidence()).isEqualTo(SemanticValidator.UNSUPPORTED_TYPE_CONFIDENCE);
    }

    @Test
    void knowledgeFailure_marksClaimsUnverifiable() {
        MedicalKnowledgeRepository broken = mock(MedicalKnowledgeRepository.class);
        when(broken.findConditionsMentionedIn(anyString())).thenThrow(new KnowledgeLookupException("down"));
        FactChecker failing = mock(FactChecker.class);
        when(failing.checkContraindications(anyString(), any(), any())).thenThrow(new KnowledgeLookupException("down"));
        when(failing.checkTreatment(anyString(), any())).thenThrow(new KnowledgeLookupException("down"));
        when(failing.checkPrevention(anyString(), any())).thenThrow(new KnowledgeLookupException("down"));

        SemanticReport report = new SemanticValidator(extractor, failing, broken)
                .validate("I have mild headache", "Rest and drink water");

        assertThat(report.factChecks()).allSatisfy(check -> {
            assertThat(check.status()).isEqualTo(FactCheckStatus.UNVERIFIABLE);
            assertThat(check.details()).isEqualTo("Knowledge base unavailable");
        });
        assertThat(report.risk()).isEqualTo(RiskLevel.MEDIUM);
    }

    @Test
    void cancellation_stopsBetweenClaims() {
        assertThatThrownBy(() -> validator.validate("I have mild headache", "Rest and drink water", () -> true))
                .isInstanceOf(CancellationException.class);
    }
}
