package com.jeevo.validation.semantic;

import com.jeevo.validation.Fixtures;
import com.jeevo.validation.domain.ClaimType;
import com.jeevo.validation.dto.SemanticDtos.ExtractedClaim;
import com.jeevo.validation.exception.ClaimExtractionException;
import com.jeevo.validation.exception.LlmClientException;
import com.jeevo.validation.llm.LlmClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ClaimExtractorTest {

    private LlmClient llm;
    private ClaimExtractor withLlm;
    private ClaimExtractor withoutLlm;

    @BeforeEach
    void setUp() {
        llm = mock(LlmClient.class);
        withLlm = new ClaimExtractor(Fixtures.llmClient(llm), Fixtures.rules());
        withoutLlm = new ClaimExtractor(Fixtures.llmClient(null), Fixtures.rules());
    }

    @Test
    void shortOrBlankInput_yieldsNoClaims() {
        assertThat(withLlm.extract("Rest.")).isEmpty();
        assertThat(withLlm.extract("   ")).isEmpty();
        assertThat(withLlm.extract(null)).isEmpty();
        verifyNoInteractions(llm);
    }

    @Test
    void withoutLlm_keywordBucketsAreUsed() {
        List<ExtractedClaim> claims = withoutLlm.extract("Rest and drink water");

        assertThat(claims).extracting(ExtractedClaim::type)
                .containsExactly(ClaimType.TREATMENT, ClaimType.PREVENTION);
        assertThat(claims).allSatisfy(claim -> {
            assertThat(claim.text()).isEqualTo("Rest and drink water");
            assertThat(claim.testable()).isTrue();
            assertThat(claim.confidence()).isEqualTo(ClaimExtractor.FALLBACK_CONFIDENCE);
        });
    }

    @Test
    void eachKeywordContributesAtMostOneClaim() {
        List<ExtractedClaim> claims = withoutLlm.extract("Take paracetamol. Take rest. Take fluids.");

        // "take" and "paracetamol" both land on the first sentence, "rest" on the second
        assertThat(claims).extracting(ExtractedClaim::text)
                .containsExactly("Take paracetamol.", "Take paracetamol.", "Take rest.");
    }

    @Test
    void llmReply_isParsedAndUntestableClaimsDropped() {
        when(llm.complete(anyString(), any())).thenReturn("""
                [
                  {"text": "Give ORS after every loose stool", "type": "treatment", "testable": true, "confidence": 0.9},
                  {"text": "Get well soon", "type": "general_info", "testable": false, "confidence": 0.4}
                ]
                """);

        List<ExtractedClaim> claims = withLlm.extract("Give ORS after every loose stool. Get well soon.");

        assertThat(claims).containsExactly(
                new ExtractedClaim("Give ORS after every loose stool", ClaimType.TREATMENT, true, 0.9));
    }

    @Test
    void malformedLlmReply_fallsBackToKeywords() {
        when(llm.complete(anyString(), any())).thenReturn("Sure! Here are the claims: rest, fluids");

        List<ExtractedClaim> claims = withLlm.extract("Rest and drink water");

        assertThat(claims).extracting(ExtractedClaim::confidence).containsOnly(ClaimExtractor.FALLBACK_CONFIDENCE);
        assertThat(claims).hasSize(2);
    }

    @Test
    void unreachableLlm_fallsBackToKeywords() {
        when(llm.complete(anyString(), any())).thenThrow(new LlmClientException("connect timed out"));

        assertThat(withLlm.extract("Rest and drink water")).hasSize(2);
    }

    @Test
    void cancelledLlmCall_propagatesInsteadOfFallingBack() {
        when(llm.complete(anyString(), any())).thenThrow(new CancellationException("LLM call cancelled"));

        assertThatThrownBy(() -> withLlm.extract("Rest and drink water", () -> true))
                .isInstanceOf(CancellationException.class);
    }

    @Test
    void cancellationHook_isHandedToTheLlmClient() {
        BooleanSupplier cancelled = () -> false;
        when(llm.complete(anyString(), same(cancelled))).thenReturn("[]");

        assertThat(withLlm.extract("Rest and drink water", cancelled)).isEmpty();
    }

    @Test
    void strictParser_rejectsOffContractReplies() {
        assertThatThrownBy(() -> withLlm.parseClaims("{\"text\": \"x\"}"))
                .isInstanceOf(ClaimExtractionException.class);
        assertThatThrownBy(() -> withLlm.parseClaims("[{\"text\": \"x\", \"type\": \"treatment\", \"testable\": true}]"))
                .isInstanceOf(ClaimExtractionException.class);
        assertThatThrownBy(() -> withLlm.parseClaims(
                "[{\"text\": \"x\", \"type\": \"treatment\", \"testable\": true, \"confidence\": 1.5}]"))
                .isInstanceOf(ClaimExtractionException.class);
        assertThatThrownBy(() -> withLlm.parseClaims(
                "[{\"text\": \"x\", \"type\": \"astrology\", \"testable\": true, \"confidence\": 0.5}]"))
                .isInstanceOf(ClaimExtractionException.class);
        assertThatThrownBy(() -> withLlm.parseClaims("```json\n[]\n```"))
                .isInstanceOf(ClaimExtractionException.class);
    }

    @Test
    void strictParser_acceptsEmptyArray() {
        assertThat(withLlm.parseClaims("[]")).isEmpty();
    }
}
