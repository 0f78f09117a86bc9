package com.jeevo.validation.semantic;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jeevo.validation.domain.ClaimType;
import com.jeevo.validation.dto.SemanticDtos.ExtractedClaim;
import com.jeevo.validation.exception.ClaimExtractionException;
import com.jeevo.validation.llm.LlmClient;
import com.jeevo.validation.rules.KeywordMatcher;
import com.jeevo.validation.rules.ValidationRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;
import java.util.regex.Pattern;

/**
 * Turns an answer into testable claims. The LLM path is used when a client is configured;
 * any failure there drops to the keyword buckets of {@link ValidationRules#claimKeywords()}.
 */
@Component
public class ClaimExtractor {

    private static final Logger log = LoggerFactory.getLogger(ClaimExtractor.class);

    static final int MIN_TEXT_LENGTH = 10;
    static final int MIN_CLAIM_LENGTH = 5;
    static final double FALLBACK_CONFIDENCE = 0.7;

    private static final Pattern SENTENCE_SPLIT = Pattern.compile("(?<=[.!?])\\s+|,\\s+|\\n+");
    private static final List<ClaimType> BUCKET_ORDER =
            List.of(ClaimType.TREATMENT, ClaimType.SYMPTOM, ClaimType.PREVENTION, ClaimType.WARNING);

    private static final String PROMPT = """
            Extract every medical claim from the answer below.
            Return ONLY a JSON array, no prose and no code fences. Each element must be an object:
            {"text": "<claim sentence>", "type": "<symptom|treatment|prevention|warning|emergency|diagnosis|general_info>", "testable": <true|false>, "confidence": <number between 0 and 1>}
            A claim is testable when it can be checked against published medical guidance.

            Answer:
            %s
            """;

    private final ObjectProvider<LlmClient> llmClient;
    private final ValidationRules rules;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public ClaimExtractor(ObjectProvider<LlmClient> llmClient, ValidationRules rules) {
        this.llmClient = llmClient;
        this.rules = rules;
    }

    public List<ExtractedClaim> extract(String text) {
        return extract(text, () -> false);
    }

    /**
     * A cancelled LLM call propagates as {@link CancellationException} instead of falling back.
     */
    public List<ExtractedClaim> extract(String text, BooleanSupplier cancelled) {
        if (text == null || text.trim().length() < MIN_TEXT_LENGTH) {
            return List.of();
        }

        LlmClient client = llmClient.getIfAvailable();
        if (client == null) {
            return extractByKeywords(text);
        }

        try {
            List<ExtractedClaim> claims = parseClaims(client.complete(PROMPT.formatted(text), cancelled));
            log.debug("LLM extracted {} testable claims", claims.size());
            return claims;
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("LLM claim extraction failed, using keyword fallback: {}", e.getMessage());
            return extractByKeywords(text);
        }
    }

    /**
     * Strict parse of the LLM reply. Anything off-contract is an extraction failure.
     */
    List<ExtractedClaim> parseClaims(String reply) {
        JsonNode root;
        try {
            root = objectMapper.readTree(reply == null ? "" : reply.trim());
        } catch (JsonProcessingException e) {
            throw new ClaimExtractionException("Claim list is not valid JSON", e);
        }
        if (root == null || !root.isArray()) {
            throw new ClaimExtractionException("Claim list must be a JSON array");
        }

        List<ExtractedClaim> claims = new ArrayList<>();
        for (JsonNode node : root) {
            JsonNode text = node.get("text");
            JsonNode type = node.get("type");
            JsonNode testable = node.get("testable");
            JsonNode confidence = node.get("confidence");
            if (text == null || !text.isTextual() || text.asText().isBlank()
                    || type == null || !type.isTextual()
                    || testable == null || !testable.isBoolean()
                    || confidence == null || !confidence.isNumber()) {
                throw new ClaimExtractionException("Claim does not match the expected shape: " + node);
            }
            double score = confidence.asDouble();
            if (score < 0.0 || score > 1.0) {
                throw new ClaimExtractionException("Claim confidence out of range: " + score);
            }
            ClaimType claimType;
            try {
                claimType = ClaimType.fromValue(type.asText());
            } catch (IllegalArgumentException e) {
                throw new ClaimExtractionException("Unknown claim type: " + type.asText(), e);
            }
            if (testable.asBoolean()) {
                claims.add(new ExtractedClaim(text.asText().trim(), claimType, true, score));
            }
        }
        return claims;
    }

    /**
     * Each keyword contributes at most one claim: the first sentence that contains it.
     */
    List<ExtractedClaim> extractByKeywords(String text) {
        if (text == null || text.trim().length() < MIN_TEXT_LENGTH) {
            return List.of();
        }
        String[] sentences = SENTENCE_SPLIT.split(text.trim());
        Map<ClaimType, List<String>> buckets = rules.claimKeywords();

        Set<ClaimType> order = new LinkedHashSet<>(BUCKET_ORDER);
        order.addAll(buckets.keySet());

        Set<String> usedKeywords = new HashSet<>();
        List<ExtractedClaim> claims = new ArrayList<>();
        for (ClaimType type : order) {
            for (String keyword : buckets.getOrDefault(type, List.of())) {
                if (usedKeywords.contains(keyword) || !KeywordMatcher.containsTerm(text, keyword)) continue;
                for (String sentence : sentences) {
                    String candidate = sentence.trim();
                    if (candidate.length() > MIN_CLAIM_LENGTH && KeywordMatcher.containsTerm(candidate, keyword)) {
                        claims.add(new ExtractedClaim(candidate, type, true, FALLBACK_CONFIDENCE));
                        usedKeywords.add(keyword);
                        break;
                    }
                }
            }
        }
        log.debug("Keyword fallback extracted {} claims", claims.size());
        return claims;
    }
}
