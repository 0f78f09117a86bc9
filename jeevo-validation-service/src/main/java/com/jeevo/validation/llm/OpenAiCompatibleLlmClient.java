package com.jeevo.validation.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jeevo.validation.exception.LlmClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

/**
 * Chat-completions client for OpenAI-compatible endpoints (OpenAI, Groq).
 */
@ConditionalOnProperty(name = "jeevo.llm.enabled", havingValue = "true")
@Component
public class OpenAiCompatibleLlmClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleLlmClient.class);

    private static final String COMPLETIONS_PATH = "/chat/completions";
    private static final long CANCEL_POLL_MS = 50;
    private static final String SYSTEM_PROMPT =
            "You are a precise medical text analyst. Follow the output format exactly.";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;
    private final String model;
    private final long timeoutMs;

    public OpenAiCompatibleLlmClient(@Value("${jeevo.llm.base-url:https://api.groq.com/openai/v1}") String baseUrl,
                                     @Value("${jeevo.llm.api-key:}") String apiKey,
                                     @Value("${jeevo.llm.model:llama-3.3-70b-versatile}") String model,
                                     @Value("${jeevo.llm.timeout-ms:8000}") long timeoutMs) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofMillis(timeoutMs)).build(),
                new ObjectMapper(), baseUrl, apiKey, model, timeoutMs);
    }

    OpenAiCompatibleLlmClient(HttpClient httpClient, ObjectMapper objectMapper,
                              String baseUrl, String apiKey, String model, long timeoutMs) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.model = model;
        this.timeoutMs = timeoutMs;
    }

    @Override
    public String complete(String prompt, BooleanSupplier cancelled) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new LlmClientException("LLM API key is not configured");
        }

        Map<String, Object> body = Map.of(
                "model", model,
                "messages", List.of(
                        Map.of("role", "system", "content", SYSTEM_PROMPT),
                        Map.of("role", "user", "content", prompt)
                ),
                "temperature", 0.0
        );

        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + COMPLETIONS_PATH))
                    .timeout(Duration.ofMillis(timeoutMs))
                    .header("Authorization", "Bearer " + apiKey)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                    .build();

            HttpResponse<String> response = await(
                    httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString()), cancelled);
            if (response.statusCode() / 100 != 2) {
                throw new LlmClientException("LLM endpoint returned HTTP " + response.statusCode());
            }
            return extractContent(objectMapper, response.body());
        } catch (IOException e) {
            throw new LlmClientException("LLM call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmClientException("LLM call interrupted", e);
        }
    }

    /**
     * Waits for the exchange while watching the caller's cancellation flag; cancelling the
     * future aborts the HTTP exchange.
     */
    private HttpResponse<String> await(CompletableFuture<HttpResponse<String>> call, BooleanSupplier cancelled)
            throws IOException, InterruptedException {
        try {
            while (true) {
                if (cancelled.getAsBoolean()) {
                    call.cancel(true);
                    log.debug("LLM call cancelled by caller");
                    throw new CancellationException("LLM call cancelled");
                }
                try {
                    return call.get(CANCEL_POLL_MS, TimeUnit.MILLISECONDS);
                } catch (TimeoutException stillRunning) {
                    log.trace("LLM call still in flight");
                }
            }
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new LlmClientException("LLM call failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            call.cancel(true);
            throw e;
        }
    }

    static String extractContent(ObjectMapper objectMapper, String responseBody) throws IOException {
        JsonNode root = objectMapper.readTree(responseBody);
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new LlmClientException("LLM response has no choices");
        }
        String content = choices.get(0).path("message").path("content").asText("");
        if (content.isBlank()) {
            throw new LlmClientException("LLM response content is empty");
        }
        log.debug("LLM completion received ({} chars)", content.length());
        return content;
    }
}
