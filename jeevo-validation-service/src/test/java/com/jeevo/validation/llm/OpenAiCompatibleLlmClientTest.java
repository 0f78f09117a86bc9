package com.jeevo.validation.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jeevo.validation.exception.LlmClientException;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class OpenAiCompatibleLlmClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private OpenAiCompatibleLlmClient clientReturning(CompletableFuture<HttpResponse<String>> exchange) {
        HttpClient http = mock(HttpClient.class);
        when(http.<String>sendAsync(any(HttpRequest.class), any())).thenReturn(exchange);
        return new OpenAiCompatibleLlmClient(http, objectMapper,
                "https://api.groq.com/openai/v1", "test-key", "llama-3.3-70b-versatile", 8000);
    }

    private static HttpResponse<String> response(int status, String body) {
        HttpResponse<String> response = mock();
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        return response;
    }

    @Test
    void extractContent_readsFirstChoice() throws Exception {
        String body = """
                {"id": "chatcmpl-1", "choices": [
                  {"index": 0, "message": {"role": "assistant", "content": "[]"}},
                  {"index": 1, "message": {"role": "assistant", "content": "ignored"}}
                ]}
                """;

        assertThat(OpenAiCompatibleLlmClient.extractContent(objectMapper, body)).isEqualTo("[]");
    }

    @Test
    void extractContent_withoutChoicesFails() {
        assertThatThrownBy(() -> OpenAiCompatibleLlmClient.extractContent(objectMapper, "{\"choices\": []}"))
                .isInstanceOf(LlmClientException.class)
                .hasMessage("LLM response has no choices");
    }

    @Test
    void extractContent_blankContentFails() {
        String body = "{\"choices\": [{\"message\": {\"content\": \"  \"}}]}";

        assertThatThrownBy(() -> OpenAiCompatibleLlmClient.extractContent(objectMapper, body))
                .isInstanceOf(LlmClientException.class)
                .hasMessage("LLM response content is empty");
    }

    @Test
    void complete_withoutApiKeyFailsFast() {
        OpenAiCompatibleLlmClient client = new OpenAiCompatibleLlmClient(HttpClient.newHttpClient(), objectMapper,
                "https://api.groq.com/openai/v1/", "", "llama-3.3-70b-versatile", 1000);

        assertThatThrownBy(() -> client.complete("extract claims"))
                .isInstanceOf(LlmClientException.class)
                .hasMessageContaining("not configured");
    }

    @Test
    void complete_returnsAssistantContent() {
        OpenAiCompatibleLlmClient client = clientReturning(CompletableFuture.completedFuture(
                response(200, "{\"choices\": [{\"message\": {\"content\": \"[]\"}}]}")));

        assertThat(client.complete("extract claims")).isEqualTo("[]");
    }

    @Test
    void complete_nonSuccessStatusFails() {
        OpenAiCompatibleLlmClient client = clientReturning(CompletableFuture.completedFuture(response(503, "")));

        assertThatThrownBy(() -> client.complete("extract claims"))
                .isInstanceOf(LlmClientException.class)
                .hasMessage("LLM endpoint returned HTTP 503");
    }

    @Test
    void complete_transportTimeoutIsWrapped() {
        OpenAiCompatibleLlmClient client = clientReturning(
                CompletableFuture.failedFuture(new HttpTimeoutException("request timed out")));

        assertThatThrownBy(() -> client.complete("extract claims"))
                .isInstanceOf(LlmClientException.class)
                .hasMessageContaining("request timed out");
    }

    @Test
    void complete_callerGivingUp_cancelsTheExchange() {
        CompletableFuture<HttpResponse<String>> exchange = new CompletableFuture<>();
        OpenAiCompatibleLlmClient client = clientReturning(exchange);
        AtomicInteger polls = new AtomicInteger();
        BooleanSupplier cancelled = () -> polls.incrementAndGet() > 2;

        assertThatThrownBy(() -> client.complete("extract claims", cancelled))
                .isInstanceOf(CancellationException.class);
        assertThat(exchange.isCancelled()).isTrue();
    }
}
