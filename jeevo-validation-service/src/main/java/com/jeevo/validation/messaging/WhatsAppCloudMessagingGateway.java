package com.jeevo.validation.messaging;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sends plain text messages through the WhatsApp Cloud API.
 * Without an access token messages are logged and skipped.
 */
@Component
public class WhatsAppCloudMessagingGateway implements MessagingGateway {

    private static final Logger log = LoggerFactory.getLogger(WhatsAppCloudMessagingGateway.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiUrl;
    private final String phoneNumberId;
    private final String accessToken;
    private final long timeoutMs;

    public WhatsAppCloudMessagingGateway(@Value("${jeevo.whatsapp.api-url:https://graph.facebook.com/v18.0}") String apiUrl,
                                         @Value("${jeevo.whatsapp.phone-number-id:}") String phoneNumberId,
                                         @Value("${jeevo.whatsapp.access-token:}") String accessToken,
                                         @Value("${jeevo.whatsapp.timeout-ms:5000}") long timeoutMs) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(timeoutMs))
                .build();
        this.objectMapper = new ObjectMapper();
        this.apiUrl = apiUrl;
        this.phoneNumberId = phoneNumberId;
        this.accessToken = accessToken;
        this.timeoutMs = timeoutMs;
    }

    @Override
    public void sendText(String phoneNumber, String text) {
        if (accessToken == null || accessToken.isBlank() || phoneNumberId == null || phoneNumberId.isBlank()) {
            log.warn("WhatsApp is not configured; message to {} not sent", mask(phoneNumber));
            return;
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("messaging_product", "whatsapp");
        body.put("recipient_type", "individual");
        body.put("to", phoneNumber);
        body.put("type", "text");
        body.put("text", Map.of("preview_url", false, "body", text));

        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(apiUrl + "/" + phoneNumberId + "/messages"))
                    .timeout(Duration.ofMillis(timeoutMs))
                    .header("Authorization", "Bearer " + accessToken)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                throw new MessagingException("WhatsApp API returned HTTP " + response.statusCode() + ": " + response.body());
            }
            log.info("WhatsApp message sent to {}", mask(phoneNumber));
        } catch (IOException e) {
            throw new MessagingException("WhatsApp send failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MessagingException("WhatsApp send interrupted", e);
        }
    }

    private static String mask(String phoneNumber) {
        if (phoneNumber == null || phoneNumber.length() <= 4) return "****";
        return "****" + phoneNumber.substring(phoneNumber.length() - 4);
    }
}
