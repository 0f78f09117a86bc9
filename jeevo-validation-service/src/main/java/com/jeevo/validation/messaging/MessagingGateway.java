package com.jeevo.validation.messaging;

/**
 * Outbound text channel used to reach experts.
 */
public interface MessagingGateway {

    void sendText(String phoneNumber, String text);
}
