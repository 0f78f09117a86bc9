package com.jeevo.validation.messaging;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WhatsAppCloudMessagingGatewayTest {

    @Test
    void unconfiguredGateway_skipsWithoutError() {
        MessagingGateway gateway = new WhatsAppCloudMessagingGateway("http://127.0.0.1:9", "", "", 200);

        assertThatCode(() -> gateway.sendText("+919876543210", "New case #1")).doesNotThrowAnyException();
    }

    @Test
    void configuredGateway_surfacesTransportFailure() {
        // nothing listens on the discard port
        MessagingGateway gateway = new WhatsAppCloudMessagingGateway("http://127.0.0.1:9", "123", "token", 200);

        assertThatThrownBy(() -> gateway.sendText("+919876543210", "New case #1"))
                .isInstanceOf(MessagingException.class);
    }
}
