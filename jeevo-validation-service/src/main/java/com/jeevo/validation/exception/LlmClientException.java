package com.jeevo.validation.exception;

/**
 * Transport or protocol failure talking to the chat-completions endpoint.
 */
public class LlmClientException extends RuntimeException {

    public LlmClientException(String message) {
        super(message);
    }

    public LlmClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
