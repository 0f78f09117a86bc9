package com.jeevo.validation.exception;

public class ClaimExtractionException extends RuntimeException {

    public ClaimExtractionException(String message) {
        super(message);
    }

    public ClaimExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
