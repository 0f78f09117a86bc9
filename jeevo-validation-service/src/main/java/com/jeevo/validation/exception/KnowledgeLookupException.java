package com.jeevo.validation.exception;

/**
 * The knowledge store could not answer a lookup. Affected claims are treated as unverifiable.
 */
public class KnowledgeLookupException extends RuntimeException {

    public KnowledgeLookupException(String message) {
        super(message);
    }

    public KnowledgeLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
