package com.jeevo.validation.llm;

import java.util.function.BooleanSupplier;

/**
 * Text-completion collaborator. Implementations bound their own call time.
 */
public interface LlmClient {

    /**
     * Abandons the in-flight call once {@code cancelled} reports true.
     *
     * @throws com.jeevo.validation.exception.LlmClientException on transport or protocol failure
     * @throws java.util.concurrent.CancellationException when the caller gave up on the call
     */
    String complete(String prompt, BooleanSupplier cancelled);

    default String complete(String prompt) {
        return complete(prompt, () -> false);
    }
}
