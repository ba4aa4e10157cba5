package com.title.reconciliation.llm;

import java.time.Duration;

/**
 * Narrow seam to a large-language-model provider.
 * The engine owns prompt construction and response parsing; implementations own transport.
 */
public interface LLMProvider {

    /**
     * Sends one prompt and returns the model's answer.
     *
     * @param prompt  the complete prompt text
     * @param timeout upper bound the provider should respect for this call
     * @return the completion
     * @throws TransientProviderException on timeouts, 5xx responses, rate limiting or
     *                                    temporary unavailability; the caller may retry
     */
    LLMCompletion complete(String prompt, Duration timeout);

    /**
     * Returns the name/identifier of this provider.
     */
    String getProviderName();

    /**
     * Checks if the provider is available and configured.
     */
    boolean isAvailable();
}
