package com.z254.prophantom.hive.llm;

import reactor.core.publisher.Mono;

/**
 * Interface for model-serving backends.
 * Only {@link ModelBackendAdapter} calls providers directly.
 */
public interface LLMProvider {

    /**
     * Complete a prompt (non-streaming).
     *
     * @param request the completion request
     * @return the completion response
     */
    Mono<LLMResponse> complete(LLMRequest request);

    /**
     * Get the provider ID.
     *
     * @return provider ID (e.g., "ollama")
     */
    String getProviderId();

    /**
     * Check if this provider is currently reachable.
     */
    Mono<Boolean> isAvailable();

    /**
     * Get the default model for this provider.
     */
    String getDefaultModel();

    /**
     * Count tokens in a text (approximate).
     */
    default int countTokens(String text) {
        // Simple approximation: ~4 characters per token
        return text != null ? (int) Math.ceil(text.length() / 4.0) : 0;
    }
}
