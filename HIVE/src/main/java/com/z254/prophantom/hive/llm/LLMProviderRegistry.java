package com.z254.prophantom.hive.llm;

import com.z254.prophantom.hive.config.HiveProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry for model-serving providers.
 */
@Component
@Slf4j
public class LLMProviderRegistry {

    private final Map<String, LLMProvider> providers = new HashMap<>();
    private final String defaultProviderId;

    public LLMProviderRegistry(List<LLMProvider> providerList, HiveProperties properties) {
        this.defaultProviderId = properties.getBackend().getDefaultProvider();

        for (LLMProvider provider : providerList) {
            providers.put(provider.getProviderId(), provider);
            log.info("Registered LLM provider: {}", provider.getProviderId());
        }

        log.info("Default LLM provider: {}", defaultProviderId);
    }

    /**
     * Get a provider by ID.
     *
     * @throws IllegalArgumentException if provider not found
     */
    public LLMProvider getProvider(String providerId) {
        LLMProvider provider = providers.get(providerId);
        if (provider == null) {
            throw new IllegalArgumentException("No LLM provider found: " + providerId);
        }
        return provider;
    }

    /**
     * Get a provider, falling back to the default when the id is empty or unknown.
     */
    public LLMProvider getProviderOrDefault(String providerId) {
        if (providerId != null && providers.containsKey(providerId)) {
            return providers.get(providerId);
        }
        return getProvider(defaultProviderId);
    }

    public Collection<LLMProvider> getProviders() {
        return providers.values();
    }
}
