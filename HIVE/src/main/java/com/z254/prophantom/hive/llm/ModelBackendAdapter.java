package com.z254.prophantom.hive.llm;

import com.z254.prophantom.hive.common.exception.AgentUnavailableException;
import com.z254.prophantom.hive.common.exception.BackendTimeoutException;
import com.z254.prophantom.hive.observability.StructuredLogger;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * The single gateway to the external model-serving process.
 * <p>
 * One call is one attempt: it is bounded by the caller's timeout and guarded by a
 * circuit breaker per agent type, so a failing model only affects its own agent.
 * Failures are mapped to {@link BackendTimeoutException} or {@link AgentUnavailableException}.
 */
@Component
@Slf4j
public class ModelBackendAdapter {

    private static final String BREAKER_PREFIX = "agent-";

    private final LLMProviderRegistry providerRegistry;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final StructuredLogger structuredLogger;

    public ModelBackendAdapter(LLMProviderRegistry providerRegistry,
                               CircuitBreakerRegistry circuitBreakerRegistry,
                               StructuredLogger structuredLogger) {
        this.providerRegistry = providerRegistry;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.structuredLogger = structuredLogger;
    }

    public Mono<LLMResponse> generate(PromptContext prompt, GenerationConstraints constraints) {
        return Mono.defer(() -> {
            LLMProvider provider = providerRegistry.getProviderOrDefault(constraints.getProvider());
            CircuitBreaker breaker = circuitBreakerRegistry.circuitBreaker(BREAKER_PREFIX + prompt.getAgentType());
            LLMRequest request = toRequest(prompt, constraints, provider);
            int promptTokens = request.getMessages().stream()
                    .mapToInt(message -> provider.countTokens(message.getContent()))
                    .sum();
            long start = System.currentTimeMillis();

            return provider.complete(request)
                    .timeout(constraints.getTimeout())
                    .transformDeferred(CircuitBreakerOperator.of(breaker))
                    .doOnSuccess(response -> structuredLogger.logBackendCall(provider.getProviderId(),
                            request.getModel(), promptTokens,
                            response != null && response.getUsage() != null
                                    ? response.getUsage().getCompletionTokens() : 0,
                            System.currentTimeMillis() - start, true))
                    .doOnError(e -> structuredLogger.logBackendCall(provider.getProviderId(),
                            request.getModel(), promptTokens, 0, System.currentTimeMillis() - start, false))
                    .switchIfEmpty(Mono.error(() -> new IllegalStateException("Backend returned no response")));
        }).onErrorMap(e -> translate(e, prompt, constraints));
    }

    private Throwable translate(Throwable error, PromptContext prompt, GenerationConstraints constraints) {
        if (error instanceof BackendTimeoutException || error instanceof AgentUnavailableException) {
            return error;
        }
        if (error instanceof TimeoutException) {
            log.warn("Backend call for {} timed out after {}", prompt.getAgentType(), constraints.getTimeout());
            return new BackendTimeoutException(prompt.getAgentType(), constraints.getTimeout());
        }
        if (error instanceof CallNotPermittedException) {
            log.warn("Circuit open for agent {}", prompt.getAgentType());
        } else {
            log.warn("Backend call for {} failed: {}", prompt.getAgentType(), error.getMessage());
        }
        return new AgentUnavailableException(prompt.getAgentType(), error);
    }

    private LLMRequest toRequest(PromptContext prompt, GenerationConstraints constraints, LLMProvider provider) {
        List<LLMRequest.Message> messages = new ArrayList<>();
        if (prompt.getSystemPrompt() != null && !prompt.getSystemPrompt().isBlank()) {
            messages.add(LLMRequest.systemMessage(prompt.getSystemPrompt()));
        }
        if (prompt.getMemoryContext() != null && !prompt.getMemoryContext().isBlank()) {
            messages.add(LLMRequest.systemMessage(prompt.getMemoryContext()));
        }
        messages.add(LLMRequest.userMessage(prompt.getUserMessage()));

        return LLMRequest.builder()
                .model(constraints.getModel() != null ? constraints.getModel() : provider.getDefaultModel())
                .messages(messages)
                .temperature(constraints.getTemperature())
                .maxTokens(constraints.getMaxTokens())
                .user(prompt.getUserId())
                .build();
    }
}
