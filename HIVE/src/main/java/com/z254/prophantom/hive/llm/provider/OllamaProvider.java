package com.z254.prophantom.hive.llm.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.prophantom.hive.config.HiveProperties;
import com.z254.prophantom.hive.llm.LLMProvider;
import com.z254.prophantom.hive.llm.LLMRequest;
import com.z254.prophantom.hive.llm.LLMResponse;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Ollama provider. Serves every agent model from a local Ollama instance.
 * Timeouts are imposed by the caller, not here.
 */
@Component
@ConditionalOnProperty(prefix = "hive.backend.ollama", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class OllamaProvider implements LLMProvider {

    private static final String PROVIDER_ID = "ollama";
    private static final String CHAT_PATH = "/api/chat";
    private static final String TAGS_PATH = "/api/tags";

    private final WebClient webClient;
    private final HiveProperties.OllamaProperties config;
    private final Timer callTimer;
    private final Counter callCounter;
    private final Counter errorCounter;

    public OllamaProvider(HiveProperties properties,
                          WebClient.Builder webClientBuilder,
                          MeterRegistry meterRegistry) {
        this.config = properties.getBackend().getOllama();

        this.webClient = webClientBuilder
                .baseUrl(config.getBaseUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();

        this.callTimer = Timer.builder("hive.backend.call.latency")
                .tag("provider", PROVIDER_ID)
                .register(meterRegistry);
        this.callCounter = Counter.builder("hive.backend.calls")
                .tag("provider", PROVIDER_ID)
                .register(meterRegistry);
        this.errorCounter = Counter.builder("hive.backend.errors")
                .tag("provider", PROVIDER_ID)
                .register(meterRegistry);
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public String getDefaultModel() {
        return config.getModel();
    }

    @Override
    public Mono<LLMResponse> complete(LLMRequest request) {
        return Mono.defer(() -> {
            callCounter.increment();
            long startTime = System.currentTimeMillis();

            return webClient.post()
                    .uri(CHAT_PATH)
                    .bodyValue(buildRequestBody(request))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .map(json -> parseResponse(json, request, startTime))
                    .doOnSuccess(response -> {
                        long duration = System.currentTimeMillis() - startTime;
                        callTimer.record(Duration.ofMillis(duration));
                        log.debug("Ollama completion: {}ms", duration);
                    })
                    .doOnError(e -> {
                        errorCounter.increment();
                        log.error("Ollama completion error: {}", e.getMessage());
                    });
        });
    }

    @Override
    public Mono<Boolean> isAvailable() {
        return webClient.get()
                .uri(TAGS_PATH)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(Duration.ofSeconds(5))
                .map(json -> true)
                .onErrorReturn(false);
    }

    Map<String, Object> buildRequestBody(LLMRequest request) {
        Map<String, Object> body = new HashMap<>();

        body.put("model", request.getModel() != null ? request.getModel() : config.getModel());
        body.put("stream", false);

        List<Map<String, Object>> messages = request.getMessages().stream()
                .map(message -> Map.<String, Object>of(
                        "role", message.getRole(),
                        "content", message.getContent() != null ? message.getContent() : ""))
                .collect(Collectors.toList());
        body.put("messages", messages);

        Map<String, Object> options = new HashMap<>();
        if (request.getTemperature() != null) {
            options.put("temperature", request.getTemperature());
        }
        if (request.getMaxTokens() != null) {
            options.put("num_predict", request.getMaxTokens());
        }
        if (!options.isEmpty()) {
            body.put("options", options);
        }
        return body;
    }

    LLMResponse parseResponse(JsonNode json, LLMRequest request, long startTime) {
        JsonNode message = json.get("message");
        String content = message != null && message.has("content") ? message.get("content").asText() : "";

        LLMResponse.FinishReason finishReason = LLMResponse.FinishReason.STOP;
        if (json.has("done_reason") && "length".equals(json.get("done_reason").asText())) {
            finishReason = LLMResponse.FinishReason.LENGTH;
        }

        // Ollama provides eval_count for tokens
        LLMResponse.Usage usage = null;
        if (json.has("prompt_eval_count") || json.has("eval_count")) {
            int promptTokens = json.has("prompt_eval_count") ? json.get("prompt_eval_count").asInt() : 0;
            int completionTokens = json.has("eval_count") ? json.get("eval_count").asInt() : 0;
            usage = LLMResponse.Usage.builder()
                    .promptTokens(promptTokens)
                    .completionTokens(completionTokens)
                    .totalTokens(promptTokens + completionTokens)
                    .build();
        }

        return LLMResponse.builder()
                .model(json.has("model") ? json.get("model").asText() : request.getModel())
                .providerId(PROVIDER_ID)
                .content(content)
                .finishReason(finishReason)
                .usage(usage)
                .latencyMs(System.currentTimeMillis() - startTime)
                .build();
    }
}
