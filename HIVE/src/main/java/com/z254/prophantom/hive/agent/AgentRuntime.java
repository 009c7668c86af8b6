package com.z254.prophantom.hive.agent;

import com.z254.prophantom.hive.common.exception.AgentUnavailableException;
import com.z254.prophantom.hive.common.exception.BackendTimeoutException;
import com.z254.prophantom.hive.common.exception.HiveException;
import com.z254.prophantom.hive.config.HiveProperties;
import com.z254.prophantom.hive.domain.model.AgentProfile;
import com.z254.prophantom.hive.domain.model.AgentReply;
import com.z254.prophantom.hive.domain.model.AgentSession;
import com.z254.prophantom.hive.domain.model.ContextSnapshot;
import com.z254.prophantom.hive.domain.model.MemoryItem;
import com.z254.prophantom.hive.domain.model.MemoryKind;
import com.z254.prophantom.hive.domain.model.MetricSample;
import com.z254.prophantom.hive.domain.model.ScoredMemory;
import com.z254.prophantom.hive.domain.model.SessionContext;
import com.z254.prophantom.hive.domain.repository.AgentSessionRepository;
import com.z254.prophantom.hive.domain.repository.ContextSnapshotRepository;
import com.z254.prophantom.hive.llm.GenerationConstraints;
import com.z254.prophantom.hive.llm.LLMResponse;
import com.z254.prophantom.hive.llm.ModelBackendAdapter;
import com.z254.prophantom.hive.llm.PromptContext;
import com.z254.prophantom.hive.memory.MemoryStore;
import com.z254.prophantom.hive.metrics.MetricNames;
import com.z254.prophantom.hive.metrics.MetricsAggregator;
import com.z254.prophantom.hive.observability.HiveMetrics;
import com.z254.prophantom.hive.observability.StructuredLogger;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Runtime for one agent type, shared by every session of that type.
 * <p>
 * A turn:
 * <ol>
 *     <li>ranks the user's memories for this agent against the message</li>
 *     <li>assembles and stores an immutable context snapshot within the token budget</li>
 *     <li>calls the model backend under the profile timeout, retrying once with the same snapshot</li>
 *     <li>on success writes one episodic memory and advances the session count and tier</li>
 *     <li>emits latency, failure and, when reported, confidence samples</li>
 * </ol>
 * A failed turn writes nothing. The runtime holds no per-call mutable state.
 */
@Slf4j
public class AgentRuntime {

    static final String EXCHANGE_TAG = "exchange";

    @Getter
    private final String agentType;
    @Getter
    private final AgentProfile profile;
    private final AgentRuntimeContext runtimeContext;

    public AgentRuntime(String agentType, AgentProfile profile, AgentRuntimeContext runtimeContext) {
        this.agentType = agentType;
        this.profile = profile;
        this.runtimeContext = runtimeContext;
    }

    public Mono<AgentReply> handle(SessionContext context, String userMessage) {
        return Mono.defer(() -> {
            long started = System.nanoTime();
            AgentSession session = sessions().getOrCreate(context.getUserId(), agentType,
                    runtimeContext.getTierPolicy().initialTier(), clock().instant());
            ContextSnapshot snapshot = snapshots().save(prepare(session, context, userMessage));
            runtimeContext.getStructuredLogger().logTurnStarted(session.getId(), agentType,
                    snapshot.getItems().size(), snapshot.getTrimmedCount());

            return generate(context, snapshot)
                    .map(response -> commit(session, snapshot, response, started))
                    .doOnError(error -> onFailure(error, started))
                    .doOnCancel(() -> log.debug("Turn cancelled for session {} ({})", session.getId(), agentType));
        });
    }

    private ContextSnapshot prepare(AgentSession session, SessionContext context, String userMessage) {
        List<ScoredMemory> ranked = memory().rank(session.getUserId(), agentType, userMessage,
                profile.getMemoryLimit());
        return runtimeContext.getContextAssembler().assemble(session, userMessage, ranked,
                context.getAttributes(), profile.getContextTokenBudget(), clock().instant());
    }

    private Mono<LLMResponse> generate(SessionContext context, ContextSnapshot snapshot) {
        HiveProperties.BackendProperties backendConfig = runtimeContext.getProperties().getBackend();
        PromptContext prompt = PromptContext.builder()
                .agentType(agentType)
                .userId(context.getUserId())
                .systemPrompt(profile.getSystemPrompt())
                .memoryContext(snapshot.getSummary())
                .userMessage(snapshot.getUserMessage())
                .build();
        GenerationConstraints constraints = GenerationConstraints.builder()
                .provider(profile.getProvider())
                .model(profile.getModel())
                .temperature(profile.getTemperature())
                .maxTokens(profile.getMaxTokens())
                .timeout(profile.getTimeout() != null ? profile.getTimeout() : backendConfig.getDefaultTimeout())
                .build();

        ModelBackendAdapter backend = runtimeContext.getBackend();
        return Mono.defer(() -> backend.generate(prompt, constraints))
                .retryWhen(Retry.max(backendConfig.getMaxRetries())
                        .filter(AgentRuntime::isBackendFailure)
                        .doBeforeRetry(signal -> log.info("Retrying backend call for {} after: {}",
                                agentType, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
    }

    /**
     * Persist the exchange and advance the session. Runs synchronously so a cancelled
     * turn either commits fully or not at all.
     */
    private AgentReply commit(AgentSession session, ContextSnapshot snapshot, LLMResponse response, long started) {
        String replyText = response.getContent() != null ? response.getContent().trim() : "";

        MemoryItem episode = MemoryItem.builder()
                .userId(session.getUserId())
                .agentType(agentType)
                .kind(MemoryKind.EPISODIC)
                .content("User: " + snapshot.getUserMessage() + "\nAssistant: " + replyText)
                .importance(runtimeContext.getProperties().getMemory().getDefaultImportance())
                .tag(EXCHANGE_TAG)
                .attribute("sessionId", session.getId())
                .attribute("snapshotId", snapshot.getId())
                .build();
        String memoryId = memory().write(episode);
        AgentSession updated = sessions().recordInteraction(session.getId(), clock().instant(),
                runtimeContext.getTierPolicy()::advance);

        long latencyMs = elapsedMillis(started);
        record(MetricNames.LATENCY_MS, latencyMs);
        record(MetricNames.TURN_FAILURE, 0.0);
        if (response.getConfidence() != null) {
            record(MetricNames.CONFIDENCE, response.getConfidence());
        }
        runtimeContext.getHiveMetrics().recordTurn(agentType, "success", Duration.ofMillis(latencyMs));
        runtimeContext.getStructuredLogger().logTurnCompleted(updated.getId(), agentType, latencyMs,
                updated.getInteractionCount(), updated.getTier().getLevel());

        return AgentReply.builder()
                .sessionId(updated.getId())
                .agentType(agentType)
                .replyText(replyText)
                .tier(updated.getTier())
                .interactionCount(updated.getInteractionCount())
                .latencyMs(latencyMs)
                .confidence(response.getConfidence())
                .snapshotId(snapshot.getId())
                .memoryItemId(memoryId)
                .build();
    }

    private void onFailure(Throwable error, long started) {
        String kind = error instanceof HiveException
                ? ((HiveException) error).getKind().name()
                : error.getClass().getSimpleName();
        record(MetricNames.TURN_FAILURE, 1.0);
        runtimeContext.getHiveMetrics().recordTurn(agentType, kind.toLowerCase(Locale.ROOT),
                Duration.ofMillis(elapsedMillis(started)));
        runtimeContext.getStructuredLogger().logTurnFailed(agentType, kind, error.getMessage());
    }

    private void record(String metric, double value) {
        runtimeContext.getMetricsAggregator().record(MetricSample.builder()
                .metric(metric)
                .agentType(agentType)
                .value(value)
                .timestamp(clock().instant())
                .build());
    }

    private static boolean isBackendFailure(Throwable error) {
        return error instanceof BackendTimeoutException || error instanceof AgentUnavailableException;
    }

    private static long elapsedMillis(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
    }

    private MemoryStore memory() {
        return runtimeContext.getMemoryStore();
    }

    private AgentSessionRepository sessions() {
        return runtimeContext.getSessionRepository();
    }

    private ContextSnapshotRepository snapshots() {
        return runtimeContext.getSnapshotRepository();
    }

    private Clock clock() {
        return runtimeContext.getClock();
    }
}
