package com.z254.prophantom.hive.health;

import com.z254.prophantom.hive.analytics.AnalyticsEngine;
import com.z254.prophantom.hive.analytics.HealthReport;
import com.z254.prophantom.hive.analytics.HealthStatus;
import com.z254.prophantom.hive.config.HiveProperties;
import com.z254.prophantom.hive.dispatch.AdmissionController;
import com.z254.prophantom.hive.dispatch.SessionDispatcher;
import com.z254.prophantom.hive.llm.LLMProviderRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;

/**
 * Health indicator for HIVE.
 * Reports model backend reachability, dispatcher load and the last analytics snapshot.
 */
@Component
@Slf4j
public class HiveHealthIndicator implements ReactiveHealthIndicator {

    private final LLMProviderRegistry providerRegistry;
    private final SessionDispatcher dispatcher;
    private final AdmissionController admissionController;
    private final AnalyticsEngine analyticsEngine;
    private final HiveProperties properties;

    public HiveHealthIndicator(LLMProviderRegistry providerRegistry,
                               SessionDispatcher dispatcher,
                               AdmissionController admissionController,
                               AnalyticsEngine analyticsEngine,
                               HiveProperties properties) {
        this.providerRegistry = providerRegistry;
        this.dispatcher = dispatcher;
        this.admissionController = admissionController;
        this.analyticsEngine = analyticsEngine;
        this.properties = properties;
    }

    @Override
    public Mono<Health> health() {
        return checkProviders()
                .map(providers -> {
                    boolean anyUp = providers.containsValue(Boolean.TRUE);
                    Health.Builder builder = anyUp ? Health.up() : Health.down();
                    HealthReport report = analyticsEngine.snapshot();

                    builder.withDetail("providers", providers);
                    builder.withDetail("defaultProvider", properties.getBackend().getDefaultProvider());
                    builder.withDetail("agentTypes", properties.getAgents().size());
                    builder.withDetail("openConnections", dispatcher.connections().size());
                    builder.withDetail("connectionStates", dispatcher.stateCounts());
                    builder.withDetail("inFlight", admissionController.inFlight());
                    builder.withDetail("globalMaxConcurrent", properties.getDispatcher().getGlobalMaxConcurrent());
                    builder.withDetail("analyticsStatus", report.getOverallStatus());
                    if (report.getOverallStatus() != HealthStatus.UNKNOWN) {
                        builder.withDetail("analyticsScore", report.getOverallScore());
                    }
                    return builder.build();
                })
                .onErrorResume(e -> {
                    log.error("Health check failed", e);
                    return Mono.just(Health.down()
                            .withDetail("error", e.getMessage())
                            .build());
                });
    }

    private Mono<Map<String, Boolean>> checkProviders() {
        return Flux.fromIterable(providerRegistry.getProviders())
                .flatMap(provider -> provider.isAvailable()
                        .timeout(Duration.ofSeconds(5))
                        .onErrorReturn(false)
                        .map(up -> Map.entry(provider.getProviderId(), up)))
                .collectMap(Map.Entry::getKey, Map.Entry::getValue, TreeMap::new);
    }
}
