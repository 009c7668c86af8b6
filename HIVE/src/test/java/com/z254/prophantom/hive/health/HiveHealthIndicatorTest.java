package com.z254.prophantom.hive.health;

import com.z254.prophantom.hive.HiveTestFixture;
import com.z254.prophantom.hive.analytics.AnalyticsEngine;
import com.z254.prophantom.hive.analytics.HealthStatus;
import com.z254.prophantom.hive.llm.LLMProvider;
import com.z254.prophantom.hive.llm.LLMProviderRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link HiveHealthIndicator}.
 */
class HiveHealthIndicatorTest {

    private HiveTestFixture fixture;
    private AnalyticsEngine analyticsEngine;

    @BeforeEach
    void setUp() {
        fixture = new HiveTestFixture();
        analyticsEngine = new AnalyticsEngine(fixture.metricsAggregator, fixture.memoryStore,
                fixture.sessionRepository, fixture.properties, fixture.hiveMetrics, fixture.structuredLogger,
                fixture.clock);
    }

    private HiveHealthIndicator indicator(List<LLMProvider> providers) {
        return new HiveHealthIndicator(new LLMProviderRegistry(providers, fixture.properties), fixture.dispatcher,
                fixture.admissionController, analyticsEngine, fixture.properties);
    }

    @Test
    @DisplayName("should be UP with load details when a provider is reachable")
    void up() {
        StepVerifier.create(indicator(List.of(fixture.provider)).health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails())
                            .containsEntry("providers", Map.of("ollama", true))
                            .containsEntry("agentTypes", 2)
                            .containsEntry("inFlight", 0)
                            .containsEntry("analyticsStatus", HealthStatus.UNKNOWN)
                            .doesNotContainKey("analyticsScore");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should be DOWN when no provider is reachable")
    void down() {
        LLMProvider offline = mock(LLMProvider.class);
        when(offline.getProviderId()).thenReturn("ollama");
        when(offline.isAvailable()).thenReturn(Mono.error(new IllegalStateException("connection refused")));

        StepVerifier.create(indicator(List.of(offline)).health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
                    assertThat(health.getDetails()).containsEntry("providers", Map.of("ollama", false));
                })
                .verifyComplete();
    }
}
