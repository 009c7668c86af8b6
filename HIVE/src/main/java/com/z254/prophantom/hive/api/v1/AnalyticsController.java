package com.z254.prophantom.hive.api.v1;

import com.z254.prophantom.hive.analytics.AnalyticsEngine;
import com.z254.prophantom.hive.analytics.HealthReport;
import com.z254.prophantom.hive.metrics.MetricView;
import com.z254.prophantom.hive.metrics.MetricsAggregator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * REST controller for performance analytics.
 */
@RestController
@RequestMapping("/api/v1/analytics")
@Tag(name = "Analytics", description = "Agent health and performance baselines")
public class AnalyticsController {

    private final AnalyticsEngine analyticsEngine;
    private final MetricsAggregator metricsAggregator;

    public AnalyticsController(AnalyticsEngine analyticsEngine, MetricsAggregator metricsAggregator) {
        this.analyticsEngine = analyticsEngine;
        this.metricsAggregator = metricsAggregator;
    }

    @GetMapping("/health")
    @Operation(summary = "Health snapshot", description = "Last computed health report")
    @ApiResponse(responseCode = "200", description = "Snapshot returned")
    public Mono<HealthReport> health() {
        return Mono.fromSupplier(analyticsEngine::snapshot);
    }

    @PostMapping("/refresh")
    @Operation(summary = "Refresh", description = "Recompute the health report now")
    @ApiResponse(responseCode = "200", description = "Snapshot recomputed")
    public Mono<HealthReport> refresh() {
        return Mono.fromCallable(analyticsEngine::refresh);
    }

    @GetMapping("/metrics")
    @Operation(summary = "Baselines", description = "Running baseline and recent values per agent type and metric")
    @ApiResponse(responseCode = "200", description = "Baselines returned")
    public Flux<MetricView> metrics() {
        return Flux.defer(() -> Flux.fromIterable(metricsAggregator.views()));
    }
}
