package com.z254.prophantom.hive.analytics;

import com.z254.prophantom.hive.config.HiveProperties;
import com.z254.prophantom.hive.domain.model.PerformanceBaseline;
import com.z254.prophantom.hive.domain.repository.AgentSessionRepository;
import com.z254.prophantom.hive.memory.MemoryStore;
import com.z254.prophantom.hive.metrics.MetricNames;
import com.z254.prophantom.hive.metrics.MetricView;
import com.z254.prophantom.hive.metrics.MetricsAggregator;
import com.z254.prophantom.hive.observability.HiveMetrics;
import com.z254.prophantom.hive.observability.StructuredLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Computes health reports from metric baselines and memory statistics.
 * <p>
 * Reports are computed on a schedule and published atomically; {@link #snapshot()}
 * only returns the last published report and never triggers computation.
 */
@Component
@Slf4j
public class AnalyticsEngine {

    private static final double MIN_SUCCESS_RATE = 0.9;
    private static final double CRITICAL_SUCCESS_RATE = 0.6;

    private final MetricsAggregator metricsAggregator;
    private final MemoryStore memoryStore;
    private final AgentSessionRepository sessionRepository;
    private final HiveProperties.AnalyticsProperties config;
    private final HiveMetrics hiveMetrics;
    private final StructuredLogger structuredLogger;
    private final Clock clock;

    private final AtomicReference<HealthReport> latest = new AtomicReference<>(HealthReport.empty());
    private final Map<String, Instant> reportedAnomalies = new ConcurrentHashMap<>();

    public AnalyticsEngine(MetricsAggregator metricsAggregator,
                           MemoryStore memoryStore,
                           AgentSessionRepository sessionRepository,
                           HiveProperties properties,
                           HiveMetrics hiveMetrics,
                           StructuredLogger structuredLogger,
                           Clock clock) {
        this.metricsAggregator = metricsAggregator;
        this.memoryStore = memoryStore;
        this.sessionRepository = sessionRepository;
        this.config = properties.getAnalytics();
        this.hiveMetrics = hiveMetrics;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
    }

    /**
     * Last computed report. Non-blocking.
     */
    public HealthReport snapshot() {
        return latest.get();
    }

    @Scheduled(fixedRateString = "${hive.analytics.refresh-interval:PT5M}", initialDelayString = "PT10S")
    public void scheduledRefresh() {
        refresh();
    }

    /**
     * Compute and publish a new report.
     */
    public synchronized HealthReport refresh() {
        List<MetricView> views = metricsAggregator.views();

        List<AnomalyFlag> anomalies = detectAnomalies(views);
        List<TrendSignal> trends = views.stream()
                .map(this::trendOf)
                .flatMap(Optional::stream)
                .collect(Collectors.toList());
        List<AgentHealth> agents = agentHealth(views);

        double overall = agents.stream().mapToDouble(AgentHealth::getScore).average().orElse(Double.NaN);

        HealthReport report = HealthReport.builder()
                .computedAt(clock.instant())
                .overallScore(Double.isNaN(overall) ? 0.0 : overall)
                .overallStatus(HealthStatus.fromScore(overall))
                .agents(agents)
                .anomalies(anomalies)
                .trends(trends)
                .recommendations(recommend(agents, anomalies, trends))
                .memory(memoryStore.stats())
                .lastConsolidation(memoryStore.lastConsolidation().orElse(null))
                .sessions(sessionRepository.count())
                .build();
        latest.set(report);
        log.debug("Analytics refreshed: {} agents, {} anomalies, status {}",
                agents.size(), anomalies.size(), report.getOverallStatus());
        return report;
    }

    // ------------------------------------------------------------------
    // Anomalies
    // ------------------------------------------------------------------

    private List<AnomalyFlag> detectAnomalies(List<MetricView> views) {
        List<AnomalyFlag> flags = new ArrayList<>();
        for (MetricView view : views) {
            if (!view.isLatestEvaluated() || Math.abs(view.getLatestDeviation()) <= config.getDeviationThreshold()) {
                continue;
            }
            PerformanceBaseline baseline = view.getBaseline();
            AnomalyFlag flag = AnomalyFlag.builder()
                    .agentType(baseline.getAgentType())
                    .metric(baseline.getMetric())
                    .value(view.getLatest().getValue())
                    .baselineMean(baseline.getMean())
                    .baselineStdDev(baseline.stdDev())
                    .deviation(view.getLatestDeviation())
                    .observedAt(view.getLatest().getTimestamp())
                    .build();
            flags.add(flag);

            String key = flag.getAgentType() + "/" + flag.getMetric();
            Instant observed = flag.getObservedAt();
            if (observed != null && !observed.equals(reportedAnomalies.put(key, observed))) {
                hiveMetrics.getAnomaliesFlagged().increment();
                structuredLogger.logAnomaly(flag.getAgentType(), flag.getMetric(), flag.getValue(), flag.getDeviation());
            }
        }
        return flags;
    }

    // ------------------------------------------------------------------
    // Trends
    // ------------------------------------------------------------------

    Optional<TrendSignal> trendOf(MetricView view) {
        List<Double> recent = view.getRecent();
        if (recent.size() < 4) {
            return Optional.empty();
        }
        int half = recent.size() / 2;
        double older = recent.subList(0, half).stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double newer = recent.subList(recent.size() - half, recent.size()).stream()
                .mapToDouble(Double::doubleValue).average().orElse(0.0);
        double change = (newer - older) / Math.max(Math.abs(older), 1.0);

        String metric = view.getBaseline().getMetric();
        TrendSignal.Direction direction;
        if (Math.abs(change) < config.getTrendThreshold()) {
            direction = TrendSignal.Direction.STABLE;
        } else if ((change > 0) == MetricNames.higherIsBetter(metric)) {
            direction = TrendSignal.Direction.IMPROVING;
        } else {
            direction = TrendSignal.Direction.DECLINING;
        }
        return Optional.of(TrendSignal.builder()
                .agentType(view.getBaseline().getAgentType())
                .metric(metric)
                .direction(direction)
                .change(change)
                .build());
    }

    // ------------------------------------------------------------------
    // Agent health
    // ------------------------------------------------------------------

    private List<AgentHealth> agentHealth(List<MetricView> views) {
        Map<String, Map<String, PerformanceBaseline>> byAgent = new TreeMap<>();
        for (MetricView view : views) {
            PerformanceBaseline baseline = view.getBaseline();
            byAgent.computeIfAbsent(baseline.getAgentType(), a -> new TreeMap<>())
                    .put(baseline.getMetric(), baseline);
        }

        List<AgentHealth> result = new ArrayList<>();
        byAgent.forEach((agentType, baselines) -> {
            PerformanceBaseline failures = baselines.get(MetricNames.TURN_FAILURE);
            PerformanceBaseline latency = baselines.get(MetricNames.LATENCY_MS);
            PerformanceBaseline confidence = baselines.get(MetricNames.CONFIDENCE);

            double successRate = failures != null ? clamp(1.0 - failures.getMean()) : 1.0;
            double meanLatency = latency != null ? latency.getMean() : 0.0;
            double latencyScore = meanLatency <= config.getResponseTimeWarningMs()
                    ? 1.0
                    : config.getResponseTimeWarningMs() / meanLatency;
            Double meanConfidence = confidence != null ? confidence.getMean() : null;

            double score = meanConfidence != null
                    ? 0.5 * successRate + 0.3 * latencyScore + 0.2 * clamp(meanConfidence)
                    : 0.6 * successRate + 0.4 * latencyScore;

            result.add(AgentHealth.builder()
                    .agentType(agentType)
                    .score(score)
                    .status(HealthStatus.fromScore(score))
                    .successRate(successRate)
                    .meanLatencyMs(meanLatency)
                    .meanConfidence(meanConfidence)
                    .turns(failures != null ? failures.getSampleCount() : 0)
                    .build());
        });
        return result;
    }

    // ------------------------------------------------------------------
    // Recommendations
    // ------------------------------------------------------------------

    private List<Recommendation> recommend(List<AgentHealth> agents, List<AnomalyFlag> anomalies,
                                           List<TrendSignal> trends) {
        List<Recommendation> recommendations = new ArrayList<>();
        for (AgentHealth agent : agents) {
            if (agent.getMeanLatencyMs() > config.getResponseTimeWarningMs()) {
                recommendations.add(Recommendation.builder()
                        .agentType(agent.getAgentType())
                        .metric(MetricNames.LATENCY_MS)
                        .severity(Recommendation.Severity.WARNING)
                        .message(String.format("Average response time %.0fms exceeds %dms",
                                agent.getMeanLatencyMs(), config.getResponseTimeWarningMs()))
                        .suggestedAction("Switch to a smaller model or add workers for this agent")
                        .build());
            }
            if (agent.getMeanConfidence() != null && agent.getMeanConfidence() < config.getConfidenceFloor()) {
                recommendations.add(Recommendation.builder()
                        .agentType(agent.getAgentType())
                        .metric(MetricNames.CONFIDENCE)
                        .severity(Recommendation.Severity.WARNING)
                        .message(String.format("Average confidence %.2f is below %.2f",
                                agent.getMeanConfidence(), config.getConfidenceFloor()))
                        .suggestedAction("Review the agent prompt and its memory context budget")
                        .build());
            }
            if (agent.getSuccessRate() < MIN_SUCCESS_RATE) {
                recommendations.add(Recommendation.builder()
                        .agentType(agent.getAgentType())
                        .metric(MetricNames.TURN_FAILURE)
                        .severity(agent.getSuccessRate() < CRITICAL_SUCCESS_RATE
                                ? Recommendation.Severity.CRITICAL
                                : Recommendation.Severity.WARNING)
                        .message(String.format("Turn success rate is %.0f%%", agent.getSuccessRate() * 100))
                        .suggestedAction("Check that the model backend serving this agent is reachable")
                        .build());
            }
        }
        for (TrendSignal trend : trends) {
            if (trend.getDirection() == TrendSignal.Direction.DECLINING) {
                recommendations.add(Recommendation.builder()
                        .agentType(trend.getAgentType())
                        .metric(trend.getMetric())
                        .severity(Recommendation.Severity.INFO)
                        .message(String.format("%s is trending worse (%+.0f%%)",
                                trend.getMetric(), trend.getChange() * 100))
                        .suggestedAction("Monitor the agent over the next refresh intervals")
                        .build());
            }
        }
        for (AnomalyFlag anomaly : anomalies) {
            recommendations.add(Recommendation.builder()
                    .agentType(anomaly.getAgentType())
                    .metric(anomaly.getMetric())
                    .severity(Recommendation.Severity.WARNING)
                    .message(String.format("Latest %s sample deviates %.1f standard deviations from baseline",
                            anomaly.getMetric(), anomaly.getDeviation()))
                    .suggestedAction("Inspect recent turns of this agent")
                    .build());
        }
        return recommendations;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
