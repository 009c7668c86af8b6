package com.z254.prophantom.hive.metrics;

import com.z254.prophantom.hive.config.HiveProperties;
import com.z254.prophantom.hive.domain.model.MetricSample;
import com.z254.prophantom.hive.domain.model.PerformanceBaseline;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Ingests metric samples and maintains an exponentially weighted baseline per
 * (metric, agent type).
 * <p>
 * For a sample x with smoothing factor a:
 * <pre>
 *   delta    = x - mean
 *   mean     = mean + a * delta
 *   variance = (1 - a) * (variance + a * delta^2)
 * </pre>
 * The first sample initializes the mean with zero variance.
 */
@Component
@Slf4j
public class MetricsAggregator {

    private static final double MIN_STD_DEV = 1e-6;

    private final Map<Key, BaselineState> states = new ConcurrentHashMap<>();
    private final Map<Key, DistributionSummary> summaries = new ConcurrentHashMap<>();
    private final HiveProperties.MetricsProperties config;
    private final MeterRegistry meterRegistry;

    private record Key(String metric, String agentType) {
    }

    public MetricsAggregator(HiveProperties properties, MeterRegistry meterRegistry) {
        this.config = properties.getMetrics();
        this.meterRegistry = meterRegistry;
    }

    /**
     * Fold a sample into its baseline.
     *
     * @return the updated baseline
     */
    public PerformanceBaseline record(MetricSample sample) {
        Objects.requireNonNull(sample.getMetric(), "metric");
        Objects.requireNonNull(sample.getAgentType(), "agentType");
        if (!Double.isFinite(sample.getValue())) {
            throw new IllegalArgumentException("Metric value must be finite: " + sample.getValue());
        }

        Key key = new Key(sample.getMetric(), sample.getAgentType());
        BaselineState state = states.computeIfAbsent(key, k -> new BaselineState(k));
        PerformanceBaseline baseline = state.update(sample, alphaFor(sample.getMetric()),
                config.getMinSamples(), config.getRecentWindow());

        summaries.computeIfAbsent(key, k -> DistributionSummary.builder("hive.metric.samples")
                        .description("Raw metric samples emitted by agent runtimes")
                        .tag("metric", k.metric())
                        .tag("agent", k.agentType())
                        .register(meterRegistry))
                .record(sample.getValue());
        return baseline;
    }

    public PerformanceBaseline baseline(String metric, String agentType) {
        BaselineState state = states.get(new Key(metric, agentType));
        return state != null ? state.view().getBaseline() : PerformanceBaseline.empty(metric, agentType);
    }

    public Optional<MetricView> view(String metric, String agentType) {
        return Optional.ofNullable(states.get(new Key(metric, agentType))).map(BaselineState::view);
    }

    /**
     * Views of every metric stream, ordered by agent type then metric.
     */
    public List<MetricView> views() {
        return states.values().stream()
                .map(BaselineState::view)
                .sorted(Comparator.comparing((MetricView v) -> v.getBaseline().getAgentType())
                        .thenComparing(v -> v.getBaseline().getMetric()))
                .collect(Collectors.toList());
    }

    double alphaFor(String metric) {
        return config.getAlphas().getOrDefault(metric, config.getDefaultAlpha());
    }

    private static final class BaselineState {

        private final Key key;
        private final Deque<Double> recent = new ArrayDeque<>();
        private double mean;
        private double variance;
        private long count;
        private boolean insufficient = true;
        private Instant lastUpdated;
        private MetricSample latest;
        private double latestDeviation;
        private boolean latestEvaluated;

        private BaselineState(Key key) {
            this.key = key;
        }

        synchronized PerformanceBaseline update(MetricSample sample, double alpha, int minSamples, int window) {
            double value = sample.getValue();

            // Deviation is measured against the baseline as it stood before this sample
            latestEvaluated = !insufficient;
            latestDeviation = latestEvaluated ? (value - mean) / Math.max(Math.sqrt(variance), MIN_STD_DEV) : 0.0;

            if (count == 0) {
                mean = value;
                variance = 0.0;
            } else {
                double delta = value - mean;
                mean += alpha * delta;
                variance = (1 - alpha) * (variance + alpha * delta * delta);
            }
            count++;
            insufficient = count < minSamples;
            lastUpdated = sample.getTimestamp() != null ? sample.getTimestamp() : Instant.now();
            latest = sample;

            recent.addLast(value);
            while (recent.size() > window) {
                recent.removeFirst();
            }
            return baseline();
        }

        synchronized MetricView view() {
            return MetricView.builder()
                    .baseline(baseline())
                    .latest(latest)
                    .latestDeviation(latestDeviation)
                    .latestEvaluated(latestEvaluated)
                    .recent(new ArrayList<>(recent))
                    .build();
        }

        private PerformanceBaseline baseline() {
            return PerformanceBaseline.builder()
                    .metric(key.metric())
                    .agentType(key.agentType())
                    .mean(mean)
                    .variance(variance)
                    .sampleCount(count)
                    .lastUpdated(lastUpdated)
                    .insufficient(insufficient)
                    .build();
        }
    }
}
