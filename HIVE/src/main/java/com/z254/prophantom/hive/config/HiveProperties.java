package com.z254.prophantom.hive.config;

import com.z254.prophantom.hive.domain.model.AgentProfile;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the HIVE service.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "hive")
public class HiveProperties {

    @Valid
    private DispatcherProperties dispatcher = new DispatcherProperties();

    @Valid
    private MemoryProperties memory = new MemoryProperties();

    @Valid
    private MetricsProperties metrics = new MetricsProperties();

    @Valid
    private AnalyticsProperties analytics = new AnalyticsProperties();

    @Valid
    private BackendProperties backend = new BackendProperties();

    @Valid
    private TierProperties tiers = new TierProperties();

    /**
     * Agent profiles keyed by agent type.
     */
    @Valid
    private Map<String, AgentProfile> agents = new LinkedHashMap<>();

    @Data
    public static class DispatcherProperties {
        /**
         * Ceiling on in-flight turns across all users and agents.
         */
        @Min(1)
        private int globalMaxConcurrent = 200;

        /**
         * Ceiling on in-flight turns for one user talking to one agent type.
         */
        @Min(1)
        private int perUserAgentMaxConcurrent = 2;

        private Duration heartbeatInterval = Duration.ofSeconds(30);

        /**
         * How long a dropped streaming connection may be resumed.
         */
        private Duration reconnectGrace = Duration.ofSeconds(60);

        @Min(1)
        private int retainedQueueSize = 256;

        private Duration sweepInterval = Duration.ofSeconds(5);

        /**
         * Sessions without activity for this long are archived.
         */
        private Duration sessionArchiveAfter = Duration.ofDays(30);

        /**
         * Hint returned to rejected callers.
         */
        private Duration retryAfter = Duration.ofSeconds(1);
    }

    @Data
    public static class MemoryProperties {
        @Min(1)
        private int defaultQueryLimit = 5;

        @DecimalMin("0.0")
        private double recencyWeight = 0.4;

        @DecimalMin("0.0")
        private double similarityWeight = 0.6;

        private Duration recencyHalfLife = Duration.ofHours(24);

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double defaultImportance = 0.5;

        private ConsolidationProperties consolidation = new ConsolidationProperties();

        @Min(1)
        private int maxItemsPerUser = 10_000;

        private Duration snapshotRetention = Duration.ofDays(30);
    }

    @Data
    public static class ConsolidationProperties {
        private boolean enabled = true;

        private Duration interval = Duration.ofHours(6);

        /**
         * Width of the time buckets raw items are grouped into.
         */
        private Duration window = Duration.ofHours(6);

        /**
         * Combined importance a group must exceed to be summarized.
         */
        private double threshold = 0.3;

        @Min(1)
        private int minGroupSize = 2;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double decayFactor = 0.99;

        /**
         * Items not accessed within this window decay.
         */
        private Duration accessWindow = Duration.ofDays(7);

        /**
         * Items whose importance falls below this floor are archived.
         */
        private double archiveFloor = 0.05;
    }

    @Data
    public static class MetricsProperties {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double defaultAlpha = 0.1;

        /**
         * Per-metric smoothing factors overriding the default.
         */
        private Map<String, Double> alphas = new HashMap<>();

        @Min(1)
        private int minSamples = 10;

        /**
         * Number of recent raw values kept per metric for trend detection.
         */
        @Min(2)
        private int recentWindow = 20;
    }

    @Data
    public static class AnalyticsProperties {
        /**
         * Number of standard deviations beyond which a sample is anomalous.
         */
        private double deviationThreshold = 3.0;

        private Duration refreshInterval = Duration.ofMinutes(5);

        private long responseTimeWarningMs = 3_000;

        private double confidenceFloor = 0.7;

        /**
         * Relative change between the halves of the recent window that counts as a trend.
         */
        private double trendThreshold = 0.1;
    }

    @Data
    public static class BackendProperties {
        private String defaultProvider = "ollama";

        private Duration defaultTimeout = Duration.ofSeconds(30);

        /**
         * Internal retries after a failed or timed-out backend call.
         */
        @Min(0)
        private int maxRetries = 1;

        private OllamaProperties ollama = new OllamaProperties();
    }

    @Data
    public static class OllamaProperties {
        private boolean enabled = true;
        private String baseUrl = "http://localhost:11434";
        private String model = "llama3.2:3b";
    }

    @Data
    public static class TierProperties {
        private List<TierDefinition> levels = new ArrayList<>(List.of(
                new TierDefinition(0, 1, "Getting to Know Each Other"),
                new TierDefinition(5, 2, "Friend"),
                new TierDefinition(20, 3, "Good Friend"),
                new TierDefinition(50, 4, "Close Friend"),
                new TierDefinition(100, 5, "Best Friend")
        ));

        private List<Long> milestones = new ArrayList<>(List.of(5L, 20L, 50L, 100L, 200L));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TierDefinition {
        /**
         * Minimum interaction count for this tier.
         */
        private long threshold;
        private int level;
        private String name;
    }
}
