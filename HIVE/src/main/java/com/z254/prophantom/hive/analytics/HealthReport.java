package com.z254.prophantom.hive.analytics;

import com.z254.prophantom.hive.memory.ConsolidationReport;
import com.z254.prophantom.hive.memory.MemoryStats;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Read-only analytics snapshot served to the dashboard.
 */
@Value
@Builder
public class HealthReport {

    /**
     * When this report was computed. Null until the first refresh.
     */
    Instant computedAt;

    double overallScore;

    HealthStatus overallStatus;

    List<AgentHealth> agents;

    List<AnomalyFlag> anomalies;

    List<TrendSignal> trends;

    List<Recommendation> recommendations;

    MemoryStats memory;

    ConsolidationReport lastConsolidation;

    long sessions;

    public static HealthReport empty() {
        return HealthReport.builder()
                .overallScore(0.0)
                .overallStatus(HealthStatus.UNKNOWN)
                .agents(List.of())
                .anomalies(List.of())
                .trends(List.of())
                .recommendations(List.of())
                .memory(MemoryStats.empty())
                .build();
    }
}
