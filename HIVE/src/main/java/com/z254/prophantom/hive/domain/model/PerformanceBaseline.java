package com.z254.prophantom.hive.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Rolling statistical expectation for one metric of one agent type.
 */
@Value
@Builder(toBuilder = true)
public class PerformanceBaseline {

    String metric;

    String agentType;

    double mean;

    double variance;

    /**
     * Number of samples folded into the baseline.
     */
    long sampleCount;

    Instant lastUpdated;

    /**
     * True while fewer than the minimum sample count have been seen.
     * Insufficient baselines are never used for deviation checks.
     */
    boolean insufficient;

    public double stdDev() {
        return Math.sqrt(Math.max(variance, 0.0));
    }

    public static PerformanceBaseline empty(String metric, String agentType) {
        return PerformanceBaseline.builder()
                .metric(metric)
                .agentType(agentType)
                .insufficient(true)
                .build();
    }
}
