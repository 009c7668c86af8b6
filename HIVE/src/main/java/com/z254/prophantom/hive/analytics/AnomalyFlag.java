package com.z254.prophantom.hive.analytics;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A metric whose latest sample deviates from its baseline beyond the configured threshold.
 */
@Value
@Builder
public class AnomalyFlag {
    String agentType;
    String metric;
    double value;
    double baselineMean;
    double baselineStdDev;
    double deviation;
    Instant observedAt;
}
