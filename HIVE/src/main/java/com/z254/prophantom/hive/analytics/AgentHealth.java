package com.z254.prophantom.hive.analytics;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AgentHealth {
    String agentType;
    double score;
    HealthStatus status;
    double successRate;
    double meanLatencyMs;
    Double meanConfidence;
    long turns;
}
