package com.z254.prophantom.hive.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class MetricSample {
    String metric;
    String agentType;
    double value;
    Instant timestamp;
}
