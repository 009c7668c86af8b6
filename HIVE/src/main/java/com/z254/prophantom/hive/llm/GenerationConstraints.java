package com.z254.prophantom.hive.llm;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Generation parameters and the caller-imposed timeout for one backend attempt.
 */
@Value
@Builder
public class GenerationConstraints {
    String provider;
    String model;
    double temperature;
    int maxTokens;
    Duration timeout;
}
