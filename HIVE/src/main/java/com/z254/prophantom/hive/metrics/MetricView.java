package com.z254.prophantom.hive.metrics;

import com.z254.prophantom.hive.domain.model.MetricSample;
import com.z254.prophantom.hive.domain.model.PerformanceBaseline;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Read-only view of one metric stream: its baseline, the latest sample and the recent values.
 */
@Value
@Builder
public class MetricView {

    PerformanceBaseline baseline;

    MetricSample latest;

    /**
     * Deviation of the latest sample from the baseline as it stood before that sample,
     * in standard deviations.
     */
    double latestDeviation;

    /**
     * False when the prior baseline was insufficient, in which case the deviation is not meaningful.
     */
    boolean latestEvaluated;

    /**
     * Most recent raw values, oldest first.
     */
    List<Double> recent;
}
