package com.z254.prophantom.hive.metrics;

/**
 * Metric names emitted by agent runtimes.
 */
public final class MetricNames {

    /** End-to-end turn latency in milliseconds. */
    public static final String LATENCY_MS = "latency_ms";

    /** Backend-reported confidence or quality signal in [0,1]. */
    public static final String CONFIDENCE = "confidence";

    /** 1 for a failed turn, 0 for a successful one. */
    public static final String TURN_FAILURE = "turn_failure";

    private MetricNames() {
    }

    public static boolean higherIsBetter(String metric) {
        return CONFIDENCE.equals(metric);
    }
}
