package com.z254.prophantom.hive.analytics;

/**
 * Health buckets for a score in [0,1].
 */
public enum HealthStatus {
    EXCELLENT(0.9),
    GOOD(0.8),
    FAIR(0.6),
    POOR(0.4),
    CRITICAL(0.0),
    UNKNOWN(Double.NaN);

    private final double floor;

    HealthStatus(double floor) {
        this.floor = floor;
    }

    public static HealthStatus fromScore(double score) {
        if (Double.isNaN(score)) {
            return UNKNOWN;
        }
        for (HealthStatus status : values()) {
            if (status != UNKNOWN && score >= status.floor) {
                return status;
            }
        }
        return CRITICAL;
    }
}
