package com.z254.prophantom.hive.analytics;

import lombok.Builder;
import lombok.Value;

/**
 * Advisory item for the dashboard. Data only, never executed.
 */
@Value
@Builder
public class Recommendation {

    public enum Severity {
        INFO,
        WARNING,
        CRITICAL
    }

    String agentType;
    String metric;
    Severity severity;
    String message;
    String suggestedAction;
}
