package com.z254.prophantom.hive.analytics;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TrendSignal {

    public enum Direction {
        IMPROVING,
        DECLINING,
        STABLE
    }

    String agentType;
    String metric;
    Direction direction;
    /**
     * Relative change between the older and newer half of the recent window.
     */
    double change;
}
