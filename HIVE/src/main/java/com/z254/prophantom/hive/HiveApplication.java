package com.z254.prophantom.hive;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * HIVE - shared runtime for the ProPhantom agent suite.
 *
 * <p>HIVE provides:
 * <ul>
 *   <li>Session dispatch - admission control, per-agent worker lanes and replayable streaming delivery</li>
 *   <li>Agent runtime - one implementation for every agent type, parameterized by profile</li>
 *   <li>Memory - typed, associative memory with relevance ranking and background consolidation</li>
 *   <li>Metrics and analytics - running baselines, anomaly flags and health reports</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class HiveApplication {

    public static void main(String[] args) {
        SpringApplication.run(HiveApplication.class, args);
    }
}
