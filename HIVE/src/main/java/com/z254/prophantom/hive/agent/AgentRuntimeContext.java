package com.z254.prophantom.hive.agent;

import com.z254.prophantom.hive.config.HiveProperties;
import com.z254.prophantom.hive.domain.repository.AgentSessionRepository;
import com.z254.prophantom.hive.domain.repository.ContextSnapshotRepository;
import com.z254.prophantom.hive.llm.ModelBackendAdapter;
import com.z254.prophantom.hive.memory.MemoryStore;
import com.z254.prophantom.hive.metrics.MetricsAggregator;
import com.z254.prophantom.hive.observability.HiveMetrics;
import com.z254.prophantom.hive.observability.StructuredLogger;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Shared services handed to every agent runtime.
 */
@Getter
@Component
@AllArgsConstructor
public class AgentRuntimeContext {
    private final MemoryStore memoryStore;
    private final ContextAssembler contextAssembler;
    private final ModelBackendAdapter backend;
    private final AgentSessionRepository sessionRepository;
    private final ContextSnapshotRepository snapshotRepository;
    private final TierPolicy tierPolicy;
    private final MetricsAggregator metricsAggregator;
    private final HiveMetrics hiveMetrics;
    private final StructuredLogger structuredLogger;
    private final HiveProperties properties;
    private final Clock clock;
}
