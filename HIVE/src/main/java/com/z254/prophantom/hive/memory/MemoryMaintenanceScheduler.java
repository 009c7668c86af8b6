package com.z254.prophantom.hive.memory;

import com.z254.prophantom.hive.config.HiveProperties;
import com.z254.prophantom.hive.domain.repository.AgentSessionRepository;
import com.z254.prophantom.hive.domain.repository.ContextSnapshotRepository;
import com.z254.prophantom.hive.observability.HiveMetrics;
import com.z254.prophantom.hive.observability.StructuredLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Periodic memory maintenance: consolidation, snapshot retention and session archival.
 */
@Component
@Slf4j
public class MemoryMaintenanceScheduler {

    private final MemoryStore memoryStore;
    private final ContextSnapshotRepository snapshotRepository;
    private final AgentSessionRepository sessionRepository;
    private final HiveProperties properties;
    private final HiveMetrics metrics;
    private final StructuredLogger structuredLogger;
    private final Clock clock;

    public MemoryMaintenanceScheduler(MemoryStore memoryStore,
                                      ContextSnapshotRepository snapshotRepository,
                                      AgentSessionRepository sessionRepository,
                                      HiveProperties properties,
                                      HiveMetrics metrics,
                                      StructuredLogger structuredLogger,
                                      Clock clock) {
        this.memoryStore = memoryStore;
        this.snapshotRepository = snapshotRepository;
        this.sessionRepository = sessionRepository;
        this.properties = properties;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${hive.memory.consolidation.interval:PT6H}",
            initialDelayString = "${hive.memory.consolidation.interval:PT6H}")
    public void scheduledConsolidation() {
        if (!properties.getMemory().getConsolidation().isEnabled()) {
            return;
        }
        consolidate();
    }

    /**
     * Run one consolidation pass and record its outcome.
     */
    public ConsolidationReport consolidate() {
        ConsolidationReport report = memoryStore.consolidate();
        if (report.isSkipped()) {
            return report;
        }
        metrics.recordConsolidation(report.getSummariesCreated(), report.getItemsArchived(), report.getConflicts());
        structuredLogger.logConsolidation(report.getExamined(), report.getSummariesCreated(),
                report.getItemsDecayed(), report.getItemsArchived(), report.getConflicts(), report.durationMs());
        return report;
    }

    @Scheduled(fixedDelayString = "PT1H", initialDelayString = "PT1H")
    public void enforceRetention() {
        Instant now = clock.instant();
        int snapshots = snapshotRepository.archiveCreatedBefore(
                now.minus(properties.getMemory().getSnapshotRetention()));
        int sessions = sessionRepository.archiveInactiveSince(
                now.minus(properties.getDispatcher().getSessionArchiveAfter()));
        if (snapshots > 0 || sessions > 0) {
            log.info("Retention: archived {} context snapshots and {} sessions", snapshots, sessions);
        }
    }
}
