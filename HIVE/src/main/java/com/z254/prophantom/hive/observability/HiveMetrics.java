package com.z254.prophantom.hive.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics for HIVE.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Turns (latency, outcome per agent type)</li>
 *     <li>Admission control (rejections per scope)</li>
 *     <li>Connections (open count, transitions, replayed and dropped messages)</li>
 *     <li>Memory consolidation (runs, summaries, archived items, conflicts)</li>
 *     <li>Analytics (anomalies flagged)</li>
 * </ul>
 */
@Component
public class HiveMetrics {

    private final MeterRegistry meterRegistry;

    private final Map<String, Timer> turnLatencyByAgent = new ConcurrentHashMap<>();
    private final Map<String, Counter> turnsByOutcome = new ConcurrentHashMap<>();
    private final Map<String, Counter> rejectionsByScope = new ConcurrentHashMap<>();
    private final Map<String, Counter> transitionsByState = new ConcurrentHashMap<>();

    private final AtomicInteger openConnections;
    @Getter
    private final Counter messagesReplayed;
    @Getter
    private final Counter messagesDropped;

    // Memory
    @Getter
    private final Counter consolidationRuns;
    @Getter
    private final Counter consolidationConflicts;
    private final DistributionSummary summariesPerRun;
    private final DistributionSummary archivedPerRun;

    @Getter
    private final Counter anomaliesFlagged;

    public HiveMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.openConnections = meterRegistry.gauge("hive.connections.open", new AtomicInteger(0));
        this.messagesReplayed = Counter.builder("hive.connections.replayed")
                .description("Retained messages replayed after reconnect")
                .register(meterRegistry);
        this.messagesDropped = Counter.builder("hive.connections.dropped")
                .description("Retained messages dropped due to queue overflow")
                .register(meterRegistry);

        this.consolidationRuns = Counter.builder("hive.memory.consolidation.runs")
                .description("Consolidation passes completed")
                .register(meterRegistry);
        this.consolidationConflicts = Counter.builder("hive.memory.consolidation.conflicts")
                .description("Change sets rescheduled after a concurrent update")
                .register(meterRegistry);
        this.summariesPerRun = DistributionSummary.builder("hive.memory.consolidation.summaries")
                .description("Summaries synthesized per consolidation pass")
                .register(meterRegistry);
        this.archivedPerRun = DistributionSummary.builder("hive.memory.consolidation.archived")
                .description("Items archived per consolidation pass")
                .register(meterRegistry);

        this.anomaliesFlagged = Counter.builder("hive.analytics.anomalies")
                .description("Metric samples flagged as anomalous")
                .register(meterRegistry);
    }

    // ========== Turn Methods ==========

    public void recordTurn(String agentType, String outcome, Duration latency) {
        turnLatencyByAgent.computeIfAbsent(agentType, type -> Timer.builder("hive.turn.latency")
                        .description("End-to-end turn latency")
                        .tag("agent", type)
                        .publishPercentiles(0.5, 0.95, 0.99)
                        .register(meterRegistry))
                .record(latency);
        turnsByOutcome.computeIfAbsent(agentType + ":" + outcome, key -> Counter.builder("hive.turns")
                        .description("Turns by agent type and outcome")
                        .tag("agent", agentType)
                        .tag("outcome", outcome)
                        .register(meterRegistry))
                .increment();
    }

    // ========== Dispatcher Methods ==========

    public void recordAdmissionRejected(String scope) {
        rejectionsByScope.computeIfAbsent(scope, s -> Counter.builder("hive.admission.rejected")
                        .description("Requests rejected by admission control")
                        .tag("scope", s)
                        .register(meterRegistry))
                .increment();
    }

    public void connectionOpened() {
        openConnections.incrementAndGet();
    }

    public void connectionClosed() {
        openConnections.decrementAndGet();
    }

    public int getOpenConnections() {
        return openConnections.get();
    }

    public void recordTransition(String toState) {
        transitionsByState.computeIfAbsent(toState, s -> Counter.builder("hive.connections.transitions")
                        .description("Connection state transitions by target state")
                        .tag("state", s)
                        .register(meterRegistry))
                .increment();
    }

    // ========== Memory Methods ==========

    public void recordConsolidation(int summaries, int archived, int conflicts) {
        consolidationRuns.increment();
        summariesPerRun.record(summaries);
        archivedPerRun.record(archived);
        if (conflicts > 0) {
            consolidationConflicts.increment(conflicts);
        }
    }
}
