package com.z254.prophantom.hive.dispatch;

import com.z254.prophantom.hive.common.exception.AdmissionRejectedException;
import com.z254.prophantom.hive.common.exception.AdmissionRejectedException.Scope;
import com.z254.prophantom.hive.config.HiveProperties;
import com.z254.prophantom.hive.domain.model.AgentProfile;
import com.z254.prophantom.hive.observability.HiveMetrics;
import com.z254.prophantom.hive.observability.StructuredLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Enforces concurrency limits before a request enters an agent lane: a global ceiling,
 * a per (user, agent) ceiling, and the agent's worker plus queue capacity.
 * Rejection is immediate, never blocking.
 */
@Component
@Slf4j
public class AdmissionController {

    private final HiveProperties properties;
    private final HiveMetrics hiveMetrics;
    private final StructuredLogger structuredLogger;

    private final AtomicInteger global = new AtomicInteger();
    // Entries exist only while the pair has requests in flight
    private final Map<String, Integer> perUserAgent = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> perAgent = new ConcurrentHashMap<>();

    public AdmissionController(HiveProperties properties, HiveMetrics hiveMetrics,
                               StructuredLogger structuredLogger) {
        this.properties = properties;
        this.hiveMetrics = hiveMetrics;
        this.structuredLogger = structuredLogger;
    }

    /**
     * Reserves a slot in every scope or none.
     *
     * @throws AdmissionRejectedException naming the first scope that is full
     */
    public Permit acquire(String userId, String agentType) {
        HiveProperties.DispatcherProperties config = properties.getDispatcher();
        String userAgentKey = userId + "|" + agentType;
        AtomicInteger agentCounter = perAgent.computeIfAbsent(agentType, key -> new AtomicInteger());

        if (!tryIncrement(global, config.getGlobalMaxConcurrent())) {
            throw reject(userId, agentType, Scope.GLOBAL, "Global concurrency limit reached");
        }
        if (!tryIncrement(userAgentKey, config.getPerUserAgentMaxConcurrent())) {
            global.decrementAndGet();
            throw reject(userId, agentType, Scope.USER_AGENT,
                    "Too many concurrent requests for " + agentType);
        }
        if (!tryIncrement(agentCounter, agentCapacity(agentType))) {
            decrement(userAgentKey);
            global.decrementAndGet();
            throw reject(userId, agentType, Scope.AGENT_QUEUE, "Agent " + agentType + " queue is full");
        }
        return new Permit(userAgentKey, agentCounter);
    }

    public int inFlight() {
        return global.get();
    }

    public int inFlight(String agentType) {
        AtomicInteger counter = perAgent.get(agentType);
        return counter == null ? 0 : counter.get();
    }

    int trackedUserAgents() {
        return perUserAgent.size();
    }

    int agentCapacity(String agentType) {
        AgentProfile profile = properties.getAgents().get(agentType);
        if (profile == null) {
            return properties.getDispatcher().getGlobalMaxConcurrent();
        }
        return profile.getWorkers() + profile.getQueueCapacity();
    }

    private static boolean tryIncrement(AtomicInteger counter, int limit) {
        while (true) {
            int current = counter.get();
            if (current >= limit) {
                return false;
            }
            if (counter.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    private boolean tryIncrement(String userAgentKey, int limit) {
        AtomicBoolean admitted = new AtomicBoolean();
        perUserAgent.compute(userAgentKey, (key, count) -> {
            int current = count == null ? 0 : count;
            if (current >= limit) {
                return count;
            }
            admitted.set(true);
            return current + 1;
        });
        return admitted.get();
    }

    private void decrement(String userAgentKey) {
        perUserAgent.computeIfPresent(userAgentKey, (key, count) -> count > 1 ? count - 1 : null);
    }

    private AdmissionRejectedException reject(String userId, String agentType, Scope scope, String message) {
        Duration retryAfter = properties.getDispatcher().getRetryAfter();
        hiveMetrics.recordAdmissionRejected(scope.name());
        structuredLogger.logAdmissionRejected(userId, agentType, scope.name());
        log.debug("Admission rejected for {}/{}: {}", userId, agentType, scope);
        return new AdmissionRejectedException(scope, message, retryAfter);
    }

    /**
     * Slot held by one admitted request. Releasing twice has no further effect.
     */
    public final class Permit {
        private final String userAgentKey;
        private final AtomicInteger agentCounter;
        private final AtomicBoolean released = new AtomicBoolean();

        private Permit(String userAgentKey, AtomicInteger agentCounter) {
            this.userAgentKey = userAgentKey;
            this.agentCounter = agentCounter;
        }

        public void release() {
            if (released.compareAndSet(false, true)) {
                agentCounter.decrementAndGet();
                decrement(userAgentKey);
                global.decrementAndGet();
            }
        }
    }
}
