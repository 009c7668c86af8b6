package com.z254.prophantom.hive.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Structured logging utility for HIVE.
 * Provides consistent, machine-parseable log entries with context.
 */
@Component
@Slf4j
public class StructuredLogger {

    private final ObjectMapper objectMapper;

    // MDC keys for context
    public static final String MDC_SESSION_ID = "sessionId";
    public static final String MDC_CONNECTION_ID = "connectionId";
    public static final String MDC_USER_ID = "userId";
    public static final String MDC_AGENT_TYPE = "agentType";

    public StructuredLogger(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Set MDC context for a turn.
     */
    public void setTurnContext(String sessionId, String connectionId, String userId, String agentType) {
        if (sessionId != null) MDC.put(MDC_SESSION_ID, sessionId);
        if (connectionId != null) MDC.put(MDC_CONNECTION_ID, connectionId);
        if (userId != null) MDC.put(MDC_USER_ID, userId);
        if (agentType != null) MDC.put(MDC_AGENT_TYPE, agentType);
    }

    public void clearContext() {
        MDC.remove(MDC_SESSION_ID);
        MDC.remove(MDC_CONNECTION_ID);
        MDC.remove(MDC_USER_ID);
        MDC.remove(MDC_AGENT_TYPE);
    }

    public void logTurnStarted(String sessionId, String agentType, int contextItems, int trimmed) {
        logEvent("turn_started", Map.of(
                "sessionId", sessionId,
                "agentType", agentType,
                "contextItems", contextItems,
                "trimmedItems", trimmed
        ));
    }

    public void logTurnCompleted(String sessionId, String agentType, long latencyMs,
                                 long interactionCount, int tierLevel) {
        logEvent("turn_completed", Map.of(
                "sessionId", sessionId,
                "agentType", agentType,
                "latencyMs", latencyMs,
                "interactionCount", interactionCount,
                "tierLevel", tierLevel
        ));
    }

    public void logTurnFailed(String agentType, String errorKind, String errorMessage) {
        logEvent("turn_failed", Map.of(
                "agentType", agentType,
                "errorKind", errorKind,
                "errorMessage", errorMessage != null ? errorMessage : "Unknown error"
        ));
    }

    /**
     * Log backend call.
     */
    public void logBackendCall(String providerId, String model, int inputTokens,
                               int outputTokens, long durationMs, boolean success) {
        logEvent("backend_call", Map.of(
                "providerId", providerId,
                "model", model != null ? model : "unknown",
                "inputTokens", inputTokens,
                "outputTokens", outputTokens,
                "durationMs", durationMs,
                "success", success
        ));
    }

    public void logMemoryOperation(String operation, String memoryKind,
                                   int entriesAffected, long durationMs) {
        logEvent("memory_operation", Map.of(
                "operation", operation,
                "memoryKind", memoryKind,
                "entriesAffected", entriesAffected,
                "durationMs", durationMs
        ));
    }

    public void logConsolidation(int examined, int summaries, int decayed, int archived,
                                 int conflicts, long durationMs) {
        logEvent("consolidation_pass", Map.of(
                "examined", examined,
                "summariesCreated", summaries,
                "itemsDecayed", decayed,
                "itemsArchived", archived,
                "conflicts", conflicts,
                "durationMs", durationMs
        ));
    }

    public void logAdmissionRejected(String userId, String agentType, String scope) {
        logEvent("admission_rejected", Map.of(
                "userId", userId,
                "agentType", agentType,
                "scope", scope
        ));
    }

    /**
     * Log connection state transition.
     */
    public void logConnectionTransition(String connectionId, String from, String to, String reason) {
        Map<String, Object> data = new HashMap<>();
        data.put("connectionId", connectionId);
        data.put("from", from);
        data.put("to", to);
        if (reason != null) data.put("reason", reason);
        logEvent("connection_transition", data);
    }

    public void logAnomaly(String agentType, String metric, double value, double zScore) {
        logEvent("anomaly_detected", Map.of(
                "agentType", agentType,
                "metric", metric,
                "value", value,
                "zScore", zScore
        ));
    }

    private void logEvent(String eventType, Map<String, Object> data) {
        Map<String, Object> event = new HashMap<>(data);
        event.put("event", eventType);
        event.put("timestamp", Instant.now().toString());
        event.put("service", "hive");

        // Add MDC context
        String sessionId = MDC.get(MDC_SESSION_ID);
        if (sessionId != null) event.putIfAbsent("sessionId", sessionId);

        String connectionId = MDC.get(MDC_CONNECTION_ID);
        if (connectionId != null) event.putIfAbsent("connectionId", connectionId);

        try {
            String json = objectMapper.writeValueAsString(event);
            log.info(json);
        } catch (JsonProcessingException e) {
            log.info("event={} data={}", eventType, data);
        }
    }
}
