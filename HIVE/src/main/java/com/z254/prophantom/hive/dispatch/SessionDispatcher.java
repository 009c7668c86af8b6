package com.z254.prophantom.hive.dispatch;

import com.z254.prophantom.hive.agent.AgentRuntime;
import com.z254.prophantom.hive.agent.AgentRuntimeRegistry;
import com.z254.prophantom.hive.common.exception.HiveException;
import com.z254.prophantom.hive.common.exception.InvalidStateException;
import com.z254.prophantom.hive.common.exception.SessionExpiredException;
import com.z254.prophantom.hive.config.HiveProperties;
import com.z254.prophantom.hive.domain.model.AgentReply;
import com.z254.prophantom.hive.domain.model.SessionContext;
import com.z254.prophantom.hive.observability.HiveMetrics;
import com.z254.prophantom.hive.observability.StructuredLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routes inbound messages from live connections to agent runtimes.
 * <p>
 * Each request passes admission control, then waits in its session lane (one at a time,
 * arrival order) and the agent's worker lane. Closing a connection cancels its in-flight
 * requests. Streaming connections receive replies as sequenced messages that are retained
 * until acknowledged and replayed after a reconnect within the grace window.
 */
@Component
@Slf4j
public class SessionDispatcher {

    private final AgentRuntimeRegistry runtimeRegistry;
    private final AdmissionController admissionController;
    private final HiveProperties.DispatcherProperties config;
    private final HiveMetrics hiveMetrics;
    private final StructuredLogger structuredLogger;
    private final Clock clock;

    private final Map<String, Connection> connections = new ConcurrentHashMap<>();
    private final Map<String, AgentLane> sessionLanes = new ConcurrentHashMap<>();
    private final Map<String, AgentLane> agentLanes = new ConcurrentHashMap<>();

    public SessionDispatcher(AgentRuntimeRegistry runtimeRegistry,
                             AdmissionController admissionController,
                             HiveProperties properties,
                             HiveMetrics hiveMetrics,
                             StructuredLogger structuredLogger,
                             Clock clock) {
        this.runtimeRegistry = runtimeRegistry;
        this.admissionController = admissionController;
        this.config = properties.getDispatcher();
        this.hiveMetrics = hiveMetrics;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
    }

    /**
     * Opens a connection for a user to a configured agent type.
     */
    public ConnectionHandle open(String userId, String agentType, TransportKind transportKind) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        runtimeRegistry.getRuntime(agentType);

        ConnectionHandle handle = new ConnectionHandle(UUID.randomUUID().toString(), userId, agentType,
                transportKind);
        Connection connection = new Connection(handle, clock.instant(), config.getRetainedQueueSize(),
                config.getReconnectGrace(), this::onTransition);
        connections.put(handle.getConnectionId(), connection);
        connection.established();
        hiveMetrics.connectionOpened();
        log.debug("Opened {} connection {} for {}/{}", transportKind, handle.getConnectionId(), userId, agentType);
        return handle;
    }

    public Mono<AgentReply> send(ConnectionHandle handle, String message) {
        return send(handle, message, Collections.emptyMap());
    }

    /**
     * Submits one user message. Fails with {@link InvalidStateException} if the connection is
     * closed or unknown, and with the close reason if the connection closes while in flight.
     */
    public Mono<AgentReply> send(ConnectionHandle handle, String message, Map<String, Object> attributes) {
        return Mono.defer(() -> {
            Connection connection = require(handle);
            AgentRuntime runtime;
            AdmissionController.Permit permit;
            try {
                if (message == null || message.isBlank()) {
                    throw new IllegalArgumentException("message must not be blank");
                }
                runtime = runtimeRegistry.getRuntime(handle.getAgentType());
                permit = admissionController.acquire(handle.getUserId(), handle.getAgentType());
            } catch (RuntimeException e) {
                deliver(connection, OutboundType.ERROR, errorPayload(e));
                throw e;
            }
            try {
                connection.turnStarted(clock.instant());
            } catch (RuntimeException e) {
                permit.release();
                throw e;
            }

            SessionContext context = SessionContext.builder()
                    .userId(handle.getUserId())
                    .agentType(handle.getAgentType())
                    .connectionId(handle.getConnectionId())
                    .attributes(attributes == null ? Collections.emptyMap() : attributes)
                    .build();

            AgentLane agentLane = agentLanes.computeIfAbsent(handle.getAgentType(),
                    type -> new AgentLane(type, runtime.getProfile().getWorkers()));
            // Held until the turn finishes; the last holder removes the lane
            String sessionKey = handle.getUserId() + "|" + handle.getAgentType();
            AgentLane sessionLane = sessionLanes.compute(sessionKey, (key, lane) -> {
                AgentLane held = lane != null ? lane : new AgentLane(key, 1);
                held.hold();
                return held;
            });
            Mono<AgentReply> turn = sessionLane.submit(() ->
                    agentLane.submit(() -> runtime.handle(context, message)));

            return Mono.firstWithSignal(turn, connection.<AgentReply>whenClosed())
                    .doOnNext(reply -> deliver(connection, OutboundType.MESSAGE, reply))
                    .doOnError(error -> deliver(connection, OutboundType.ERROR, errorPayload(error)))
                    .doFinally(signal -> {
                        permit.release();
                        connection.turnFinished();
                        sessionLanes.computeIfPresent(sessionKey, (key, lane) -> lane.drop() ? null : lane);
                    });
        });
    }

    /**
     * One request, one reply, over a connection that lives for the duration of the call.
     */
    public Mono<AgentReply> exchange(String userId, String agentType, String message,
                                     Map<String, Object> attributes) {
        return Mono.defer(() -> {
            ConnectionHandle handle = open(userId, agentType, TransportKind.REQUEST_RESPONSE);
            return send(handle, message, attributes)
                    .doFinally(signal -> close(handle));
        });
    }

    int sessionLaneCount() {
        return sessionLanes.size();
    }

    /**
     * Closes the connection and cancels anything it has in flight. Idempotent.
     */
    public void close(ConnectionHandle handle) {
        Connection connection = connections.remove(handle.getConnectionId());
        if (connection != null && connection.close(new InvalidStateException(
                "Connection " + handle.getConnectionId() + " was closed"), "closed")) {
            hiveMetrics.connectionClosed();
        }
    }

    /**
     * Binds the outbound stream of a streaming connection.
     */
    public Connection.Attachment attach(ConnectionHandle handle) {
        return require(handle).attach();
    }

    public OutboundMessage publish(ConnectionHandle handle, OutboundType type, Object payload) {
        Connection connection = require(handle);
        Connection.Published published = connection.publish(type, payload, clock.instant());
        if (published.isDropped()) {
            hiveMetrics.getMessagesDropped().increment();
        }
        return published.getMessage();
    }

    public void heartbeat(ConnectionHandle handle) {
        require(handle).heartbeat(clock.instant());
    }

    public void acknowledge(ConnectionHandle handle, long seq) {
        require(handle).acknowledge(seq, clock.instant());
    }

    /**
     * The transport under a connection went away. Opens the reconnect grace window.
     */
    public void transportLost(ConnectionHandle handle) {
        Connection connection = connections.get(handle.getConnectionId());
        if (connection != null) {
            connection.transportLost(clock.instant(), "transport lost");
        }
    }

    /**
     * Transport loss reported by a specific binding. Ignored once the client has resumed elsewhere.
     */
    public void transportLost(ConnectionHandle handle, long attachmentGeneration) {
        Connection connection = connections.get(handle.getConnectionId());
        if (connection != null) {
            connection.transportLost(attachmentGeneration, clock.instant(), "transport lost");
        }
    }

    /**
     * Reattaches a client to a reconnecting connection and replays every retained message
     * after {@code lastAckSeq}, exactly once and in order.
     *
     * @throws SessionExpiredException if the connection is unknown or its grace window elapsed
     */
    public Connection.ResumeResult resume(String connectionId, String userId, long lastAckSeq) {
        Connection connection = connections.get(connectionId);
        if (connection == null) {
            throw new SessionExpiredException(connectionId);
        }
        if (!connection.getHandle().getUserId().equals(userId)) {
            throw new InvalidStateException("Connection " + connectionId + " belongs to another user");
        }
        Instant now = clock.instant();
        if (connection.isExpired(now)) {
            expire(connection);
            throw new SessionExpiredException(connectionId);
        }
        Connection.ResumeResult result = connection.resume(lastAckSeq, now);
        hiveMetrics.getMessagesReplayed().increment(result.getReplayed().size());
        log.info("Connection {} resumed after seq {}, replayed {} message(s){}", connectionId, lastAckSeq,
                result.getReplayed().size(), result.getGap().map(gap -> " with gap " + gap).orElse(""));
        return result;
    }

    public Optional<ConnectionHandle> findHandle(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId)).map(Connection::getHandle);
    }

    public Optional<ConnectionState> state(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId)).map(Connection::getState);
    }

    public Collection<Connection> connections() {
        return Collections.unmodifiableCollection(connections.values());
    }

    /**
     * Counts open connections per state.
     */
    public Map<ConnectionState, Integer> stateCounts() {
        Map<ConnectionState, Integer> counts = new LinkedHashMap<>();
        for (Connection connection : connections.values()) {
            counts.merge(connection.getState(), 1, Integer::sum);
        }
        return counts;
    }

    @Scheduled(fixedDelayString = "${hive.dispatcher.sweep-interval:PT5S}")
    public void sweepExpired() {
        sweep(clock.instant());
    }

    /**
     * Moves silent streaming connections to RECONNECTING and closes those whose grace window elapsed.
     *
     * @return number of connections closed
     */
    public int sweep(Instant now) {
        List<Connection> expired = new ArrayList<>();
        for (Connection connection : connections.values()) {
            if (connection.isHeartbeatOverdue(now, config.getHeartbeatInterval())) {
                connection.transportLost(now, "missed heartbeats");
            }
            if (connection.isExpired(now)) {
                expired.add(connection);
            }
        }
        expired.forEach(this::expire);
        if (!expired.isEmpty()) {
            log.info("Closed {} connection(s) after reconnect grace elapsed", expired.size());
        }
        return expired.size();
    }

    private void expire(Connection connection) {
        if (connections.remove(connection.getId(), connection)
                && connection.close(new SessionExpiredException(connection.getId()), "grace elapsed")) {
            hiveMetrics.connectionClosed();
        }
    }

    private Connection require(ConnectionHandle handle) {
        Connection connection = connections.get(handle.getConnectionId());
        if (connection == null || connection.getState() == ConnectionState.CLOSED) {
            throw new InvalidStateException("Connection " + handle.getConnectionId() + " is not open");
        }
        return connection;
    }

    private void deliver(Connection connection, OutboundType type, Object payload) {
        if (connection.getHandle().getTransportKind() != TransportKind.STREAMING
                || connection.getState() == ConnectionState.CLOSED) {
            return;
        }
        try {
            Connection.Published published = connection.publish(type, payload, clock.instant());
            if (published.isDropped()) {
                hiveMetrics.getMessagesDropped().increment();
            }
        } catch (InvalidStateException e) {
            log.debug("Connection {} closed before {} could be delivered", connection.getId(), type);
        }
    }

    public static Map<String, Object> errorPayload(Throwable error) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (error instanceof HiveException) {
            HiveException hiveError = (HiveException) error;
            payload.put("code", hiveError.getCode());
            payload.put("error", hiveError.getKind().name());
        } else if (error instanceof IllegalArgumentException) {
            payload.put("code", 400);
            payload.put("error", "BAD_REQUEST");
        } else {
            payload.put("code", 500);
            payload.put("error", "INTERNAL");
        }
        payload.put("message", error.getMessage());
        return payload;
    }

    private void onTransition(Connection connection, ConnectionState from, ConnectionState to, String reason) {
        hiveMetrics.recordTransition(to.name());
        structuredLogger.logConnectionTransition(connection.getId(), from.name(), to.name(), reason);
    }
}
