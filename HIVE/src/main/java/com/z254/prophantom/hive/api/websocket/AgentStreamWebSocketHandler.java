package com.z254.prophantom.hive.api.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.prophantom.hive.common.exception.HiveException;
import com.z254.prophantom.hive.common.exception.InvalidStateException;
import com.z254.prophantom.hive.config.HiveProperties;
import com.z254.prophantom.hive.dispatch.Connection;
import com.z254.prophantom.hive.dispatch.ConnectionHandle;
import com.z254.prophantom.hive.dispatch.OutboundMessage;
import com.z254.prophantom.hive.dispatch.OutboundType;
import com.z254.prophantom.hive.dispatch.SessionDispatcher;
import com.z254.prophantom.hive.dispatch.TransportKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * WebSocket endpoint for streaming conversations with an agent.
 * <p>
 * Connect with {@code ?userId=&agentType=}. Every heartbeat carries the connection id;
 * reconnect within the grace window with {@code ?userId=&connectionId=&lastSeq=} to receive
 * the messages sent after {@code lastSeq}.
 */
@Component
@Slf4j
public class AgentStreamWebSocketHandler implements WebSocketHandler {

    public static final String PATH = "/ws/agents";

    private final SessionDispatcher dispatcher;
    private final ObjectMapper objectMapper;
    private final Duration heartbeatInterval;

    public AgentStreamWebSocketHandler(SessionDispatcher dispatcher, ObjectMapper objectMapper,
                                       HiveProperties properties) {
        this.dispatcher = dispatcher;
        this.objectMapper = objectMapper;
        this.heartbeatInterval = properties.getDispatcher().getHeartbeatInterval();
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        Map<String, String> params = UriComponentsBuilder.fromUri(session.getHandshakeInfo().getUri())
                .build()
                .getQueryParams()
                .toSingleValueMap();

        ConnectionHandle handle;
        Connection.Attachment attachment;
        try {
            String resumeId = params.get("connectionId");
            if (resumeId != null) {
                long lastSeq = params.containsKey("lastSeq") ? Long.parseLong(params.get("lastSeq")) : 0L;
                Connection.ResumeResult resumed = dispatcher.resume(resumeId, params.get("userId"), lastSeq);
                handle = dispatcher.findHandle(resumeId)
                        .orElseThrow(() -> new InvalidStateException("Connection " + resumeId + " is not open"));
                attachment = resumed.getAttachment();
            } else {
                handle = dispatcher.open(params.get("userId"), params.get("agentType"), TransportKind.STREAMING);
                attachment = dispatcher.attach(handle);
                sendHeartbeat(handle);
            }
        } catch (HiveException | IllegalArgumentException e) {
            log.info("WebSocket session {} refused: {}", session.getId(), e.getMessage());
            String frame = toJson(Frame.builder()
                    .type(OutboundType.ERROR.wireName())
                    .payload(SessionDispatcher.errorPayload(e))
                    .timestamp(Instant.now())
                    .build());
            return session.send(Mono.just(session.textMessage(frame)))
                    .then(session.close(CloseStatus.POLICY_VIOLATION));
        }

        ConnectionHandle connection = handle;
        long generation = attachment.getGeneration();
        AtomicBoolean closedByClient = new AtomicBoolean();
        log.info("WebSocket session {} bound to connection {}", session.getId(), connection.getConnectionId());

        Disposable heartbeats = Flux.interval(heartbeatInterval)
                .subscribe(tick -> sendHeartbeat(connection));

        Flux<WebSocketMessage> output = attachment.getOutbound()
                .map(message -> session.textMessage(toJson(Frame.from(message))));

        Mono<Void> input = session.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .concatMap(text -> handleFrame(session, connection, closedByClient, text))
                .then();

        return session.send(output)
                .then(Mono.defer(session::close))
                .and(input)
                .doFinally(signalType -> {
                    heartbeats.dispose();
                    if (!closedByClient.get()) {
                        dispatcher.transportLost(connection, generation);
                    }
                    log.info("WebSocket session {} ended: {}", session.getId(), signalType);
                });
    }

    private Mono<Void> handleFrame(WebSocketSession session, ConnectionHandle connection,
                                   AtomicBoolean closedByClient, String text) {
        ClientFrame frame;
        try {
            frame = objectMapper.readValue(text, ClientFrame.class);
        } catch (JsonProcessingException e) {
            log.warn("Invalid JSON frame on connection {}: {}", connection.getConnectionId(), e.getOriginalMessage());
            sendError(connection, new IllegalArgumentException("Invalid JSON frame"));
            return Mono.empty();
        }

        String type = frame.getType() == null ? "" : frame.getType();
        try {
            switch (type) {
                case "message":
                    submit(connection, frame);
                    return Mono.empty();
                case "ack":
                    dispatcher.acknowledge(connection, frame.getSeq() != null ? frame.getSeq() : 0L);
                    return Mono.empty();
                case "ping":
                    dispatcher.heartbeat(connection);
                    sendHeartbeat(connection);
                    return Mono.empty();
                case "close":
                    closedByClient.set(true);
                    dispatcher.close(connection);
                    return session.close(CloseStatus.NORMAL);
                default:
                    sendError(connection, new IllegalArgumentException("Unknown frame type: " + type));
                    return Mono.empty();
            }
        } catch (InvalidStateException e) {
            log.debug("Frame {} ignored on connection {}: {}", type, connection.getConnectionId(), e.getMessage());
            return Mono.empty();
        }
    }

    /**
     * Replies and failures reach the client as sequenced frames published by the dispatcher.
     */
    private void submit(ConnectionHandle connection, ClientFrame frame) {
        Map<String, Object> context = frame.getContext() != null ? frame.getContext() : Collections.emptyMap();
        dispatcher.send(connection, frame.getContent(), context)
                .subscribe(
                        reply -> log.debug("Reply delivered on connection {} (session {})",
                                connection.getConnectionId(), reply.getSessionId()),
                        error -> log.debug("Turn failed on connection {}: {}",
                                connection.getConnectionId(), error.getMessage()));
    }

    private void sendHeartbeat(ConnectionHandle connection) {
        try {
            dispatcher.publish(connection, OutboundType.HEARTBEAT,
                    Map.of("connectionId", connection.getConnectionId()));
        } catch (InvalidStateException e) {
            log.debug("Heartbeat skipped, connection {} is closed", connection.getConnectionId());
        }
    }

    private void sendError(ConnectionHandle connection, Throwable error) {
        try {
            dispatcher.publish(connection, OutboundType.ERROR, SessionDispatcher.errorPayload(error));
        } catch (InvalidStateException e) {
            log.debug("Error frame skipped, connection {} is closed", connection.getConnectionId());
        }
    }

    private String toJson(Frame frame) {
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize {} frame: {}", frame.getType(), e.getMessage());
            return "{\"type\":\"error\",\"payload\":{\"error\":\"INTERNAL\"}}";
        }
    }

    /**
     * Inbound frame.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class ClientFrame {
        private String type;
        private String content;
        private Long seq;
        private Map<String, Object> context;
    }

    /**
     * Outbound frame.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    static class Frame {
        private String type;
        private long seq;
        private Object payload;
        private Instant timestamp;

        static Frame from(OutboundMessage message) {
            return Frame.builder()
                    .type(message.getType().wireName())
                    .seq(message.getSeq())
                    .payload(message.getPayload())
                    .timestamp(message.getTimestamp())
                    .build();
        }
    }
}
