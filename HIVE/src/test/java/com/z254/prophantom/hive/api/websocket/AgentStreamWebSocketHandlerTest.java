package com.z254.prophantom.hive.api.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.prophantom.hive.HiveTestFixture;
import com.z254.prophantom.hive.dispatch.ConnectionHandle;
import com.z254.prophantom.hive.dispatch.ConnectionState;
import com.z254.prophantom.hive.dispatch.OutboundType;
import com.z254.prophantom.hive.dispatch.TransportKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.reactivestreams.Publisher;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.HandshakeInfo;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link AgentStreamWebSocketHandler}.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class AgentStreamWebSocketHandlerTest {

    @Mock
    private WebSocketSession session;

    private HiveTestFixture fixture;
    private AgentStreamWebSocketHandler handler;
    private List<String> sentMessages;

    @BeforeEach
    void setUp() {
        fixture = new HiveTestFixture();
        handler = new AgentStreamWebSocketHandler(fixture.dispatcher, fixture.objectMapper, fixture.properties);
        sentMessages = new CopyOnWriteArrayList<>();

        when(session.getId()).thenReturn("ws-session-1");
        when(session.receive()).thenReturn(Flux.empty());
        when(session.textMessage(anyString())).thenAnswer(inv -> {
            String payload = inv.getArgument(0);
            sentMessages.add(payload);
            return mock(WebSocketMessage.class);
        });
        when(session.close()).thenReturn(Mono.empty());
        when(session.close(any(CloseStatus.class))).thenReturn(Mono.empty());
        sendUntil(frames -> false);
    }

    private void connect(String query) {
        URI uri = URI.create("ws://localhost" + AgentStreamWebSocketHandler.PATH + "?" + query);
        when(session.getHandshakeInfo()).thenReturn(new HandshakeInfo(uri, new HttpHeaders(), Mono.empty(), null));
    }

    private void receive(String... frames) {
        List<WebSocketMessage> inbound = new ArrayList<>();
        for (String frame : frames) {
            WebSocketMessage message = mock(WebSocketMessage.class);
            when(message.getPayloadAsText()).thenReturn(frame);
            inbound.add(message);
        }
        when(session.receive()).thenReturn(Flux.fromIterable(inbound));
    }

    /**
     * Consumes outbound frames until {@code done} holds for the frames sent so far.
     */
    private void sendUntil(Predicate<List<String>> done) {
        doAnswer(inv -> {
            Publisher<WebSocketMessage> outbound = inv.getArgument(0);
            return Flux.from(outbound)
                    .takeUntil(message -> done.test(sentMessages))
                    .then();
        }).when(session).send(any());
    }

    private List<JsonNode> frames(String type) {
        return sentMessages.stream()
                .map(this::parse)
                .filter(node -> type.equals(node.path("type").asText()))
                .collect(Collectors.toList());
    }

    private JsonNode parse(String json) {
        try {
            return fixture.objectMapper.readTree(json);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private long count(List<String> sent, String type) {
        return sent.stream().filter(json -> json.contains("\"type\":\"" + type + "\"")).count();
    }

    private void runHandler() {
        StepVerifier.create(handler.handle(session))
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    private String connectionId() {
        return frames("heartbeat").get(0).path("payload").path("connectionId").asText();
    }

    @Nested
    @DisplayName("Handshake")
    class HandshakeTests {

        @Test
        @DisplayName("should announce the connection id and keep the connection for reconnect")
        void announcesConnection() {
            connect("userId=user-1&agentType=" + HiveTestFixture.AGENT);
            sendUntil(sent -> count(sent, "heartbeat") >= 1);

            runHandler();

            String connectionId = connectionId();
            assertThat(connectionId).isNotBlank();
            assertThat(fixture.dispatcher.state(connectionId)).contains(ConnectionState.RECONNECTING);
        }

        @Test
        @DisplayName("should refuse an unknown agent type with an error frame")
        void refusesUnknownAgent() {
            connect("userId=user-1&agentType=nope");

            runHandler();

            assertThat(frames("error")).singleElement()
                    .satisfies(frame -> assertThat(frame.path("payload").path("error").asText())
                            .isEqualTo("UNKNOWN_AGENT"));
            verify(session).close(CloseStatus.POLICY_VIOLATION);
            assertThat(fixture.dispatcher.connections()).isEmpty();
        }

        @Test
        @DisplayName("should refuse a resume of an unknown connection as expired")
        void refusesExpiredResume() {
            connect("userId=user-1&connectionId=missing&lastSeq=0");

            runHandler();

            assertThat(frames("error")).singleElement()
                    .satisfies(frame -> {
                        assertThat(frame.path("payload").path("error").asText()).isEqualTo("SESSION_EXPIRED");
                        assertThat(frame.path("payload").path("code").asInt()).isEqualTo(1002);
                    });
            verify(session).close(CloseStatus.POLICY_VIOLATION);
        }
    }

    @Nested
    @DisplayName("Client frames")
    class ClientFrameTests {

        @Test
        @DisplayName("should answer a message frame with a sequenced reply")
        void message() {
            connect("userId=user-1&agentType=" + HiveTestFixture.AGENT);
            receive("{\"type\":\"message\",\"content\":\"hello\"}");
            sendUntil(sent -> count(sent, "message") >= 1);

            runHandler();

            assertThat(frames("message")).singleElement()
                    .satisfies(frame -> {
                        assertThat(frame.path("seq").asLong()).isEqualTo(1);
                        assertThat(frame.path("payload").path("replyText").asText()).isEqualTo("Reply to: hello");
                    });
            assertThat(fixture.provider.getCalls()).isEqualTo(1);
        }

        @Test
        @DisplayName("should answer ping with a heartbeat")
        void ping() {
            connect("userId=user-1&agentType=" + HiveTestFixture.AGENT);
            receive("{\"type\":\"ping\"}");
            sendUntil(sent -> count(sent, "heartbeat") >= 2);

            runHandler();

            assertThat(frames("heartbeat")).hasSize(2)
                    .allSatisfy(frame -> assertThat(frame.path("payload").path("connectionId").asText())
                            .isEqualTo(connectionId()));
        }

        @Test
        @DisplayName("should report an unknown frame type")
        void unknownType() {
            connect("userId=user-1&agentType=" + HiveTestFixture.AGENT);
            receive("{\"type\":\"subscribe\"}");
            sendUntil(sent -> count(sent, "error") >= 1);

            runHandler();

            assertThat(frames("error")).singleElement()
                    .satisfies(frame -> {
                        assertThat(frame.path("payload").path("error").asText()).isEqualTo("BAD_REQUEST");
                        assertThat(frame.path("payload").path("message").asText())
                                .isEqualTo("Unknown frame type: subscribe");
                    });
        }

        @Test
        @DisplayName("should report invalid JSON")
        void invalidJson() {
            connect("userId=user-1&agentType=" + HiveTestFixture.AGENT);
            receive("not valid json {{{");
            sendUntil(sent -> count(sent, "error") >= 1);

            runHandler();

            assertThat(frames("error")).singleElement()
                    .satisfies(frame -> assertThat(frame.path("payload").path("message").asText())
                            .isEqualTo("Invalid JSON frame"));
        }

        @Test
        @DisplayName("should close the connection on a close frame")
        void close() {
            connect("userId=user-1&agentType=" + HiveTestFixture.AGENT);
            receive("{\"type\":\"close\"}");

            runHandler();

            assertThat(fixture.dispatcher.state(connectionId())).isEmpty();
            verify(session).close(CloseStatus.NORMAL);
        }
    }

    @Nested
    @DisplayName("Resume")
    class ResumeTests {

        @Test
        @DisplayName("should replay only the messages after the last acknowledged sequence")
        void replaysAfterLastSeq() {
            ConnectionHandle handle = fixture.dispatcher.open("user-1", HiveTestFixture.AGENT,
                    TransportKind.STREAMING);
            fixture.dispatcher.attach(handle);
            fixture.dispatcher.publish(handle, OutboundType.MESSAGE, Map.of("text", "one"));
            fixture.dispatcher.publish(handle, OutboundType.MESSAGE, Map.of("text", "two"));
            fixture.dispatcher.transportLost(handle);

            connect("userId=user-1&connectionId=" + handle.getConnectionId() + "&lastSeq=1");
            sendUntil(sent -> count(sent, "message") >= 1);

            runHandler();

            assertThat(frames("resumed")).hasSize(1);
            assertThat(frames("message")).singleElement()
                    .satisfies(frame -> {
                        assertThat(frame.path("seq").asLong()).isEqualTo(2);
                        assertThat(frame.path("payload").path("text").asText()).isEqualTo("two");
                    });
            assertThat(fixture.dispatcher.state(handle.getConnectionId())).contains(ConnectionState.RECONNECTING);
        }
    }
}
