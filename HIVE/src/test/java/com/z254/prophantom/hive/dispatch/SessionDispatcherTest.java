package com.z254.prophantom.hive.dispatch;

import com.z254.prophantom.hive.FakeLLMProvider;
import com.z254.prophantom.hive.HiveTestFixture;
import com.z254.prophantom.hive.common.exception.AdmissionRejectedException;
import com.z254.prophantom.hive.common.exception.BackendTimeoutException;
import com.z254.prophantom.hive.common.exception.InvalidStateException;
import com.z254.prophantom.hive.common.exception.SessionExpiredException;
import com.z254.prophantom.hive.common.exception.UnknownAgentException;
import com.z254.prophantom.hive.domain.model.AgentReply;
import com.z254.prophantom.hive.domain.model.MemoryItem;
import com.z254.prophantom.hive.llm.LLMRequest;
import com.z254.prophantom.hive.llm.LLMResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Unit tests for {@link SessionDispatcher}.
 */
class SessionDispatcherTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private HiveTestFixture fixture;
    private SessionDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        fixture = new HiveTestFixture();
        dispatcher = fixture.dispatcher;
    }

    private ConnectionHandle openStreaming() {
        return dispatcher.open("u1", HiveTestFixture.AGENT, TransportKind.STREAMING);
    }

    @Nested
    @DisplayName("open and close")
    class OpenAndClose {

        @Test
        @DisplayName("should open a connected connection for a known agent")
        void shouldOpenConnection() {
            ConnectionHandle handle = openStreaming();

            assertThat(dispatcher.state(handle.getConnectionId())).contains(ConnectionState.CONNECTED);
            assertThat(dispatcher.findHandle(handle.getConnectionId())).contains(handle);
            assertThat(fixture.hiveMetrics.getOpenConnections()).isEqualTo(1);
            assertThat(dispatcher.stateCounts()).containsEntry(ConnectionState.CONNECTED, 1);
        }

        @Test
        @DisplayName("should refuse unknown agents and anonymous users")
        void shouldValidateOpen() {
            assertThatThrownBy(() -> dispatcher.open("u1", "tarot", TransportKind.STREAMING))
                    .isInstanceOf(UnknownAgentException.class);
            assertThatThrownBy(() -> dispatcher.open(" ", HiveTestFixture.AGENT, TransportKind.STREAMING))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(dispatcher.connections()).isEmpty();
        }

        @Test
        @DisplayName("should close idempotently and refuse further messages")
        void shouldCloseIdempotently() {
            ConnectionHandle handle = openStreaming();

            dispatcher.close(handle);
            dispatcher.close(handle);

            assertThat(fixture.hiveMetrics.getOpenConnections()).isZero();
            assertThat(dispatcher.state(handle.getConnectionId())).isEmpty();
            StepVerifier.create(dispatcher.send(handle, "hello?"))
                    .expectError(InvalidStateException.class)
                    .verify(WAIT);
        }

        @Test
        @DisplayName("should cancel in-flight work when the connection closes")
        void shouldCancelInFlightWork() {
            fixture.provider.hang();
            ConnectionHandle handle = openStreaming();

            StepVerifier.create(dispatcher.send(handle, "anyone there?"))
                    .then(() -> dispatcher.close(handle))
                    .expectError(InvalidStateException.class)
                    .verify(WAIT);

            assertThat(fixture.admissionController.inFlight()).isZero();
            assertThat(fixture.memoryStore.itemsOfUser("u1")).isEmpty();
        }
    }

    @Nested
    @DisplayName("send")
    class Send {

        @Test
        @DisplayName("should deliver the reply as the next sequenced message")
        void shouldDeliverReply() {
            ConnectionHandle handle = openStreaming();
            Connection.Attachment attachment = dispatcher.attach(handle);

            AgentReply reply = dispatcher.send(handle, "hello").block(WAIT);
            dispatcher.transportLost(handle, attachment.getGeneration());

            List<OutboundMessage> frames = attachment.getOutbound().collectList().block(WAIT);
            assertThat(frames).singleElement().satisfies(frame -> {
                assertThat(frame.getType()).isEqualTo(OutboundType.MESSAGE);
                assertThat(frame.getSeq()).isEqualTo(1);
                assertThat(frame.getPayload()).isEqualTo(reply);
            });
            assertThat(reply.getReplyText()).isEqualTo("Reply to: hello");
        }

        @Test
        @DisplayName("should return the connection to idle after the turn")
        void shouldReturnToIdle() {
            ConnectionHandle handle = openStreaming();

            dispatcher.send(handle, "hello").block(WAIT);

            assertThat(dispatcher.state(handle.getConnectionId())).contains(ConnectionState.IDLE);
            assertThat(fixture.admissionController.inFlight()).isZero();
        }

        @Test
        @DisplayName("should serve one message of a session at a time, in arrival order")
        void shouldSerializeSessionTurns() {
            fixture.provider.respondWith(request -> {
                String message = FakeLLMProvider.lastUserMessage(request);
                Mono<LLMResponse> response = Mono.just(LLMResponse.text("ok " + message, request.getModel(), "ollama"));
                return message.equals("first") ? response.delayElement(Duration.ofMillis(200)) : response;
            });
            ConnectionHandle handle = openStreaming();

            Mono<AgentReply> first = dispatcher.send(handle, "first");
            Mono<AgentReply> second = dispatcher.send(handle, "second");
            List<AgentReply> replies = Mono.zip(first, second, (a, b) -> List.of(a, b)).block(WAIT);

            assertThat(replies).extracting(AgentReply::getInteractionCount).containsExactly(1L, 2L);
            List<LLMRequest> requests = fixture.provider.getRequests();
            assertThat(FakeLLMProvider.lastUserMessage(requests.get(0))).isEqualTo("first");
            assertThat(requests.get(1).getMessages())
                    .anySatisfy(message -> assertThat(message.getContent()).contains("User: first"));
            assertThat(fixture.memoryStore.itemsOfUser("u1")).extracting(MemoryItem::getContent)
                    .containsExactly("User: first\nAssistant: ok first", "User: second\nAssistant: ok second");
        }

        @Test
        @DisplayName("should reject beyond the per-user limit and report it on the stream")
        void shouldRejectOverLimit() {
            fixture.properties.getDispatcher().setPerUserAgentMaxConcurrent(1);
            fixture.provider.hang();
            ConnectionHandle handle = openStreaming();
            Connection.Attachment attachment = dispatcher.attach(handle);
            dispatcher.send(handle, "slow").subscribe(reply -> { }, error -> { });

            StepVerifier.create(dispatcher.send(handle, "impatient"))
                    .expectError(AdmissionRejectedException.class)
                    .verify(WAIT);

            dispatcher.close(handle);
            List<OutboundMessage> frames = attachment.getOutbound().collectList().block(WAIT);
            assertThat(frames).first().satisfies(frame -> {
                assertThat(frame.getType()).isEqualTo(OutboundType.ERROR);
                assertThat(frame.getPayload()).isEqualTo(SessionDispatcher.errorPayload(
                        new AdmissionRejectedException(AdmissionRejectedException.Scope.USER_AGENT,
                                "Too many concurrent requests for emo_ai", Duration.ofSeconds(1))));
            });
        }

        @Test
        @DisplayName("should reject a blank message")
        void shouldRejectBlankMessage() {
            ConnectionHandle handle = openStreaming();

            StepVerifier.create(dispatcher.send(handle, "  "))
                    .expectError(IllegalArgumentException.class)
                    .verify(WAIT);
            assertThat(fixture.admissionController.inFlight()).isZero();
        }

        @Test
        @DisplayName("should report backend timeouts as error messages")
        void shouldReportTimeouts() {
            fixture.properties.getAgents().get(HiveTestFixture.AGENT).setTimeout(Duration.ofMillis(50));
            fixture.provider.hang();
            ConnectionHandle handle = openStreaming();
            Connection.Attachment attachment = dispatcher.attach(handle);

            StepVerifier.create(dispatcher.send(handle, "hello"))
                    .expectError(BackendTimeoutException.class)
                    .verify(WAIT);

            dispatcher.transportLost(handle);
            assertThat(attachment.getOutbound().collectList().block(WAIT)).singleElement()
                    .satisfies(frame -> {
                        assertThat(frame.getType()).isEqualTo(OutboundType.ERROR);
                        assertThat(frame.getSeq()).isEqualTo(1);
                    });
        }
    }

    @Nested
    @DisplayName("exchange")
    class Exchange {

        @Test
        @DisplayName("should answer over a connection that is gone afterwards")
        void shouldUseEphemeralConnection() {
            AgentReply reply = dispatcher.exchange("u1", HiveTestFixture.AGENT, "hi", Map.of("mood", "happy"))
                    .block(WAIT);

            assertThat(reply.getInteractionCount()).isEqualTo(1);
            assertThat(dispatcher.connections()).isEmpty();
            assertThat(fixture.hiveMetrics.getOpenConnections()).isZero();
            assertThat(fixture.provider.getRequests().get(0).getMessages())
                    .anySatisfy(message -> assertThat(message.getContent()).contains("mood: happy"));
        }

        @Test
        @DisplayName("should forget session lanes and per-user limits once every exchange is done")
        void shouldReleasePerSessionState() {
            List<AgentReply> replies = Flux.range(0, 200)
                    .concatMap(i -> dispatcher.exchange("user-" + i, HiveTestFixture.AGENT, "hi", Map.of()))
                    .collectList()
                    .block(WAIT);

            assertThat(replies).hasSize(200);
            await().atMost(WAIT).untilAsserted(() -> {
                assertThat(dispatcher.sessionLaneCount()).isZero();
                assertThat(fixture.admissionController.trackedUserAgents()).isZero();
                assertThat(fixture.admissionController.inFlight()).isZero();
            });
        }

        @Test
        @DisplayName("should fail for unknown agents without leaving a connection behind")
        void shouldFailForUnknownAgent() {
            StepVerifier.create(dispatcher.exchange("u1", "tarot", "hi", Map.of()))
                    .expectError(UnknownAgentException.class)
                    .verify(WAIT);
            assertThat(dispatcher.connections()).isEmpty();
        }
    }

    @Nested
    @DisplayName("reconnect")
    class Reconnect {

        @Test
        @DisplayName("should replay replies produced while disconnected exactly once")
        void shouldReplayExactlyOnce() {
            ConnectionHandle handle = openStreaming();
            Connection.Attachment first = dispatcher.attach(handle);
            dispatcher.send(handle, "one").block(WAIT);
            dispatcher.transportLost(handle, first.getGeneration());

            AgentReply missed = dispatcher.send(handle, "two").block(WAIT);
            Connection.ResumeResult resumed = dispatcher.resume(handle.getConnectionId(), "u1", 1);

            assertThat(resumed.getReplayed()).singleElement().satisfies(frame -> {
                assertThat(frame.getSeq()).isEqualTo(2);
                assertThat(frame.getPayload()).isEqualTo(missed);
            });
            assertThat(fixture.hiveMetrics.getMessagesReplayed().count()).isEqualTo(1.0);

            dispatcher.acknowledge(handle, 2);
            dispatcher.transportLost(handle, resumed.getAttachment().getGeneration());
            assertThat(dispatcher.resume(handle.getConnectionId(), "u1", 2).getReplayed()).isEmpty();
        }

        @Test
        @DisplayName("should not let a replaced transport knock a resumed connection offline")
        void shouldIgnoreOldTransport() {
            ConnectionHandle handle = openStreaming();
            Connection.Attachment first = dispatcher.attach(handle);
            dispatcher.transportLost(handle, first.getGeneration());
            dispatcher.resume(handle.getConnectionId(), "u1", 0);

            dispatcher.transportLost(handle, first.getGeneration());

            assertThat(dispatcher.state(handle.getConnectionId())).contains(ConnectionState.CONNECTED);
        }

        @Test
        @DisplayName("should refuse resumes by other users and for unknown connections")
        void shouldValidateResume() {
            ConnectionHandle handle = openStreaming();
            dispatcher.transportLost(handle);

            assertThatThrownBy(() -> dispatcher.resume(handle.getConnectionId(), "intruder", 0))
                    .isInstanceOf(InvalidStateException.class);
            assertThatThrownBy(() -> dispatcher.resume("missing", "u1", 0))
                    .isInstanceOf(SessionExpiredException.class);
        }

        @Test
        @DisplayName("should close connections whose grace window elapsed")
        void shouldExpireAfterGrace() {
            ConnectionHandle handle = openStreaming();
            dispatcher.transportLost(handle);

            fixture.clock.advance(Duration.ofSeconds(59));
            assertThat(dispatcher.sweep(fixture.clock.instant())).isZero();

            fixture.clock.advance(Duration.ofSeconds(1));
            assertThat(dispatcher.sweep(fixture.clock.instant())).isEqualTo(1);

            assertThat(dispatcher.state(handle.getConnectionId())).isEmpty();
            assertThat(fixture.hiveMetrics.getOpenConnections()).isZero();
            assertThatThrownBy(() -> dispatcher.resume(handle.getConnectionId(), "u1", 0))
                    .isInstanceOf(SessionExpiredException.class);
        }

        @Test
        @DisplayName("should expire on resume when the sweep has not run yet")
        void shouldExpireOnLateResume() {
            ConnectionHandle handle = openStreaming();
            dispatcher.transportLost(handle);
            fixture.clock.advance(Duration.ofMinutes(2));

            assertThatThrownBy(() -> dispatcher.resume(handle.getConnectionId(), "u1", 0))
                    .isInstanceOf(SessionExpiredException.class);
            assertThat(dispatcher.connections()).isEmpty();
        }

        @Test
        @DisplayName("should treat silent streaming connections as dropped")
        void shouldDropSilentConnections() {
            ConnectionHandle streaming = openStreaming();
            ConnectionHandle direct = dispatcher.open("u2", HiveTestFixture.AGENT, TransportKind.REQUEST_RESPONSE);
            fixture.clock.advance(Duration.ofSeconds(61));

            dispatcher.sweep(fixture.clock.instant());

            assertThat(dispatcher.state(streaming.getConnectionId())).contains(ConnectionState.RECONNECTING);
            assertThat(dispatcher.state(direct.getConnectionId())).contains(ConnectionState.CONNECTED);

            fixture.clock.advance(Duration.ofSeconds(60));
            assertThat(dispatcher.sweep(fixture.clock.instant())).isEqualTo(1);
        }

        @Test
        @DisplayName("should keep connections alive that send heartbeats")
        void shouldKeepHeartbeatingConnections() {
            ConnectionHandle handle = openStreaming();
            for (int i = 0; i < 4; i++) {
                fixture.clock.advance(Duration.ofSeconds(30));
                dispatcher.heartbeat(handle);
            }

            dispatcher.sweep(fixture.clock.instant());

            assertThat(dispatcher.state(handle.getConnectionId())).contains(ConnectionState.IDLE);
        }
    }

    @Test
    @DisplayName("should describe errors for clients")
    void shouldDescribeErrors() {
        assertThat(SessionDispatcher.errorPayload(new SessionExpiredException("c1")))
                .containsEntry("code", 1002)
                .containsEntry("error", "SESSION_EXPIRED");
        assertThat(SessionDispatcher.errorPayload(new IllegalArgumentException("bad")))
                .containsEntry("code", 400)
                .containsEntry("error", "BAD_REQUEST")
                .containsEntry("message", "bad");
        assertThat(SessionDispatcher.errorPayload(new IllegalStateException("oops")))
                .containsEntry("code", 500)
                .containsEntry("error", "INTERNAL");
    }
}
