package com.z254.prophantom.hive.dispatch;

import com.z254.prophantom.hive.common.exception.HiveException;
import com.z254.prophantom.hive.common.exception.InvalidStateException;
import com.z254.prophantom.hive.common.exception.SessionExpiredException;
import lombok.Getter;
import lombok.Value;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * A client connection to one agent type. All state changes happen under the
 * connection's monitor, so a replay and a concurrent publish never interleave.
 */
public class Connection {

    /**
     * Observer for state changes, invoked while the connection lock is held.
     */
    @FunctionalInterface
    interface TransitionListener {
        void onTransition(Connection connection, ConnectionState from, ConnectionState to, String reason);
    }

    /**
     * An outbound transport bound to this connection. Each binding has a new generation.
     */
    @Value
    public static class Attachment {
        long generation;
        Flux<OutboundMessage> outbound;
    }

    @Value
    public static class ResumeResult {
        Attachment attachment;
        List<OutboundMessage> replayed;
        Optional<ReplayGap> gap;
    }

    @Getter
    private final ConnectionHandle handle;
    @Getter
    private final Instant openedAt;
    private final RetainedQueue retained;
    private final Duration reconnectGrace;
    private final TransitionListener listener;
    private final Sinks.Empty<Void> closed = Sinks.empty();

    private ConnectionState state = ConnectionState.CONNECTING;
    private Instant lastSeenAt;
    private Instant graceDeadline;
    private long lastSeq;
    private int inFlight;
    private Sinks.Many<OutboundMessage> live;
    private long generation;
    private volatile HiveException closeReason;

    Connection(ConnectionHandle handle, Instant now, int retainedCapacity, Duration reconnectGrace,
               TransitionListener listener) {
        this.handle = handle;
        this.openedAt = now;
        this.lastSeenAt = now;
        this.retained = new RetainedQueue(retainedCapacity);
        this.reconnectGrace = reconnectGrace;
        this.listener = listener;
    }

    public String getId() {
        return handle.getConnectionId();
    }

    public synchronized ConnectionState getState() {
        return state;
    }

    public synchronized Instant getLastSeenAt() {
        return lastSeenAt;
    }

    public synchronized int getInFlight() {
        return inFlight;
    }

    public synchronized long getLastSeq() {
        return lastSeq;
    }

    int retainedSize() {
        return retained.size();
    }

    long droppedCount() {
        return retained.droppedCount();
    }

    synchronized void established() {
        transition(ConnectionState.CONNECTED, "opened");
    }

    /**
     * Records client liveness. A confirmed heartbeat moves an idle-capable connection to IDLE.
     */
    synchronized void heartbeat(Instant now) {
        requireOpen();
        lastSeenAt = now;
        if (state == ConnectionState.CONNECTED && inFlight == 0) {
            transition(ConnectionState.IDLE, "heartbeat");
        }
    }

    synchronized void turnStarted(Instant now) {
        requireOpen();
        inFlight++;
        lastSeenAt = now;
        if (state == ConnectionState.CONNECTED || state == ConnectionState.IDLE) {
            transition(ConnectionState.BUSY, "request");
        }
    }

    synchronized void turnFinished() {
        if (inFlight > 0) {
            inFlight--;
        }
        if (inFlight == 0 && state == ConnectionState.BUSY) {
            transition(ConnectionState.IDLE, "request complete");
        }
    }

    /**
     * Assigns the next sequence number to sequenced messages and retains them.
     * Delivery to the live transport is skipped while reconnecting.
     *
     * @return the message as assigned, and whether the retained queue overflowed
     */
    synchronized Published publish(OutboundType type, Object payload, Instant now) {
        requireOpen();
        boolean dropped = false;
        OutboundMessage message;
        if (type.isSequenced()) {
            message = new OutboundMessage(type, ++lastSeq, payload, now);
            if (handle.getTransportKind() == TransportKind.STREAMING) {
                dropped = retained.add(message);
            }
        } else {
            message = new OutboundMessage(type, lastSeq, payload, now);
        }
        if (live != null && state != ConnectionState.RECONNECTING) {
            live.tryEmitNext(message);
        }
        return new Published(message, dropped);
    }

    @Value
    static class Published {
        OutboundMessage message;
        boolean dropped;
    }

    synchronized void acknowledge(long seq, Instant now) {
        requireOpen();
        lastSeenAt = now;
        retained.acknowledge(seq);
    }

    /**
     * Binds a new outbound transport. Any previously bound transport is completed.
     */
    synchronized Attachment attach() {
        requireOpen();
        Sinks.Many<OutboundMessage> sink = bindLive();
        return new Attachment(generation, sink.asFlux());
    }

    /**
     * Like {@link #transportLost(Instant, String)}, ignored if a newer transport has been bound since.
     */
    synchronized boolean transportLost(long attachmentGeneration, Instant now, String reason) {
        if (attachmentGeneration != generation) {
            return false;
        }
        return transportLost(now, reason);
    }

    /**
     * Starts the reconnect grace window. No-op if already reconnecting.
     */
    synchronized boolean transportLost(Instant now, String reason) {
        if (state == ConnectionState.CLOSED || state == ConnectionState.RECONNECTING) {
            return false;
        }
        if (state == ConnectionState.CONNECTING) {
            transition(ConnectionState.CONNECTED, "opened");
        }
        transition(ConnectionState.RECONNECTING, reason);
        graceDeadline = now.plus(reconnectGrace);
        completeLive();
        return true;
    }

    /**
     * Replays everything after {@code lastAckSeq} onto a fresh transport, exactly once.
     *
     * @throws SessionExpiredException if the connection is closed or its grace window elapsed
     */
    synchronized ResumeResult resume(long lastAckSeq, Instant now) {
        if (state == ConnectionState.CLOSED || isExpired(now)) {
            throw new SessionExpiredException(getId());
        }
        if (state != ConnectionState.RECONNECTING) {
            // Client noticed the drop before we did.
            transportLost(now, "superseded");
        }
        retained.acknowledge(lastAckSeq);
        RetainedQueue.Replay replay = retained.replayAfter(lastAckSeq);

        transition(ConnectionState.CONNECTED, "resumed");
        graceDeadline = null;
        lastSeenAt = now;
        if (inFlight > 0) {
            transition(ConnectionState.BUSY, "request");
        }

        Sinks.Many<OutboundMessage> sink = bindLive();
        sink.tryEmitNext(new OutboundMessage(OutboundType.RESUMED, lastSeq, null, now));
        replay.getGap().ifPresent(gap ->
                sink.tryEmitNext(new OutboundMessage(OutboundType.GAP, lastSeq, gap, now)));
        replay.getMessages().forEach(sink::tryEmitNext);
        return new ResumeResult(new Attachment(generation, sink.asFlux()), replay.getMessages(), replay.getGap());
    }

    /**
     * Closes the connection. In-flight requests observe {@code reason} as their failure.
     *
     * @return false if already closed
     */
    synchronized boolean close(HiveException reason, String description) {
        if (state == ConnectionState.CLOSED) {
            return false;
        }
        closeReason = reason;
        transition(ConnectionState.CLOSED, description);
        completeLive();
        closed.tryEmitEmpty();
        return true;
    }

    /**
     * Errors with the close reason once the connection is closed. Never completes otherwise.
     */
    <T> Mono<T> whenClosed() {
        return closed.asMono().then(Mono.defer(() -> Mono.error(closeReason)));
    }

    synchronized boolean isExpired(Instant now) {
        return state == ConnectionState.RECONNECTING && graceDeadline != null && !now.isBefore(graceDeadline);
    }

    synchronized boolean isHeartbeatOverdue(Instant now, Duration interval) {
        if (state != ConnectionState.CONNECTED && state != ConnectionState.IDLE) {
            return false;
        }
        return handle.getTransportKind() == TransportKind.STREAMING
                && now.isAfter(lastSeenAt.plus(interval.multipliedBy(2)));
    }

    private void transition(ConnectionState target, String reason) {
        ConnectionState from = state;
        if (!from.canTransitionTo(target)) {
            throw new InvalidStateException("Connection " + getId() + " cannot move from " + from + " to " + target);
        }
        state = target;
        listener.onTransition(this, from, target, reason);
    }

    private void requireOpen() {
        if (state == ConnectionState.CLOSED) {
            throw new InvalidStateException("Connection " + getId() + " is closed");
        }
    }

    private Sinks.Many<OutboundMessage> bindLive() {
        completeLive();
        generation++;
        live = Sinks.many().unicast().onBackpressureBuffer();
        return live;
    }

    private void completeLive() {
        if (live != null) {
            live.tryEmitComplete();
            live = null;
        }
    }
}
