package com.z254.prophantom.hive.dispatch;

import lombok.Value;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Bounded buffer of sequenced messages not yet acknowledged by the client.
 * When full, the oldest message is dropped and remembered so that a later
 * replay can report the loss as a gap.
 */
class RetainedQueue {

    @Value
    static class Replay {
        List<OutboundMessage> messages;
        Optional<ReplayGap> gap;
    }

    private final int capacity;
    private final Deque<OutboundMessage> messages = new ArrayDeque<>();
    private long droppedThrough;
    private long droppedCount;

    RetainedQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Retained queue capacity must be positive");
        }
        this.capacity = capacity;
    }

    /**
     * @return true if the oldest message had to be dropped
     */
    synchronized boolean add(OutboundMessage message) {
        boolean dropped = false;
        if (messages.size() == capacity) {
            OutboundMessage oldest = messages.pollFirst();
            droppedThrough = oldest.getSeq();
            droppedCount++;
            dropped = true;
        }
        messages.addLast(message);
        return dropped;
    }

    synchronized void acknowledge(long seq) {
        while (!messages.isEmpty() && messages.peekFirst().getSeq() <= seq) {
            messages.pollFirst();
        }
    }

    /**
     * Messages after the given sequence number, in order, plus the range lost to overflow if any.
     */
    synchronized Replay replayAfter(long lastAckSeq) {
        List<OutboundMessage> pending = new ArrayList<>();
        for (OutboundMessage message : messages) {
            if (message.getSeq() > lastAckSeq) {
                pending.add(message);
            }
        }
        Optional<ReplayGap> gap = droppedThrough > lastAckSeq
                ? Optional.of(new ReplayGap(lastAckSeq + 1, droppedThrough))
                : Optional.empty();
        return new Replay(pending, gap);
    }

    synchronized int size() {
        return messages.size();
    }

    synchronized long droppedCount() {
        return droppedCount;
    }
}
