package com.z254.prophantom.hive.dispatch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RetainedQueue}.
 */
class RetainedQueueTest {

    private static OutboundMessage message(long seq) {
        return new OutboundMessage(OutboundType.MESSAGE, seq, "payload-" + seq, Instant.EPOCH);
    }

    @Test
    @DisplayName("should replay unacknowledged messages in order")
    void shouldReplayInOrder() {
        RetainedQueue queue = new RetainedQueue(10);
        for (long seq = 1; seq <= 5; seq++) {
            queue.add(message(seq));
        }

        RetainedQueue.Replay replay = queue.replayAfter(2);

        assertThat(replay.getMessages()).extracting(OutboundMessage::getSeq).containsExactly(3L, 4L, 5L);
        assertThat(replay.getGap()).isEmpty();
    }

    @Test
    @DisplayName("should forget acknowledged messages")
    void shouldForgetAcknowledged() {
        RetainedQueue queue = new RetainedQueue(10);
        for (long seq = 1; seq <= 4; seq++) {
            queue.add(message(seq));
        }

        queue.acknowledge(3);

        assertThat(queue.size()).isEqualTo(1);
        assertThat(queue.replayAfter(0).getMessages()).extracting(OutboundMessage::getSeq).containsExactly(4L);
    }

    @Test
    @DisplayName("should drop the oldest message when full and report the loss as a gap")
    void shouldReportGapAfterOverflow() {
        RetainedQueue queue = new RetainedQueue(3);
        boolean anyDropped = false;
        for (long seq = 1; seq <= 5; seq++) {
            anyDropped |= queue.add(message(seq));
        }

        RetainedQueue.Replay replay = queue.replayAfter(0);

        assertThat(anyDropped).isTrue();
        assertThat(queue.droppedCount()).isEqualTo(2);
        assertThat(replay.getMessages()).extracting(OutboundMessage::getSeq).containsExactly(3L, 4L, 5L);
        assertThat(replay.getGap()).contains(new ReplayGap(1, 2));
    }

    @Test
    @DisplayName("should not report a gap the client has already acknowledged past")
    void shouldNotReportAcknowledgedGap() {
        RetainedQueue queue = new RetainedQueue(2);
        for (long seq = 1; seq <= 3; seq++) {
            queue.add(message(seq));
        }

        assertThat(queue.replayAfter(1).getGap()).isEmpty();
        assertThat(queue.replayAfter(1).getMessages()).extracting(OutboundMessage::getSeq).containsExactly(2L, 3L);
    }

    @Test
    @DisplayName("should require a positive capacity")
    void shouldRequirePositiveCapacity() {
        assertThatThrownBy(() -> new RetainedQueue(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
