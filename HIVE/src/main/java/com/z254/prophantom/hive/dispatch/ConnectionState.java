package com.z254.prophantom.hive.dispatch;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of a live connection and the transitions allowed between them.
 */
public enum ConnectionState {
    CONNECTING,
    CONNECTED,
    /** Heartbeat confirmed, no request in flight. */
    IDLE,
    /** At least one request in flight. */
    BUSY,
    /** Transport dropped, grace window open. */
    RECONNECTING,
    /** Terminal. */
    CLOSED;

    private Set<ConnectionState> targets;

    static {
        CONNECTING.targets = EnumSet.of(CONNECTED, CLOSED);
        CONNECTED.targets = EnumSet.of(IDLE, BUSY, RECONNECTING, CLOSED);
        IDLE.targets = EnumSet.of(BUSY, RECONNECTING, CLOSED);
        BUSY.targets = EnumSet.of(IDLE, RECONNECTING, CLOSED);
        RECONNECTING.targets = EnumSet.of(CONNECTED, CLOSED);
        CLOSED.targets = EnumSet.noneOf(ConnectionState.class);
    }

    public boolean canTransitionTo(ConnectionState target) {
        return targets.contains(target);
    }

    public boolean isLive() {
        return this == CONNECTED || this == IDLE || this == BUSY;
    }
}
