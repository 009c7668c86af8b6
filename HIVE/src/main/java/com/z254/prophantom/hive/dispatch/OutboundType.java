package com.z254.prophantom.hive.dispatch;

import java.util.Locale;

public enum OutboundType {
    MESSAGE(true),
    ERROR(true),
    HEARTBEAT(false),
    /** Reports retained messages lost to queue overflow. */
    GAP(false),
    RESUMED(false);

    private final boolean sequenced;

    OutboundType(boolean sequenced) {
        this.sequenced = sequenced;
    }

    /**
     * Sequenced messages get a new sequence number and are retained for replay.
     */
    public boolean isSequenced() {
        return sequenced;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
