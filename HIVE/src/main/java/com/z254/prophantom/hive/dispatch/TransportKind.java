package com.z254.prophantom.hive.dispatch;

public enum TransportKind {
    /** One request, one reply, e.g. an HTTP call. */
    REQUEST_RESPONSE,
    /** Long-lived bidirectional channel with sequenced server pushes. */
    STREAMING
}
