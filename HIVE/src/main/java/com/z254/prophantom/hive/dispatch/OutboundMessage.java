package com.z254.prophantom.hive.dispatch;

import lombok.Value;

import java.time.Instant;

/**
 * Server-to-client message on a streaming connection.
 * Unsequenced messages carry the last assigned sequence number.
 */
@Value
public class OutboundMessage {
    OutboundType type;
    long seq;
    Object payload;
    Instant timestamp;
}
