package com.z254.prophantom.hive.dispatch;

import lombok.Value;

/**
 * Opaque reference to a connection owned by the dispatcher.
 */
@Value
public class ConnectionHandle {
    String connectionId;
    String userId;
    String agentType;
    TransportKind transportKind;
}
