package com.z254.prophantom.hive.common.exception;

import lombok.Getter;

/**
 * Closed set of failure kinds surfaced by HIVE.
 * Each kind carries a stable code and a default human-readable message
 * that callers can render without knowing the internal cause.
 */
@Getter
public enum ErrorKind {

    ADMISSION_REJECTED(1001, "Capacity exceeded, retry later"),
    SESSION_EXPIRED(1002, "Session expired, open a new session"),
    BACKEND_TIMEOUT(1003, "The agent did not answer in time"),
    AGENT_UNAVAILABLE(1004, "The agent is temporarily unavailable"),
    INVALID_STATE(1005, "Operation not allowed on a closed connection"),
    STORE_CONFLICT(1006, "Concurrent memory update"),
    UNKNOWN_AGENT(1007, "Unknown agent type"),
    NOT_FOUND(1008, "Resource not found");

    private final int code;
    private final String message;

    ErrorKind(int code, String message) {
        this.code = code;
        this.message = message;
    }

    /**
     * Kinds that callers may retry themselves. The core never retries these internally.
     */
    public boolean isRetryableByCaller() {
        return this == ADMISSION_REJECTED || this == BACKEND_TIMEOUT || this == AGENT_UNAVAILABLE;
    }
}
