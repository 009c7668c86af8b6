package com.z254.prophantom.hive.common.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * Thrown when a request would exceed a concurrency ceiling.
 */
@Getter
public class AdmissionRejectedException extends HiveException {

    public enum Scope {
        GLOBAL,
        USER_AGENT,
        AGENT_QUEUE
    }

    private final Scope scope;
    private final Duration retryAfter;

    public AdmissionRejectedException(Scope scope, String message, Duration retryAfter) {
        super(ErrorKind.ADMISSION_REJECTED, message);
        this.scope = scope;
        this.retryAfter = retryAfter;
    }
}
