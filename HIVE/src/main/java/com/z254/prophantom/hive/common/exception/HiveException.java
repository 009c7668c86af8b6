package com.z254.prophantom.hive.common.exception;

import lombok.Getter;

/**
 * Base exception for all HIVE failures.
 */
@Getter
public class HiveException extends RuntimeException {

    private final ErrorKind kind;

    public HiveException(ErrorKind kind) {
        super(kind.getMessage());
        this.kind = kind;
    }

    public HiveException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public HiveException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public int getCode() {
        return kind.getCode();
    }
}
