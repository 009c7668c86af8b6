package com.z254.prophantom.hive.common.exception;

/**
 * Thrown for operations on a connection whose state does not allow them.
 */
public class InvalidStateException extends HiveException {

    public InvalidStateException(String message) {
        super(ErrorKind.INVALID_STATE, message);
    }
}
