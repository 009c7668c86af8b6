package com.z254.prophantom.hive.common.exception;

public class NotFoundException extends HiveException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
