package com.khartoum.launchpad.exception;

/** Input rejected before any tenant or job is created. */
public class InvalidRequestException extends RuntimeException {
    public InvalidRequestException(String message) {
        super(message);
    }
}
