package com.khartoum.launchpad.exception;

public class JobTrackerException extends RuntimeException {
    public JobTrackerException(String message, Throwable cause) {
        super(message, cause);
    }
}
