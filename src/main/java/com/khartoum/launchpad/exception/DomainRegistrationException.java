package com.khartoum.launchpad.exception;

public class DomainRegistrationException extends RuntimeException {
    public DomainRegistrationException(String message) {
        super(message);
    }
}
