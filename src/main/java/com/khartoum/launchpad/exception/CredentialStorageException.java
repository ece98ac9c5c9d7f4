package com.khartoum.launchpad.exception;

public class CredentialStorageException extends RuntimeException {
    public CredentialStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
