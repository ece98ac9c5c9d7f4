package com.khartoum.launchpad.exception;

/**
 * Raised when the managed database service rejects or fails a provisioning,
 * migration or seeding request. Not retried.
 */
public class ProvisioningException extends RuntimeException {
    public ProvisioningException(String message) {
        super(message);
    }

    public ProvisioningException(String message, Throwable cause) {
        super(message, cause);
    }
}
