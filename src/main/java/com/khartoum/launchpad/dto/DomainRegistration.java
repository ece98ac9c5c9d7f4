package com.khartoum.launchpad.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Outcome of registering one hostname. {@code verified} is true only when the
 * TLS certificate was already issued at registration time.
 */
@Data
@AllArgsConstructor
public class DomainRegistration {
    private boolean success;
    private boolean verified;
    private boolean skipped;
    private String error;

    public static DomainRegistration registered(boolean verified) {
        return new DomainRegistration(true, verified, false, null);
    }

    public static DomainRegistration skippedRegistration() {
        return new DomainRegistration(true, false, true, null);
    }

    public static DomainRegistration failed(String error) {
        return new DomainRegistration(false, false, false, error);
    }
}
