package com.khartoum.launchpad.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of a tenant site. Only the launch pipeline moves a tenant out of
 * {@link #PROVISIONING}, either to {@link #ACTIVE} or to {@link #SUSPENDED}.
 */
public enum TenantStatus {
    PROVISIONING,
    ACTIVE,
    SUSPENDED,
    ARCHIVED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
