package com.khartoum.launchpad.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Overall status of a {@link TenantJob}. {@link #TIMEOUT} is terminal like
 * {@link #FAILED} but marks a step that exceeded its deadline.
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    TIMEOUT;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == TIMEOUT;
    }
}
