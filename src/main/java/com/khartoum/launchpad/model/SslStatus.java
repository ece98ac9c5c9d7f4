package com.khartoum.launchpad.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SslStatus {
    PENDING,
    ACTIVE,
    FAILED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
