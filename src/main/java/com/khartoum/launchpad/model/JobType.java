package com.khartoum.launchpad.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum JobType {
    LAUNCH,
    UPDATE_KEYS,
    ADD_DOMAIN,
    UPGRADE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
