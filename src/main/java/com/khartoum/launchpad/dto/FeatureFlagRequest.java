package com.khartoum.launchpad.dto;

import lombok.Data;

import java.util.Map;

@Data
public class FeatureFlagRequest {
    /** Values are checked to be booleans before propagation. */
    private Map<String, Object> flags;
}
