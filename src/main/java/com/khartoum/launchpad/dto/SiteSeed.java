package com.khartoum.launchpad.dto;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class SiteSeed {
    private String siteName;
    private String themePreset;
    private String adminEmail;
    private Map<String, Boolean> features;
}
