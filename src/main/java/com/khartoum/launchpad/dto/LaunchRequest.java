package com.khartoum.launchpad.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.ToString;

import java.util.Map;

/**
 * Launch wizard submission. Slug format and reserved names are checked by
 * the domain registrar, not here, so the wizard and the API share one guard.
 */
@Data
public class LaunchRequest {
    @NotBlank(message = "slug and displayName are required")
    private String slug;

    @NotBlank(message = "slug and displayName are required")
    @Size(max = 100, message = "Display name must be 100 characters or fewer")
    private String displayName;

    @Pattern(regexp = "^(?=.{4,253}$)([a-z0-9]([a-z0-9-]{0,61}[a-z0-9])?\\.)+[a-z]{2,63}$",
             message = "Invalid custom domain")
    private String customDomain;

    private String template;
    private String themePreset;
    private Map<String, Boolean> features;

    @ToString.Exclude
    private String googleMapsKey;

    private String aiProvider;

    @ToString.Exclude
    private String aiKey;

    private String emailProvider;

    @ToString.Exclude
    private String emailKey;
}
