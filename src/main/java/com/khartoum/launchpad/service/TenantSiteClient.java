package com.khartoum.launchpad.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.khartoum.launchpad.dto.SiteSeed;
import com.khartoum.launchpad.exception.ProvisioningException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes to a tenant's own database through its REST data API, authenticated
 * with the tenant's service-role key. Values travel as JSON bodies, never as
 * SQL text.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TenantSiteClient {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public void upsertSiteConfig(String apiUrl, String serviceRoleKey, SiteSeed seed) {
        Map<String, Object> branding = new LinkedHashMap<>();
        branding.put("siteName", seed.getSiteName());
        branding.put("logoUrl", null);
        branding.put("faviconUrl", null);

        List<Map<String, String>> rows = List.of(
            configRow("branding", branding),
            configRow("theme", Map.of("preset", seed.getThemePreset())),
            configRow("features", seed.getFeatures() != null ? seed.getFeatures() : Map.of())
        );

        upsert(apiUrl, serviceRoleKey, "site_config", "key", rows, "Failed to seed site_config");
    }

    public void upsertAdmin(String apiUrl, String serviceRoleKey, String email) {
        upsert(apiUrl, serviceRoleKey, "admins", "email", List.of(Map.of("email", email)), "Failed to seed admin");
    }

    /** Replaces the tenant's runtime feature set with {@code features}. */
    public void updateFeatures(String apiUrl, String serviceRoleKey, Map<String, Boolean> features) {
        upsert(apiUrl, serviceRoleKey, "site_config", "key",
            List.of(configRow("features", new HashMap<>(features))), "Failed to update site_config features");
    }

    private void upsert(String apiUrl, String serviceRoleKey, String table, String conflictColumn,
                        List<? extends Map<String, ?>> rows, String failurePrefix) {
        String url = apiUrl + "/rest/v1/" + table + "?on_conflict=" + conflictColumn;

        HttpHeaders headers = new HttpHeaders();
        headers.set("apikey", serviceRoleKey);
        headers.setBearerAuth(serviceRoleKey);
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("Prefer", "resolution=merge-duplicates");

        try {
            restTemplate.exchange(url, HttpMethod.POST, new HttpEntity<>(rows, headers), String.class);
            log.debug("Upserted {} row(s) into {} at {}", rows.size(), table, apiUrl);
        } catch (HttpStatusCodeException e) {
            throw new ProvisioningException(failurePrefix + ": (" + e.getStatusCode().value() + ") "
                + e.getResponseBodyAsString(), e);
        } catch (ResourceAccessException e) {
            throw new ProvisioningException(failurePrefix + ": " + e.getMessage(), e);
        }
    }

    private Map<String, String> configRow(String key, Object value) {
        try {
            return Map.of("key", key, "value", objectMapper.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new ProvisioningException("Could not serialize " + key + " config", e);
        }
    }
}
