package com.khartoum.launchpad.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.khartoum.launchpad.config.LaunchpadProperties;
import com.khartoum.launchpad.dto.ProvisionedDatabase;
import com.khartoum.launchpad.dto.SiteSeed;
import com.khartoum.launchpad.exception.ProvisioningException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Creates one managed database project per tenant through the management API,
 * applies the template schema and seeds the tenant's runtime configuration.
 * Nothing here is retried: a failure is reported to the launch pipeline as is.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DatabaseProvisioner {

    static final String READY_STATUS = "ACTIVE_HEALTHY";
    static final Set<String> DEAD_STATUSES = Set.of("INACTIVE", "REMOVED");
    static final String EXTENSIONS_SQL =
        "CREATE EXTENSION IF NOT EXISTS pgcrypto; CREATE EXTENSION IF NOT EXISTS pg_trgm;";

    private static final SecureRandom RANDOM = new SecureRandom();

    private final RestTemplate restTemplate;
    private final LaunchpadProperties properties;
    private final MigrationCatalog migrationCatalog;
    private final TenantSiteClient tenantSiteClient;

    // ==================== PROJECT ====================

    public ProvisionedDatabase createDatabase(String slug) {
        LaunchpadProperties.Database config = properties.getDatabase();
        if (config.getOrganizationId() == null || config.getOrganizationId().isBlank()) {
            throw new ProvisioningException("launchpad.database.organization-id is required for provisioning");
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", config.getProjectPrefix() + slug);
        body.put("organization_id", config.getOrganizationId());
        body.put("region", config.getRegion());
        body.put("db_pass", generatePassword());
        body.put("plan", config.getPlan());

        JsonNode project;
        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(
                config.getManagementUrl() + "/projects", HttpMethod.POST,
                new HttpEntity<>(body, managementHeaders()), JsonNode.class);
            project = response.getBody();
        } catch (HttpStatusCodeException e) {
            throw new ProvisioningException("Failed to create database project ("
                + e.getStatusCode().value() + "): " + e.getResponseBodyAsString(), e);
        } catch (ResourceAccessException e) {
            throw new ProvisioningException("Failed to reach the database management API: " + e.getMessage(), e);
        }

        if (project == null || !project.hasNonNull("id")) {
            throw new ProvisioningException("Database management API returned no project id");
        }
        String ref = project.get("id").asText();
        log.info("Requested database project {} for slug {}", ref, slug);

        awaitReady(ref);

        Map<String, String> keys = fetchApiKeys(ref);
        String anonKey = keys.get("anon");
        String serviceRoleKey = keys.get("service_role");
        if (anonKey == null || serviceRoleKey == null) {
            throw new ProvisioningException("Missing API keys for project " + ref);
        }

        log.info("Database project {} is ready", ref);
        return new ProvisionedDatabase(ref, "https://" + ref + ".supabase.co", anonKey, serviceRoleKey);
    }

    private void awaitReady(String ref) {
        LaunchpadProperties.Database config = properties.getDatabase();
        Duration timeout = config.getReadyTimeout();
        long deadline = System.nanoTime() + timeout.toNanos();
        String url = config.getManagementUrl() + "/projects/" + ref;

        while (System.nanoTime() < deadline) {
            sleep(config.getPollInterval());

            try {
                ResponseEntity<JsonNode> response = restTemplate.exchange(
                    url, HttpMethod.GET, new HttpEntity<>(managementHeaders()), JsonNode.class);
                JsonNode status = response.getBody() != null ? response.getBody().get("status") : null;
                String value = status != null ? status.asText() : null;

                if (READY_STATUS.equals(value)) {
                    return;
                }
                if (value != null && DEAD_STATUSES.contains(value)) {
                    throw new ProvisioningException("Database project creation failed: " + value);
                }
                log.debug("Project {} status {}", ref, value);
            } catch (HttpStatusCodeException e) {
                // The project may not be visible yet
                log.debug("Status poll for {} returned {}", ref, e.getStatusCode().value());
            }
        }

        throw new ProvisioningException("Database project creation timed out after " + timeout.toSeconds()
            + "s. The project may still be provisioning; check the provider dashboard.");
    }

    private Map<String, String> fetchApiKeys(String ref) {
        String url = properties.getDatabase().getManagementUrl() + "/projects/" + ref + "/api-keys";
        JsonNode keys;
        try {
            keys = restTemplate.exchange(url, HttpMethod.GET,
                new HttpEntity<>(managementHeaders()), JsonNode.class).getBody();
        } catch (HttpStatusCodeException e) {
            throw new ProvisioningException("Failed to fetch API keys for project " + ref, e);
        }

        Map<String, String> byName = new LinkedHashMap<>();
        if (keys != null && keys.isArray()) {
            keys.forEach(key -> {
                if (key.hasNonNull("name") && key.hasNonNull("api_key")) {
                    byName.put(key.get("name").asText(), key.get("api_key").asText());
                }
            });
        }
        return byName;
    }

    // ==================== SCHEMA ====================

    /**
     * Applies every bundled migration in version order. Stops at the first
     * failing file.
     */
    public void runMigrations(String reference) {
        List<MigrationCatalog.Migration> migrations = migrationCatalog.list();
        if (migrations.isEmpty()) {
            log.warn("No template migrations found. Database {} will need migrations run manually.", reference);
            return;
        }

        runSql(reference, EXTENSIONS_SQL);

        for (MigrationCatalog.Migration migration : migrations) {
            try {
                runSql(reference, migration.readSql());
            } catch (RuntimeException e) {
                throw new ProvisioningException("Migration " + migration.getFilename() + " failed: " + e.getMessage(), e);
            }
            log.debug("Applied {} to {}", migration.getFilename(), reference);
        }
        log.info("Applied {} migration(s) to {}", migrations.size(), reference);
    }

    void runSql(String reference, String sql) {
        String url = properties.getDatabase().getManagementUrl() + "/projects/" + reference + "/database/query";
        try {
            restTemplate.exchange(url, HttpMethod.POST,
                new HttpEntity<>(Map.of("query", sql), managementHeaders()), String.class);
        } catch (HttpStatusCodeException e) {
            throw new ProvisioningException("SQL execution failed (" + e.getStatusCode().value() + "): "
                + e.getResponseBodyAsString(), e);
        } catch (ResourceAccessException e) {
            throw new ProvisioningException("SQL execution failed: " + e.getMessage(), e);
        }
    }

    // ==================== SEED ====================

    public void seedDatabase(String reference, String apiUrl, String serviceRoleKey, SiteSeed seed) {
        tenantSiteClient.upsertSiteConfig(apiUrl, serviceRoleKey, seed);
        tenantSiteClient.upsertAdmin(apiUrl, serviceRoleKey, seed.getAdminEmail());
        log.info("Seeded configuration for database {}", reference);
    }

    private HttpHeaders managementHeaders() {
        String token = properties.getDatabase().getManagementToken();
        if (token == null || token.isBlank()) {
            throw new ProvisioningException("launchpad.database.management-token is required");
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(token);
        headers.setContentType(MediaType.APPLICATION_JSON);
        return headers;
    }

    private static String generatePassword() {
        byte[] bytes = new byte[24];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private static void sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProvisioningException("Interrupted while waiting for the database project", e);
        }
    }
}
