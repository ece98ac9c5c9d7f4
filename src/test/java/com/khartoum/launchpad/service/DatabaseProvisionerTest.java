package com.khartoum.launchpad.service;

import com.khartoum.launchpad.config.LaunchpadProperties;
import com.khartoum.launchpad.dto.ProvisionedDatabase;
import com.khartoum.launchpad.dto.SiteSeed;
import com.khartoum.launchpad.exception.ProvisioningException;
import com.khartoum.launchpad.service.MigrationCatalog.Migration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

@ExtendWith(MockitoExtension.class)
class DatabaseProvisionerTest {

    private static final String API = "https://management.test/v1";

    @Mock
    private MigrationCatalog migrationCatalog;

    @Mock
    private TenantSiteClient tenantSiteClient;

    private LaunchpadProperties properties;
    private MockRestServiceServer server;
    private DatabaseProvisioner provisioner;

    @BeforeEach
    void setUp() {
        properties = new LaunchpadProperties();
        LaunchpadProperties.Database database = properties.getDatabase();
        database.setManagementUrl(API);
        database.setManagementToken("mgmt-token");
        database.setOrganizationId("org-42");
        database.setPollInterval(Duration.ofMillis(1));
        database.setReadyTimeout(Duration.ofSeconds(5));

        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        provisioner = new DatabaseProvisioner(restTemplate, properties, migrationCatalog, tenantSiteClient);
    }

    @Test
    void createDatabase_createsProjectWaitsForHealthAndReturnsKeys() {
        // Given
        server.expect(requestTo(API + "/projects"))
            .andExpect(method(HttpMethod.POST))
            .andExpect(header("Authorization", "Bearer mgmt-token"))
            .andExpect(jsonPath("$.name").value("rb-acme"))
            .andExpect(jsonPath("$.organization_id").value("org-42"))
            .andExpect(jsonPath("$.region").value("us-east-1"))
            .andExpect(jsonPath("$.db_pass").isNotEmpty())
            .andRespond(withSuccess("{\"id\":\"abcref\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(API + "/projects/abcref"))
            .andRespond(withSuccess("{\"status\":\"COMING_UP\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(API + "/projects/abcref"))
            .andRespond(withStatus(HttpStatus.NOT_FOUND));
        server.expect(requestTo(API + "/projects/abcref"))
            .andRespond(withSuccess("{\"status\":\"ACTIVE_HEALTHY\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(API + "/projects/abcref/api-keys"))
            .andRespond(withSuccess("[{\"name\":\"anon\",\"api_key\":\"anon-123\"},"
                + "{\"name\":\"service_role\",\"api_key\":\"service-456\"}]", MediaType.APPLICATION_JSON));

        // When
        ProvisionedDatabase database = provisioner.createDatabase("acme");

        // Then
        server.verify();
        assertEquals("abcref", database.getReference());
        assertEquals("https://abcref.supabase.co", database.getApiUrl());
        assertEquals("anon-123", database.getAnonKey());
        assertEquals("service-456", database.getServiceRoleKey());
    }

    @Test
    void createDatabase_reportsProviderRejection() {
        // Given
        server.expect(requestTo(API + "/projects"))
            .andRespond(withStatus(HttpStatus.PAYMENT_REQUIRED)
                .body("{\"message\":\"project limit reached\"}")
                .contentType(MediaType.APPLICATION_JSON));

        // When
        ProvisioningException exception = assertThrows(ProvisioningException.class,
            () -> provisioner.createDatabase("acme"));

        // Then
        assertEquals("Failed to create database project (402): {\"message\":\"project limit reached\"}",
            exception.getMessage());
    }

    @Test
    void createDatabase_failsWhenProjectBecomesInactive() {
        // Given
        server.expect(requestTo(API + "/projects"))
            .andRespond(withSuccess("{\"id\":\"abcref\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(API + "/projects/abcref"))
            .andRespond(withSuccess("{\"status\":\"INACTIVE\"}", MediaType.APPLICATION_JSON));

        // When
        ProvisioningException exception = assertThrows(ProvisioningException.class,
            () -> provisioner.createDatabase("acme"));

        // Then
        assertEquals("Database project creation failed: INACTIVE", exception.getMessage());
    }

    @Test
    void createDatabase_timesOutWhenProjectNeverBecomesHealthy() {
        // Given
        properties.getDatabase().setReadyTimeout(Duration.ZERO);
        server.expect(requestTo(API + "/projects"))
            .andRespond(withSuccess("{\"id\":\"abcref\"}", MediaType.APPLICATION_JSON));

        // When
        ProvisioningException exception = assertThrows(ProvisioningException.class,
            () -> provisioner.createDatabase("acme"));

        // Then
        assertTrue(exception.getMessage().startsWith("Database project creation timed out after 0s"));
    }

    @Test
    void createDatabase_requiresBothApiKeys() {
        // Given
        server.expect(requestTo(API + "/projects"))
            .andRespond(withSuccess("{\"id\":\"abcref\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(API + "/projects/abcref"))
            .andRespond(withSuccess("{\"status\":\"ACTIVE_HEALTHY\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(API + "/projects/abcref/api-keys"))
            .andRespond(withSuccess("[{\"name\":\"anon\",\"api_key\":\"anon-123\"}]", MediaType.APPLICATION_JSON));

        // When
        ProvisioningException exception = assertThrows(ProvisioningException.class,
            () -> provisioner.createDatabase("acme"));

        // Then
        assertEquals("Missing API keys for project abcref", exception.getMessage());
    }

    @Test
    void createDatabase_requiresOrganization() {
        // Given
        properties.getDatabase().setOrganizationId(null);

        // When
        ProvisioningException exception = assertThrows(ProvisioningException.class,
            () -> provisioner.createDatabase("acme"));

        // Then
        assertTrue(exception.getMessage().contains("organization-id"));
        server.verify();
    }

    @Test
    void runMigrations_enablesExtensionsThenAppliesEachFileInOrder() {
        // Given
        when(migrationCatalog.list()).thenReturn(List.of(
            migration("20250101000000", "create table listings (id uuid);"),
            migration("20250301120000", "alter table listings add column price numeric;")));
        server.expect(requestTo(API + "/projects/abcref/database/query"))
            .andExpect(jsonPath("$.query").value(DatabaseProvisioner.EXTENSIONS_SQL))
            .andRespond(withSuccess());
        server.expect(requestTo(API + "/projects/abcref/database/query"))
            .andExpect(jsonPath("$.query").value("create table listings (id uuid);"))
            .andRespond(withSuccess());
        server.expect(requestTo(API + "/projects/abcref/database/query"))
            .andExpect(jsonPath("$.query").value("alter table listings add column price numeric;"))
            .andRespond(withSuccess());

        // When
        provisioner.runMigrations("abcref");

        // Then
        server.verify();
    }

    @Test
    void runMigrations_stopsAtFirstFailingFile() {
        // Given
        when(migrationCatalog.list()).thenReturn(List.of(
            migration("20250101000000", "create table listings (id uuid);"),
            migration("20250301120000", "alter table listings add column price numeric;")));
        server.expect(requestTo(API + "/projects/abcref/database/query")).andRespond(withSuccess());
        server.expect(requestTo(API + "/projects/abcref/database/query"))
            .andRespond(withBadRequest().body("syntax error at or near \"create\""));

        // When
        ProvisioningException exception = assertThrows(ProvisioningException.class,
            () -> provisioner.runMigrations("abcref"));

        // Then
        assertEquals("Migration 20250101000000_migration.sql failed: SQL execution failed (400): "
            + "syntax error at or near \"create\"", exception.getMessage());
        server.verify();
    }

    @Test
    void runMigrations_withoutBundledFilesDoesNothing() {
        // Given
        when(migrationCatalog.list()).thenReturn(List.of());

        // When
        provisioner.runMigrations("abcref");

        // Then
        server.verify();
    }

    @Test
    void seedDatabase_writesSiteConfigThenAdmin() {
        // Given
        SiteSeed seed = SiteSeed.builder()
            .siteName("Acme Realty")
            .themePreset("luxury-blue")
            .adminEmail("owner@acme.test")
            .features(Map.of("chat", true))
            .build();

        // When
        provisioner.seedDatabase("abcref", "https://abcref.supabase.co", "service-456", seed);

        // Then
        InOrder inOrder = inOrder(tenantSiteClient);
        inOrder.verify(tenantSiteClient).upsertSiteConfig("https://abcref.supabase.co", "service-456", seed);
        inOrder.verify(tenantSiteClient).upsertAdmin("https://abcref.supabase.co", "service-456", "owner@acme.test");
    }

    private static Migration migration(String version, String sql) {
        return new Migration(version, version + "_migration.sql",
            new ByteArrayResource(sql.getBytes(StandardCharsets.UTF_8)));
    }
}
