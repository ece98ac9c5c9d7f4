package com.khartoum.launchpad.repository;

import com.khartoum.launchpad.model.Tenant;
import com.khartoum.launchpad.model.TenantStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class TenantRepositoryTest {

    @Autowired
    private TenantRepository tenantRepository;

    @Autowired
    private TestEntityManager entityManager;

    private UUID tenantId;

    @BeforeEach
    void setUp() {
        Tenant tenant = new Tenant();
        tenant.setTeamId(7L);
        tenant.setSlug("acme");
        tenant.setDisplayName("Acme Realty");
        tenant.setAdminEmail("owner@acme.test");
        tenantId = entityManager.persistAndFlush(tenant).getId();
        entityManager.clear();
    }

    @Test
    void pipelineWrites_applyWhileProvisioning() {
        // When
        int refRows = tenantRepository.recordDatabaseRef(tenantId, "ref-acme");
        int versionRows = tenantRepository.recordSchemaVersion(tenantId, "20250222100000");
        int activatedRows = tenantRepository.activate(tenantId);

        // Then
        assertEquals(1, refRows);
        assertEquals(1, versionRows);
        assertEquals(1, activatedRows);
        Tenant stored = entityManager.find(Tenant.class, tenantId);
        assertEquals("ref-acme", stored.getDatabaseRef());
        assertEquals("20250222100000", stored.getSchemaVersion());
        assertEquals(TenantStatus.ACTIVE, stored.getStatus());
    }

    @Test
    void pipelineWrites_doNotReviveSuspendedTenant() {
        // Given
        assertEquals(1, tenantRepository.suspend(tenantId));

        // When
        int refRows = tenantRepository.recordDatabaseRef(tenantId, "ref-late");
        int versionRows = tenantRepository.recordSchemaVersion(tenantId, "20250222100000");
        int activatedRows = tenantRepository.activate(tenantId);

        // Then
        assertEquals(0, refRows);
        assertEquals(0, versionRows);
        assertEquals(0, activatedRows);
        Tenant stored = entityManager.find(Tenant.class, tenantId);
        assertEquals(TenantStatus.SUSPENDED, stored.getStatus());
        assertNull(stored.getDatabaseRef());
        assertNull(stored.getSchemaVersion());
    }

    @Test
    void suspend_leavesArchivedTenantAlone() {
        // Given
        Tenant tenant = entityManager.find(Tenant.class, tenantId);
        tenant.setStatus(TenantStatus.ARCHIVED);
        entityManager.persistAndFlush(tenant);
        entityManager.clear();

        // When
        int rows = tenantRepository.suspend(tenantId);

        // Then
        assertEquals(0, rows);
        assertEquals(TenantStatus.ARCHIVED, entityManager.find(Tenant.class, tenantId).getStatus());
    }
}
