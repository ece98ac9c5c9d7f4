package com.khartoum.launchpad.repository;

import com.khartoum.launchpad.model.Tenant;
import com.khartoum.launchpad.model.TenantStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import java.util.List;
import java.util.UUID;

@Repository
public interface TenantRepository extends JpaRepository<Tenant, UUID> {
    boolean existsBySlug(String slug);
    boolean existsBySlugAndStatusNot(String slug, TenantStatus status);
    List<Tenant> findByStatusOrderByCreatedAtAsc(TenantStatus status);

    // Pipeline writes only land while the tenant is still provisioning; each returns the rows changed.

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Tenant t set t.databaseRef = :databaseRef, t.updatedAt = local datetime "
        + "where t.id = :id and t.status = com.khartoum.launchpad.model.TenantStatus.PROVISIONING")
    int recordDatabaseRef(@Param("id") UUID id, @Param("databaseRef") String databaseRef);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Tenant t set t.schemaVersion = :schemaVersion, t.updatedAt = local datetime "
        + "where t.id = :id and t.status = com.khartoum.launchpad.model.TenantStatus.PROVISIONING")
    int recordSchemaVersion(@Param("id") UUID id, @Param("schemaVersion") String schemaVersion);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Tenant t set t.status = com.khartoum.launchpad.model.TenantStatus.ACTIVE, "
        + "t.updatedAt = local datetime "
        + "where t.id = :id and t.status = com.khartoum.launchpad.model.TenantStatus.PROVISIONING")
    int activate(@Param("id") UUID id);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Tenant t set t.status = com.khartoum.launchpad.model.TenantStatus.SUSPENDED, "
        + "t.updatedAt = local datetime "
        + "where t.id = :id and t.status <> com.khartoum.launchpad.model.TenantStatus.ARCHIVED")
    int suspend(@Param("id") UUID id);
}
