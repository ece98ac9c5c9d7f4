package com.khartoum.launchpad.repository;

import com.khartoum.launchpad.model.TenantKey;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TenantKeyRepository extends JpaRepository<TenantKey, UUID> {
    Optional<TenantKey> findByTenantIdAndKeyType(UUID tenantId, String keyType);
    List<TenantKey> findByTenantIdAndKeyTypeIn(UUID tenantId, Collection<String> keyTypes);
    List<TenantKey> findByTenantId(UUID tenantId);
}
