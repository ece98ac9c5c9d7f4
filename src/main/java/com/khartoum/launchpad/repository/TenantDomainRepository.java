package com.khartoum.launchpad.repository;

import com.khartoum.launchpad.model.TenantDomain;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import java.util.UUID;

@Repository
public interface TenantDomainRepository extends JpaRepository<TenantDomain, UUID> {
    boolean existsByHostname(String hostname);
}
