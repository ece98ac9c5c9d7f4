package com.khartoum.launchpad.repository;

import com.khartoum.launchpad.model.TenantJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import java.util.UUID;

@Repository
public interface TenantJobRepository extends JpaRepository<TenantJob, UUID> {
}
