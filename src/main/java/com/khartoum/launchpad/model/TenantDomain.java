package com.khartoum.launchpad.model;

import jakarta.persistence.*;
import lombok.Data;
import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Entity
@Table(name = "tenant_domains")
public class TenantDomain {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @Column(unique = true, nullable = false)
    private String hostname;

    @Column(name = "is_primary", nullable = false)
    private boolean primary;

    @Enumerated(EnumType.STRING)
    @Column(name = "ssl_status", nullable = false)
    private SslStatus sslStatus = SslStatus.PENDING;

    @Column(name = "verified_at")
    private LocalDateTime verifiedAt;

    @Column(name = "created_at")
    private LocalDateTime createdAt = LocalDateTime.now();

    public static TenantDomain of(UUID tenantId, String hostname, boolean primary, SslStatus sslStatus) {
        TenantDomain domain = new TenantDomain();
        domain.setTenantId(tenantId);
        domain.setHostname(hostname);
        domain.setPrimary(primary);
        domain.setSslStatus(sslStatus);
        if (sslStatus == SslStatus.ACTIVE) {
            domain.setVerifiedAt(LocalDateTime.now());
        }
        return domain;
    }
}
