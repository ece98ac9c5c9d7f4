package com.khartoum.launchpad.model;

import jakarta.persistence.*;
import lombok.Data;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

@Data
@Entity
@Table(name = "tenants")
public class Tenant {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "team_id", nullable = false)
    private Long teamId;

    @Column(unique = true, nullable = false, length = 63)
    private String slug;

    @Column(name = "display_name", nullable = false, length = 100)
    private String displayName;

    @Column(nullable = false)
    private String template = "preconstruction-v1";

    @Column(name = "theme_preset")
    private String themePreset = "luxury-blue";

    @Convert(converter = FeatureFlagsConverter.class)
    @Column(name = "feature_flags", columnDefinition = "TEXT")
    private Map<String, Boolean> featureFlags = new HashMap<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TenantStatus status = TenantStatus.PROVISIONING;

    @Column(name = "admin_email", nullable = false)
    private String adminEmail;

    @Column(name = "database_ref")
    private String databaseRef;

    @Column(name = "schema_version")
    private String schemaVersion;

    @Column(name = "created_at")
    private LocalDateTime createdAt = LocalDateTime.now();

    @Column(name = "updated_at")
    private LocalDateTime updatedAt = LocalDateTime.now();

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }
}
