package com.khartoum.launchpad.service;

import com.khartoum.launchpad.dto.FlagMergeResult;
import com.khartoum.launchpad.dto.FlagPropagationResult;
import com.khartoum.launchpad.model.KeyKind;
import com.khartoum.launchpad.model.Tenant;
import com.khartoum.launchpad.model.TenantStatus;
import com.khartoum.launchpad.repository.TenantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Rolls new feature flag defaults out to existing tenants. Additive only: a
 * flag a tenant already has, whatever its value, is never overwritten.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeatureFlagService {

    private final TenantRepository tenantRepository;
    private final CredentialVault credentialVault;
    private final TenantSiteClient tenantSiteClient;

    public FlagPropagationResult propagateToAll(Map<String, Boolean> defaults) {
        List<Tenant> tenants = tenantRepository.findByStatusOrderByCreatedAtAsc(TenantStatus.ACTIVE);

        int tenantsUpdated = 0;
        int totalFlagsAdded = 0;
        List<FlagPropagationResult.TenantError> errors = new ArrayList<>();

        for (Tenant tenant : tenants) {
            FlagMergeResult result = propagate(tenant.getId(), defaults);
            if (result.getError() != null) {
                errors.add(new FlagPropagationResult.TenantError(
                    tenant.getId().toString(), tenant.getSlug(), result.getError()));
            }
            if (!result.getAdded().isEmpty()) {
                tenantsUpdated++;
                totalFlagsAdded += result.getAdded().size();
            }
        }

        log.info("Propagated {} flag(s): {} of {} tenant(s) updated, {} error(s)",
            defaults.size(), tenantsUpdated, tenants.size(), errors.size());

        return new FlagPropagationResult(
            "Propagated " + defaults.size() + " flag(s) to " + tenantsUpdated + " tenant(s)",
            tenants.size(), tenantsUpdated, totalFlagsAdded, errors);
    }

    /**
     * Merges the defaults into one tenant, first in the platform record, then in
     * the tenant's own site configuration. A site update failure is reported
     * but the platform record keeps the merged flags.
     */
    public FlagMergeResult propagate(UUID tenantId, Map<String, Boolean> defaults) {
        Tenant tenant = tenantRepository.findById(tenantId).orElse(null);
        if (tenant == null) {
            return new FlagMergeResult(List.of(), List.of(), "Tenant not found: " + tenantId);
        }

        Map<String, Boolean> existing = tenant.getFeatureFlags() != null ? tenant.getFeatureFlags() : Map.of();
        Map<String, Boolean> merged = new LinkedHashMap<>(existing);
        List<String> added = new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        defaults.forEach((flag, value) -> {
            if (existing.containsKey(flag)) {
                skipped.add(flag);
            } else {
                merged.put(flag, value);
                added.add(flag);
            }
        });

        if (added.isEmpty()) {
            return new FlagMergeResult(added, skipped, null);
        }

        try {
            tenant.setFeatureFlags(merged);
            tenantRepository.save(tenant);
        } catch (RuntimeException e) {
            log.error("Failed to update flags of tenant {}", tenant.getSlug(), e);
            return new FlagMergeResult(List.of(), skipped, "Failed to update platform DB: " + e.getMessage());
        }

        if (tenant.getDatabaseRef() != null) {
            try {
                String apiUrl = credentialVault.readKey(tenantId, KeyKind.DATABASE_URL).orElse(null);
                String serviceRoleKey = credentialVault.readKey(tenantId, KeyKind.DATABASE_SERVICE_ROLE).orElse(null);
                if (apiUrl == null || serviceRoleKey == null) {
                    throw new IllegalStateException("Missing database URL or service role key");
                }
                tenantSiteClient.updateFeatures(apiUrl, serviceRoleKey, merged);
            } catch (RuntimeException e) {
                log.warn("Flags of tenant {} updated on the platform only: {}", tenant.getSlug(), e.getMessage());
                return new FlagMergeResult(added, skipped,
                    "Platform DB updated but tenant site_config failed: " + e.getMessage());
            }
        }

        log.debug("Tenant {} gained flags {}", tenant.getSlug(), added);
        return new FlagMergeResult(added, skipped, null);
    }
}
