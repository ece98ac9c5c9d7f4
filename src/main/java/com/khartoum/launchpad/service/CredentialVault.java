package com.khartoum.launchpad.service;

import com.khartoum.launchpad.dto.CredentialEntry;
import com.khartoum.launchpad.exception.CredentialStorageException;
import com.khartoum.launchpad.model.TenantKey;
import com.khartoum.launchpad.repository.TenantKeyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Encrypted per-tenant credential storage, unique on (tenant, kind).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialVault {

    private final TenantKeyRepository tenantKeyRepository;
    private final EncryptionService encryptionService;

    /**
     * Encrypts and upserts the whole batch in one transaction. Existing rows of
     * the same kind are replaced. Any failure rolls back every entry.
     */
    @Transactional(rollbackFor = Exception.class)
    public void storeKeys(UUID tenantId, List<CredentialEntry> entries) {
        if (entries.isEmpty()) {
            return;
        }

        // Later entries of the same kind win, as with a single upsert statement
        Map<String, CredentialEntry> byKind = new LinkedHashMap<>();
        entries.forEach(entry -> byKind.put(entry.getKind(), entry));

        try {
            Map<String, TenantKey> existing = tenantKeyRepository
                .findByTenantIdAndKeyTypeIn(tenantId, byKind.keySet()).stream()
                .collect(Collectors.toMap(TenantKey::getKeyType, Function.identity()));

            LocalDateTime now = LocalDateTime.now();
            List<TenantKey> rows = new ArrayList<>();
            for (CredentialEntry entry : byKind.values()) {
                TenantKey row = existing.getOrDefault(entry.getKind(), new TenantKey());
                row.setTenantId(tenantId);
                row.setKeyType(entry.getKind());
                row.setEncryptedValue(encryptionService.encrypt(entry.getValue()));
                row.setValidatedAt(entry.isValidated() ? now : null);
                rows.add(row);
            }

            tenantKeyRepository.saveAllAndFlush(rows);
            log.info("Stored {} credential(s) for tenant {}", rows.size(), tenantId);
        } catch (RuntimeException e) {
            log.error("Failed to store credentials for tenant {}", tenantId, e);
            throw new CredentialStorageException(rootMessage(e), e);
        }
    }

    /** Records a successful explicit validation. Returns false when no such key is stored. */
    @Transactional
    public boolean markValidated(UUID tenantId, String kind) {
        return tenantKeyRepository.findByTenantIdAndKeyType(tenantId, kind)
            .map(key -> {
                key.setValidatedAt(LocalDateTime.now());
                tenantKeyRepository.save(key);
                log.info("Marked {} key validated for tenant {}", kind, tenantId);
                return true;
            })
            .orElse(false);
    }

    @Transactional(readOnly = true)
    public Optional<String> readKey(UUID tenantId, String kind) {
        return tenantKeyRepository.findByTenantIdAndKeyType(tenantId, kind)
            .map(key -> encryptionService.decrypt(key.getEncryptedValue()));
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : e.getClass().getSimpleName();
    }
}
