package com.khartoum.launchpad.service;

import com.khartoum.launchpad.config.LaunchpadProperties;
import com.khartoum.launchpad.dto.CredentialEntry;
import com.khartoum.launchpad.model.KeyKind;
import com.khartoum.launchpad.model.TenantKey;
import com.khartoum.launchpad.repository.TenantKeyRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Import({CredentialVault.class, EncryptionService.class})
@EnableConfigurationProperties(LaunchpadProperties.class)
class CredentialVaultTest {

    @Autowired
    private CredentialVault credentialVault;

    @Autowired
    private TenantKeyRepository tenantKeyRepository;

    @Autowired
    private TestEntityManager entityManager;

    private final UUID tenantId = UUID.randomUUID();

    @Test
    void storeKeys_encryptsValuesAtRest() {
        // When
        credentialVault.storeKeys(tenantId, List.of(
            CredentialEntry.confirmed(KeyKind.DATABASE_SERVICE_ROLE, "service-role-secret")));
        entityManager.clear();

        // Then
        TenantKey row = tenantKeyRepository.findByTenantIdAndKeyType(tenantId, KeyKind.DATABASE_SERVICE_ROLE)
            .orElseThrow();
        assertNotEquals("service-role-secret", row.getEncryptedValue());
        assertEquals(3, row.getEncryptedValue().split(":").length);
        assertEquals(Optional.of("service-role-secret"),
            credentialVault.readKey(tenantId, KeyKind.DATABASE_SERVICE_ROLE));
    }

    @Test
    void storeKeys_setsValidatedAtOnlyForConfirmedEntries() {
        // When
        credentialVault.storeKeys(tenantId, List.of(
            CredentialEntry.confirmed(KeyKind.DATABASE_URL, "https://ref.supabase.co"),
            CredentialEntry.unconfirmed(KeyKind.OPENAI, "sk-openai-123456")));
        entityManager.clear();

        // Then
        assertNotNull(tenantKeyRepository.findByTenantIdAndKeyType(tenantId, KeyKind.DATABASE_URL)
            .orElseThrow().getValidatedAt());
        assertNull(tenantKeyRepository.findByTenantIdAndKeyType(tenantId, KeyKind.OPENAI)
            .orElseThrow().getValidatedAt());
    }

    @Test
    void storeKeys_secondStoreReplacesTheExistingRow() {
        // Given
        credentialVault.storeKeys(tenantId, List.of(CredentialEntry.unconfirmed(KeyKind.RESEND, "re_first_key")));
        entityManager.clear();

        // When
        credentialVault.storeKeys(tenantId, List.of(CredentialEntry.unconfirmed(KeyKind.RESEND, "re_second_key")));
        entityManager.clear();

        // Then
        assertEquals(1, tenantKeyRepository.findByTenantId(tenantId).size());
        assertEquals(Optional.of("re_second_key"), credentialVault.readKey(tenantId, KeyKind.RESEND));
    }

    @Test
    void storeKeys_laterEntryOfSameKindWins() {
        // When
        credentialVault.storeKeys(tenantId, List.of(
            CredentialEntry.unconfirmed(KeyKind.GEMINI, "first-gemini-key"),
            CredentialEntry.unconfirmed(KeyKind.GEMINI, "second-gemini-key")));
        entityManager.clear();

        // Then
        assertEquals(1, tenantKeyRepository.findByTenantId(tenantId).size());
        assertEquals(Optional.of("second-gemini-key"), credentialVault.readKey(tenantId, KeyKind.GEMINI));
    }

    @Test
    void markValidated_stampsStoredKey() {
        // Given
        credentialVault.storeKeys(tenantId, List.of(CredentialEntry.unconfirmed(KeyKind.GOOGLE_MAPS, "maps-key-123")));
        entityManager.clear();

        // When
        boolean marked = credentialVault.markValidated(tenantId, KeyKind.GOOGLE_MAPS);
        entityManager.flush();
        entityManager.clear();

        // Then
        assertTrue(marked);
        assertNotNull(tenantKeyRepository.findByTenantIdAndKeyType(tenantId, KeyKind.GOOGLE_MAPS)
            .orElseThrow().getValidatedAt());
    }

    @Test
    void markValidated_returnsFalseWhenKeyIsMissing() {
        assertFalse(credentialVault.markValidated(tenantId, KeyKind.SENDGRID));
    }

    @Test
    void readKey_returnsEmptyWhenKeyIsMissing() {
        assertEquals(Optional.empty(), credentialVault.readKey(tenantId, KeyKind.ANTHROPIC));
    }
}
