package com.khartoum.launchpad.service;

import com.khartoum.launchpad.dto.CredentialEntry;
import com.khartoum.launchpad.exception.CredentialStorageException;
import com.khartoum.launchpad.model.KeyKind;
import com.khartoum.launchpad.repository.TenantKeyRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CredentialVaultFailureTest {

    @Mock
    private TenantKeyRepository tenantKeyRepository;

    @Mock
    private EncryptionService encryptionService;

    @InjectMocks
    private CredentialVault credentialVault;

    @Test
    void storeKeys_encryptionFailureWritesNothing() {
        // Given
        UUID tenantId = UUID.randomUUID();
        when(tenantKeyRepository.findByTenantIdAndKeyTypeIn(eq(tenantId), anyCollection())).thenReturn(List.of());
        when(encryptionService.encrypt("database-url")).thenReturn("iv:cipher:tag");
        when(encryptionService.encrypt("anon-key"))
            .thenThrow(new IllegalStateException("launchpad.encryption.key is not configured"));

        // When
        CredentialStorageException exception = assertThrows(CredentialStorageException.class,
            () -> credentialVault.storeKeys(tenantId, List.of(
                CredentialEntry.confirmed(KeyKind.DATABASE_URL, "database-url"),
                CredentialEntry.confirmed(KeyKind.DATABASE_ANON_KEY, "anon-key"))));

        // Then
        assertEquals("launchpad.encryption.key is not configured", exception.getMessage());
        verify(tenantKeyRepository, never()).saveAllAndFlush(any());
    }

    @Test
    void storeKeys_emptyBatchIsNoOp() {
        // When
        credentialVault.storeKeys(UUID.randomUUID(), List.of());

        // Then
        verifyNoInteractions(tenantKeyRepository, encryptionService);
    }
}
