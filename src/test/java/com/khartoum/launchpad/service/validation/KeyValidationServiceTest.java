package com.khartoum.launchpad.service.validation;

import com.khartoum.launchpad.dto.ValidateKeyRequest;
import com.khartoum.launchpad.dto.ValidationResult;
import com.khartoum.launchpad.exception.InvalidRequestException;
import com.khartoum.launchpad.model.KeyKind;
import com.khartoum.launchpad.model.Tenant;
import com.khartoum.launchpad.repository.TenantRepository;
import com.khartoum.launchpad.service.CredentialVault;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class KeyValidationServiceTest {

    @Mock
    private KeyValidator geminiValidator;

    @Mock
    private KeyValidator mapsValidator;

    @Mock
    private CredentialVault credentialVault;

    @Mock
    private TenantRepository tenantRepository;

    private KeyValidationService service;

    private final UUID tenantId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        when(geminiValidator.kind()).thenReturn(KeyKind.GEMINI);
        when(mapsValidator.kind()).thenReturn(KeyKind.GOOGLE_MAPS);
        service = new KeyValidationService(List.of(geminiValidator, mapsValidator), credentialVault, tenantRepository);
    }

    @Test
    void validate_aiWithoutProviderUsesGemini() {
        // Given
        when(geminiValidator.validate("AIzaSy-gemini-123456"))
            .thenReturn(ValidationResult.valid("Gemini API key is active and working"));

        // When
        ValidationResult result = service.validate(KeyValidationService.AI, request("AIzaSy-gemini-123456", null, null),
            "owner@acme.test");

        // Then
        assertTrue(result.isValid());
        verifyNoInteractions(mapsValidator, credentialVault, tenantRepository);
    }

    @Test
    void validate_successOnOwnedTenantIsRecorded() {
        // Given
        when(mapsValidator.validate("AIzaSy-maps-123456")).thenReturn(ValidationResult.valid("ok"));
        when(tenantRepository.findById(tenantId)).thenReturn(Optional.of(tenant("owner@acme.test")));

        // When
        service.validate(KeyValidationService.MAPS, request("AIzaSy-maps-123456", null, tenantId), "owner@acme.test");

        // Then
        verify(credentialVault).markValidated(tenantId, KeyKind.GOOGLE_MAPS);
    }

    @Test
    void validate_successOnForeignTenantIsNotRecorded() {
        // Given
        when(mapsValidator.validate("AIzaSy-maps-123456")).thenReturn(ValidationResult.valid("ok"));
        when(tenantRepository.findById(tenantId)).thenReturn(Optional.of(tenant("owner@acme.test")));

        // When
        ValidationResult result = service.validate(KeyValidationService.MAPS,
            request("AIzaSy-maps-123456", null, tenantId), "intruder@elsewhere.test");

        // Then
        assertTrue(result.isValid());
        verifyNoInteractions(credentialVault);
    }

    @Test
    void validate_failureIsNeverRecorded() {
        // Given
        when(mapsValidator.validate("AIzaSy-maps-123456")).thenReturn(ValidationResult.invalid("denied"));

        // When
        service.validate(KeyValidationService.MAPS, request("AIzaSy-maps-123456", null, tenantId), "owner@acme.test");

        // Then
        verifyNoInteractions(credentialVault, tenantRepository);
    }

    @Test
    void validate_blankKeyIsRejected() {
        InvalidRequestException exception = assertThrows(InvalidRequestException.class,
            () -> service.validate(KeyValidationService.MAPS, request("  ", null, null), "owner@acme.test"));
        assertEquals("API key is required", exception.getMessage());
    }

    @Test
    void validate_providerWithoutValidatorBeanIsRejected() {
        InvalidRequestException exception = assertThrows(InvalidRequestException.class,
            () -> service.validate(KeyValidationService.EMAIL, request("re_resend_123456", "resend", null), null));
        assertEquals("No validator available for resend", exception.getMessage());
    }

    @Test
    void resolveKind_mapsCategoriesAndProviders() {
        assertEquals(KeyKind.GOOGLE_MAPS, KeyValidationService.resolveKind("maps", "ignored"));
        assertEquals(KeyKind.ANTHROPIC, KeyValidationService.resolveKind("ai", "anthropic"));
        assertEquals(KeyKind.RESEND, KeyValidationService.resolveKind("email", null));
        assertEquals(KeyKind.SENDGRID, KeyValidationService.resolveKind("email", "sendgrid"));

        assertEquals("Unknown AI provider: mistral",
            assertThrows(InvalidRequestException.class, () -> KeyValidationService.resolveKind("ai", "mistral"))
                .getMessage());
        assertEquals("Unknown key type: sms",
            assertThrows(InvalidRequestException.class, () -> KeyValidationService.resolveKind("sms", null))
                .getMessage());
    }

    private static ValidateKeyRequest request(String apiKey, String provider, UUID tenantId) {
        ValidateKeyRequest request = new ValidateKeyRequest();
        request.setApiKey(apiKey);
        request.setProvider(provider);
        request.setTenantId(tenantId);
        return request;
    }

    private Tenant tenant(String adminEmail) {
        Tenant tenant = new Tenant();
        tenant.setId(tenantId);
        tenant.setAdminEmail(adminEmail);
        return tenant;
    }
}
