package com.khartoum.launchpad.service.validation;

import com.khartoum.launchpad.dto.ValidateKeyRequest;
import com.khartoum.launchpad.dto.ValidationResult;
import com.khartoum.launchpad.exception.InvalidRequestException;
import com.khartoum.launchpad.model.KeyKind;
import com.khartoum.launchpad.repository.TenantRepository;
import com.khartoum.launchpad.service.CredentialVault;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Routes a key check to the validator of the chosen provider and, when the
 * key belongs to one of the caller's tenants, records the successful check.
 */
@Slf4j
@Service
public class KeyValidationService {

    public static final String MAPS = "maps";
    public static final String AI = "ai";
    public static final String EMAIL = "email";

    private final Map<String, KeyValidator> validators;
    private final CredentialVault credentialVault;
    private final TenantRepository tenantRepository;

    public KeyValidationService(List<KeyValidator> validators,
                                CredentialVault credentialVault,
                                TenantRepository tenantRepository) {
        this.validators = validators.stream()
            .collect(Collectors.toMap(KeyValidator::kind, Function.identity()));
        this.credentialVault = credentialVault;
        this.tenantRepository = tenantRepository;
    }

    public ValidationResult validate(String category, ValidateKeyRequest request, String callerEmail) {
        if (request.getApiKey() == null || request.getApiKey().isBlank()) {
            throw new InvalidRequestException("API key is required");
        }

        String kind = resolveKind(category, request.getProvider());
        KeyValidator validator = validators.get(kind);
        if (validator == null) {
            throw new InvalidRequestException("No validator available for " + kind);
        }

        ValidationResult result = validator.validate(request.getApiKey());

        if (result.isValid() && request.getTenantId() != null) {
            boolean owned = tenantRepository.findById(request.getTenantId())
                .map(tenant -> tenant.getAdminEmail().equals(callerEmail))
                .orElse(false);
            if (owned) {
                credentialVault.markValidated(request.getTenantId(), kind);
            } else {
                log.debug("Not recording {} check for tenant {} outside the caller's account", kind, request.getTenantId());
            }
        }
        return result;
    }

    static String resolveKind(String category, String provider) {
        switch (category) {
            case MAPS:
                return KeyKind.GOOGLE_MAPS;
            case AI:
                return pick(provider, KeyKind.GEMINI, KeyKind.AI_PROVIDERS, "Unknown AI provider: ");
            case EMAIL:
                return pick(provider, KeyKind.RESEND, KeyKind.EMAIL_PROVIDERS, "Unknown email provider: ");
            default:
                throw new InvalidRequestException("Unknown key type: " + category);
        }
    }

    private static String pick(String provider, String fallback, Set<String> known, String unknownMessage) {
        String kind = provider == null || provider.isBlank() ? fallback : provider;
        if (!known.contains(kind)) {
            throw new InvalidRequestException(unknownMessage + kind);
        }
        return kind;
    }
}
