package com.khartoum.launchpad.service.validation;

import com.khartoum.launchpad.dto.ValidationResult;

/**
 * Checks a third-party API key against its provider with a minimal live call.
 */
public interface KeyValidator {

    /** Credential kind this validator checks, e.g. {@code openai}. */
    String kind();

    ValidationResult validate(String apiKey);
}
