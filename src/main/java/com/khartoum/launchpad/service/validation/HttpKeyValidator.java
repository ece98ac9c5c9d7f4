package com.khartoum.launchpad.service.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.khartoum.launchpad.dto.ValidationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Base for validators that probe a provider over HTTP. Subclasses issue the
 * probe and translate error statuses into user facing messages.
 */
@Slf4j
public abstract class HttpKeyValidator implements KeyValidator {

    static final int MIN_KEY_LENGTH = 10;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    protected final RestTemplate restTemplate;

    protected HttpKeyValidator(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    /** Name shown in messages, e.g. "OpenAI". */
    protected abstract String providerName();

    protected abstract ResponseEntity<JsonNode> probe(String apiKey);

    protected abstract ValidationResult onError(int status, JsonNode body);

    protected ValidationResult onSuccess(JsonNode body) {
        return ValidationResult.valid(providerName() + " API key is active and working");
    }

    @Override
    public final ValidationResult validate(String apiKey) {
        if (apiKey == null || apiKey.trim().length() < MIN_KEY_LENGTH) {
            return ValidationResult.invalid("API key is too short");
        }

        try {
            ResponseEntity<JsonNode> response = probe(apiKey.trim());
            return onSuccess(response.getBody());
        } catch (HttpStatusCodeException e) {
            log.debug("{} key check returned {}", providerName(), e.getStatusCode().value());
            return onError(e.getStatusCode().value(), parse(e.getResponseBodyAsString()));
        } catch (RestClientException e) {
            log.warn("Could not reach {} to validate a key: {}", providerName(), e.getMessage());
            return ValidationResult.invalid(
                "Failed to reach " + providerName() + " API. Check your network connection.", e.getMessage());
        }
    }

    protected static ValidationResult rateLimited() {
        return ValidationResult.invalid("Rate limit reached. Try again in a moment.");
    }

    private static JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return MAPPER.createObjectNode();
        }
        try {
            return MAPPER.readTree(body);
        } catch (Exception e) {
            log.debug("Error body is not JSON: {}", e.getMessage());
            return MAPPER.createObjectNode();
        }
    }
}
