package com.khartoum.launchpad.service.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.khartoum.launchpad.dto.ValidationResult;
import com.khartoum.launchpad.model.KeyKind;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Map;

/**
 * Geocodes a fixed address. The Geocoding API answers 200 for most key
 * problems, so the verdict comes from the {@code status} field of the body.
 */
@Component
public class GoogleMapsKeyValidator extends HttpKeyValidator {

    static final String GEOCODE_URL = "https://maps.googleapis.com/maps/api/geocode/json";
    static final String TEST_ADDRESS = "Toronto, ON, Canada";

    private static final Map<String, String> STATUS_MESSAGES = Map.of(
        "REQUEST_DENIED",
        "Invalid API key, or Geocoding API is not enabled. Enable it at console.cloud.google.com.",
        "OVER_DAILY_LIMIT",
        "Quota exceeded. Check your billing account at console.cloud.google.com.",
        "OVER_QUERY_LIMIT",
        "Rate limit reached. Try again in a moment.",
        "INVALID_REQUEST",
        "Unexpected error: the test request was malformed."
    );

    public GoogleMapsKeyValidator(RestTemplate restTemplate) {
        super(restTemplate);
    }

    @Override
    public String kind() {
        return KeyKind.GOOGLE_MAPS;
    }

    @Override
    protected String providerName() {
        return "Google Maps";
    }

    @Override
    protected ResponseEntity<JsonNode> probe(String apiKey) {
        URI uri = UriComponentsBuilder.fromHttpUrl(GEOCODE_URL)
            .queryParam("address", TEST_ADDRESS)
            .queryParam("key", apiKey)
            .encode()
            .build()
            .toUri();
        return restTemplate.getForEntity(uri, JsonNode.class);
    }

    @Override
    protected ValidationResult onSuccess(JsonNode body) {
        return fromStatus(body);
    }

    @Override
    protected ValidationResult onError(int status, JsonNode body) {
        if (body.hasNonNull("status")) {
            return fromStatus(body);
        }
        return ValidationResult.invalid("Google Maps API returned error (" + status + ")");
    }

    private static ValidationResult fromStatus(JsonNode body) {
        String status = body == null ? "" : body.path("status").asText("");
        if ("OK".equals(status)) {
            return ValidationResult.valid("Google Maps key is active and working");
        }
        String details = body == null || !body.hasNonNull("error_message") ? null : body.get("error_message").asText();
        String message = STATUS_MESSAGES.getOrDefault(status, "API returned status: " + status);
        return ValidationResult.invalid(message, details);
    }
}
