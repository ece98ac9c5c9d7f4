package com.khartoum.launchpad.service.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.khartoum.launchpad.dto.ValidationResult;
import com.khartoum.launchpad.model.KeyKind;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * Asks Gemini for a five token reply, the cheapest call that proves the key
 * can actually generate content.
 */
@Component
public class GeminiKeyValidator extends HttpKeyValidator {

    static final String GENERATE_URL =
        "https://generativelanguage.googleapis.com/v1beta/models/gemini-2.0-flash:generateContent";

    public GeminiKeyValidator(RestTemplate restTemplate) {
        super(restTemplate);
    }

    @Override
    public String kind() {
        return KeyKind.GEMINI;
    }

    @Override
    protected String providerName() {
        return "Gemini";
    }

    @Override
    protected ResponseEntity<JsonNode> probe(String apiKey) {
        URI uri = UriComponentsBuilder.fromHttpUrl(GENERATE_URL)
            .queryParam("key", apiKey)
            .encode()
            .build()
            .toUri();

        Map<String, Object> body = Map.of(
            "contents", List.of(Map.of("parts", List.of(Map.of("text", "Reply with exactly: OK")))),
            "generationConfig", Map.of("maxOutputTokens", 5)
        );

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return restTemplate.exchange(uri, HttpMethod.POST, new HttpEntity<>(body, headers), JsonNode.class);
    }

    @Override
    protected ValidationResult onError(int status, JsonNode body) {
        JsonNode error = body.path("error");
        String errorStatus = error.path("status").asText("");
        String errorMessage = error.path("message").asText("");

        if (status == 400 && errorMessage.contains("API_KEY_INVALID")) {
            return ValidationResult.invalid("Invalid API key. Check that it's correct.");
        }
        if (status == 403) {
            return ValidationResult.invalid(
                "API key is restricted or Generative Language API is not enabled. Enable it at console.cloud.google.com.");
        }
        if (status == 429 || "RESOURCE_EXHAUSTED".equals(errorStatus)) {
            return ValidationResult.invalid("Quota exceeded. Check your billing at console.cloud.google.com.");
        }
        return ValidationResult.invalid("API returned error (" + status + "): "
            + (errorMessage.isEmpty() ? "Unknown error" : errorMessage));
    }
}
