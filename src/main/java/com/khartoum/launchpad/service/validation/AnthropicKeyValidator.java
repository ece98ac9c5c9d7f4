package com.khartoum.launchpad.service.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.khartoum.launchpad.dto.ValidationResult;
import com.khartoum.launchpad.model.KeyKind;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

@Component
public class AnthropicKeyValidator extends HttpKeyValidator {

    static final String MODELS_URL = "https://api.anthropic.com/v1/models";
    static final String API_VERSION = "2023-06-01";

    public AnthropicKeyValidator(RestTemplate restTemplate) {
        super(restTemplate);
    }

    @Override
    public String kind() {
        return KeyKind.ANTHROPIC;
    }

    @Override
    protected String providerName() {
        return "Anthropic";
    }

    @Override
    protected ResponseEntity<JsonNode> probe(String apiKey) {
        HttpHeaders headers = new HttpHeaders();
        headers.set("x-api-key", apiKey);
        headers.set("anthropic-version", API_VERSION);
        return restTemplate.exchange(MODELS_URL, HttpMethod.GET, new HttpEntity<>(headers), JsonNode.class);
    }

    @Override
    protected ValidationResult onError(int status, JsonNode body) {
        return switch (status) {
            case 401 -> ValidationResult.invalid("Invalid API key. Check that it's correct and has billing credits.");
            case 403 -> ValidationResult.invalid("API key does not have sufficient permissions.");
            case 429 -> rateLimited();
            default -> ValidationResult.invalid("Anthropic API returned error (" + status + ")");
        };
    }
}
