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
public class ResendKeyValidator extends HttpKeyValidator {

    static final String API_KEYS_URL = "https://api.resend.com/api-keys";

    public ResendKeyValidator(RestTemplate restTemplate) {
        super(restTemplate);
    }

    @Override
    public String kind() {
        return KeyKind.RESEND;
    }

    @Override
    protected String providerName() {
        return "Resend";
    }

    @Override
    protected ResponseEntity<JsonNode> probe(String apiKey) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey);
        return restTemplate.exchange(API_KEYS_URL, HttpMethod.GET, new HttpEntity<>(headers), JsonNode.class);
    }

    @Override
    protected ValidationResult onError(int status, JsonNode body) {
        return switch (status) {
            case 401 -> ValidationResult.invalid("Invalid API key. Check that it's correct.");
            case 403 -> ValidationResult.invalid("API key does not have sufficient permissions.");
            case 429 -> rateLimited();
            default -> ValidationResult.invalid("Resend API returned error (" + status + ")");
        };
    }
}
