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
public class OpenAiKeyValidator extends HttpKeyValidator {

    static final String MODELS_URL = "https://api.openai.com/v1/models";

    public OpenAiKeyValidator(RestTemplate restTemplate) {
        super(restTemplate);
    }

    @Override
    public String kind() {
        return KeyKind.OPENAI;
    }

    @Override
    protected String providerName() {
        return "OpenAI";
    }

    @Override
    protected ResponseEntity<JsonNode> probe(String apiKey) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey);
        return restTemplate.exchange(MODELS_URL, HttpMethod.GET, new HttpEntity<>(headers), JsonNode.class);
    }

    @Override
    protected ValidationResult onError(int status, JsonNode body) {
        return switch (status) {
            case 401 -> ValidationResult.invalid("Invalid API key. Check that it's correct and has billing credits.");
            case 429 -> rateLimited();
            default -> ValidationResult.invalid("OpenAI API returned error (" + status + ")");
        };
    }
}
