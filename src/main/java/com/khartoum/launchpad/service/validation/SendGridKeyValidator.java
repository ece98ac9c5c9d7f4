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
public class SendGridKeyValidator extends HttpKeyValidator {

    static final String SCOPES_URL = "https://api.sendgrid.com/v3/scopes";

    public SendGridKeyValidator(RestTemplate restTemplate) {
        super(restTemplate);
    }

    @Override
    public String kind() {
        return KeyKind.SENDGRID;
    }

    @Override
    protected String providerName() {
        return "SendGrid";
    }

    @Override
    protected ResponseEntity<JsonNode> probe(String apiKey) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey);
        return restTemplate.exchange(SCOPES_URL, HttpMethod.GET, new HttpEntity<>(headers), JsonNode.class);
    }

    @Override
    protected ValidationResult onError(int status, JsonNode body) {
        return switch (status) {
            case 401 -> ValidationResult.invalid("Invalid API key. Check that it's correct.");
            case 403 -> ValidationResult.invalid(
                "API key does not have sufficient permissions. Ensure Mail Send is enabled.");
            case 429 -> rateLimited();
            default -> ValidationResult.invalid("SendGrid API returned error (" + status + ")");
        };
    }
}
