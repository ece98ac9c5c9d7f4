package com.khartoum.launchpad.service.validation;

import com.khartoum.launchpad.dto.ValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class GeminiKeyValidatorTest {

    private MockRestServiceServer server;
    private GeminiKeyValidator validator;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        validator = new GeminiKeyValidator(restTemplate);
    }

    @Test
    void validate_generatesTinyReply() {
        // Given
        server.expect(requestTo(startsWith(GeminiKeyValidator.GENERATE_URL)))
            .andExpect(method(HttpMethod.POST))
            .andExpect(queryParam("key", "AIzaSy-gemini-123456"))
            .andExpect(jsonPath("$.generationConfig.maxOutputTokens").value(5))
            .andRespond(withSuccess("{\"candidates\":[]}", MediaType.APPLICATION_JSON));

        // When
        ValidationResult result = validator.validate("AIzaSy-gemini-123456");

        // Then
        assertTrue(result.isValid());
        assertEquals("Gemini API key is active and working", result.getMessage());
    }

    @Test
    void validate_invalidKey() {
        // Given
        server.expect(requestTo(startsWith(GeminiKeyValidator.GENERATE_URL)))
            .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                .body("{\"error\":{\"status\":\"INVALID_ARGUMENT\",\"message\":\"API key not valid. [API_KEY_INVALID]\"}}")
                .contentType(MediaType.APPLICATION_JSON));

        // When
        ValidationResult result = validator.validate("AIzaSy-gemini-123456");

        // Then
        assertEquals("Invalid API key. Check that it's correct.", result.getMessage());
    }

    @Test
    void validate_exhaustedQuota() {
        // Given
        server.expect(requestTo(startsWith(GeminiKeyValidator.GENERATE_URL)))
            .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS)
                .body("{\"error\":{\"status\":\"RESOURCE_EXHAUSTED\",\"message\":\"Quota exceeded\"}}")
                .contentType(MediaType.APPLICATION_JSON));

        // When
        ValidationResult result = validator.validate("AIzaSy-gemini-123456");

        // Then
        assertEquals("Quota exceeded. Check your billing at console.cloud.google.com.", result.getMessage());
    }

    @Test
    void validate_otherErrorsCarryProviderMessage() {
        // Given
        server.expect(requestTo(startsWith(GeminiKeyValidator.GENERATE_URL)))
            .andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR).body("not json"));

        // When
        ValidationResult result = validator.validate("AIzaSy-gemini-123456");

        // Then
        assertEquals("API returned error (500): Unknown error", result.getMessage());
    }
}
