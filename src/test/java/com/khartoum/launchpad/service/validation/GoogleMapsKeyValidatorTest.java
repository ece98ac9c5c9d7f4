package com.khartoum.launchpad.service.validation;

import com.khartoum.launchpad.dto.ValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class GoogleMapsKeyValidatorTest {

    private MockRestServiceServer server;
    private GoogleMapsKeyValidator validator;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        validator = new GoogleMapsKeyValidator(restTemplate);
    }

    @Test
    void validate_okStatusMeansWorkingKey() {
        // Given
        server.expect(requestTo(startsWith(GoogleMapsKeyValidator.GEOCODE_URL)))
            .andExpect(queryParam("key", "AIzaSy-maps-123456"))
            .andRespond(withSuccess("{\"status\":\"OK\",\"results\":[]}", MediaType.APPLICATION_JSON));

        // When
        ValidationResult result = validator.validate("AIzaSy-maps-123456");

        // Then
        assertTrue(result.isValid());
        assertEquals("Google Maps key is active and working", result.getMessage());
    }

    @Test
    void validate_deniedRequestOnSuccessfulResponseIsInvalid() {
        // Given
        server.expect(requestTo(startsWith(GoogleMapsKeyValidator.GEOCODE_URL)))
            .andRespond(withSuccess("{\"status\":\"REQUEST_DENIED\",\"error_message\":\"The provided API key is invalid.\"}",
                MediaType.APPLICATION_JSON));

        // When
        ValidationResult result = validator.validate("AIzaSy-maps-123456");

        // Then
        assertFalse(result.isValid());
        assertEquals("Invalid API key, or Geocoding API is not enabled. Enable it at console.cloud.google.com.",
            result.getMessage());
        assertEquals("The provided API key is invalid.", result.getDetails());
    }

    @Test
    void validate_unknownStatusIsEchoed() {
        // Given
        server.expect(requestTo(startsWith(GoogleMapsKeyValidator.GEOCODE_URL)))
            .andRespond(withSuccess("{\"status\":\"UNKNOWN_ERROR\"}", MediaType.APPLICATION_JSON));

        // When
        ValidationResult result = validator.validate("AIzaSy-maps-123456");

        // Then
        assertEquals("API returned status: UNKNOWN_ERROR", result.getMessage());
        assertNull(result.getDetails());
    }

    @Test
    void validate_httpErrorWithoutStatusBody() {
        // Given
        server.expect(requestTo(startsWith(GoogleMapsKeyValidator.GEOCODE_URL)))
            .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        // When
        ValidationResult result = validator.validate("AIzaSy-maps-123456");

        // Then
        assertEquals("Google Maps API returned error (503)", result.getMessage());
    }
}
