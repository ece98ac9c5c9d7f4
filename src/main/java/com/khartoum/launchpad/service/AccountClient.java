package com.khartoum.launchpad.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.khartoum.launchpad.config.LaunchpadProperties;
import com.khartoum.launchpad.dto.AccountProfile;
import com.khartoum.launchpad.dto.TeamInfo;
import com.khartoum.launchpad.exception.NotAuthenticatedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * Resolves the caller behind a bearer token against the upstream account API.
 * Any lookup failure is reported as {@link NotAuthenticatedException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountClient {

    static final String VERIFY_FAILED = "Failed to verify your account. Please log in again.";

    private final RestTemplate restTemplate;
    private final LaunchpadProperties properties;

    public AccountProfile getProfile(String token) {
        JsonNode body = get(token, "/profile", "Failed to fetch profile");
        // The profile may come wrapped in {"user": {...}}
        JsonNode user = body.hasNonNull("user") ? body.get("user") : body;
        return new AccountProfile(
            longOrNull(user, "id"),
            textOrNull(user, "name"),
            textOrNull(user, "email"),
            longOrNull(user, "team_id")
        );
    }

    public TeamInfo getTeamInfo(String token) {
        JsonNode body = get(token, "/launchpad/team-info", "Failed to fetch team info");
        String tier = textOrNull(body, "tier");
        return new TeamInfo(
            longOrNull(body, "id"),
            textOrNull(body, "name"),
            tier != null ? tier : "free",
            textOrNull(body, "api_token")
        );
    }

    private JsonNode get(String token, String path, String failure) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(token);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        try {
            JsonNode body = restTemplate.exchange(properties.getAccount().getApiUrl() + path,
                HttpMethod.GET, new HttpEntity<>(headers), JsonNode.class).getBody();
            if (body == null) {
                log.warn("{}: empty response", failure);
                throw new NotAuthenticatedException(VERIFY_FAILED);
            }
            return body;
        } catch (RestClientResponseException e) {
            log.warn("{} ({})", failure, e.getStatusCode().value());
            throw new NotAuthenticatedException(VERIFY_FAILED, e);
        } catch (RestClientException e) {
            log.warn("{}: {}", failure, e.getMessage());
            throw new NotAuthenticatedException(VERIFY_FAILED, e);
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() || value.asText().isEmpty() ? null : value.asText();
    }

    private static Long longOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asLong();
    }
}
