package com.khartoum.launchpad.controller;

import com.khartoum.launchpad.dto.ErrorResponse;
import com.khartoum.launchpad.dto.FeatureFlagRequest;
import com.khartoum.launchpad.dto.FlagPropagationResult;
import com.khartoum.launchpad.exception.InvalidRequestException;
import com.khartoum.launchpad.service.AdminKeyVerifier;
import com.khartoum.launchpad.service.FeatureFlagService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminController {

    private final AdminKeyVerifier adminKeyVerifier;
    private final FeatureFlagService featureFlagService;

    /**
     * Adds new feature flag defaults to every active tenant. Flags a tenant
     * already has keep their value.
     */
    @PostMapping("/features")
    public ResponseEntity<?> propagateFeatures(
            @RequestHeader(value = "X-Admin-Key", required = false) String adminKey,
            @RequestBody FeatureFlagRequest request) {
        if (!adminKeyVerifier.isValid(adminKey)) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(new ErrorResponse("Unauthorized"));
        }

        Map<String, Boolean> flags = toFlags(request.getFlags());

        try {
            FlagPropagationResult result = featureFlagService.propagateToAll(flags);
            return ResponseEntity.ok(result);
        } catch (RuntimeException e) {
            log.error("Feature propagation failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("Feature propagation failed: " + e.getMessage()));
        }
    }

    private static Map<String, Boolean> toFlags(Map<String, Object> raw) {
        if (raw == null || raw.isEmpty()) {
            throw new InvalidRequestException("flags must be a non-empty object of { flagName: boolean }");
        }
        Map<String, Boolean> flags = new LinkedHashMap<>();
        raw.forEach((name, value) -> {
            if (!(value instanceof Boolean)) {
                String type = value == null ? "null" : value.getClass().getSimpleName().toLowerCase(Locale.ROOT);
                throw new InvalidRequestException("Flag \"" + name + "\" must be a boolean, got " + type);
            }
            flags.put(name, (Boolean) value);
        });
        return flags;
    }
}
