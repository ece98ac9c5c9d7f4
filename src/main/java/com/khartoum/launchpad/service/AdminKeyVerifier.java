package com.khartoum.launchpad.service;

import com.khartoum.launchpad.config.LaunchpadProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

@Component
@RequiredArgsConstructor
public class AdminKeyVerifier {

    private final LaunchpadProperties properties;

    /** Constant-time comparison. False when no admin key is configured. */
    public boolean isValid(String presented) {
        String expected = properties.getAdmin().getApiKey();
        if (expected == null || expected.isEmpty() || presented == null) {
            return false;
        }
        return MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.UTF_8),
            presented.getBytes(StandardCharsets.UTF_8));
    }
}
