package com.khartoum.launchpad.service;

import com.khartoum.launchpad.config.LaunchpadProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-256-GCM encryption for stored tenant credentials.
 * Format: base64(iv) + ":" + base64(ciphertext) + ":" + base64(authTag)
 */
@Slf4j
@Service
public class EncryptionService {

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;
    private static final int TAG_LENGTH_BYTES = 16;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final SecretKey secretKey;

    public EncryptionService(LaunchpadProperties properties) {
        this.secretKey = parseKey(properties.getEncryption().getKey());
    }

    public String encrypt(String plaintext) {
        requireKey();
        try {
            byte[] iv = new byte[IV_LENGTH];
            SECURE_RANDOM.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(TAG_LENGTH_BYTES * 8, iv));
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            // JCE appends the tag to the ciphertext; store it as its own segment
            int cipherLength = sealed.length - TAG_LENGTH_BYTES;
            byte[] ciphertext = new byte[cipherLength];
            byte[] tag = new byte[TAG_LENGTH_BYTES];
            System.arraycopy(sealed, 0, ciphertext, 0, cipherLength);
            System.arraycopy(sealed, cipherLength, tag, 0, TAG_LENGTH_BYTES);

            Base64.Encoder encoder = Base64.getEncoder();
            return encoder.encodeToString(iv) + ":" + encoder.encodeToString(ciphertext) + ":" + encoder.encodeToString(tag);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt credential", e);
        }
    }

    public String decrypt(String encoded) {
        requireKey();
        String[] parts = encoded == null ? new String[0] : encoded.split(":");
        if (parts.length != 3 || parts[0].isEmpty() || parts[2].isEmpty()) {
            throw new IllegalArgumentException("Invalid encrypted key format");
        }

        try {
            Base64.Decoder decoder = Base64.getDecoder();
            byte[] iv = decoder.decode(parts[0]);
            byte[] ciphertext = decoder.decode(parts[1]);
            byte[] tag = decoder.decode(parts[2]);

            byte[] sealed = new byte[ciphertext.length + tag.length];
            System.arraycopy(ciphertext, 0, sealed, 0, ciphertext.length);
            System.arraycopy(tag, 0, sealed, ciphertext.length, tag.length);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(TAG_LENGTH_BYTES * 8, iv));
            return new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to decrypt credential", e);
        }
    }

    private void requireKey() {
        if (secretKey == null) {
            throw new IllegalStateException(
                "launchpad.encryption.key is not configured. Generate one with: openssl rand -base64 32");
        }
    }

    private static SecretKey parseKey(String base64Key) {
        if (base64Key == null || base64Key.isBlank()) {
            log.warn("No encryption key configured; credential storage is unavailable");
            return null;
        }
        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(base64Key.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("launchpad.encryption.key must be valid Base64", e);
        }
        if (keyBytes.length != 32) {
            throw new IllegalStateException(
                "launchpad.encryption.key must be 256 bits (32 bytes). Got: " + keyBytes.length + " bytes");
        }
        return new SecretKeySpec(keyBytes, "AES");
    }
}
