package com.tasktracker.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import com.tasktracker.backend.modules.auth.application.exception.CredentialIntegrityException;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Holds the HMAC signing key. Loaded once at startup and never changed afterwards;
 * rotating the secret means restarting the service, which invalidates every token.
 */
@Component
public class JwtTokenProvider {

    private static final String HMAC_SHA_256 = "HmacSHA256";
    static final int MIN_KEY_BYTES = 32;

    private final SecretKey secretKey;

    public JwtTokenProvider(@Value("${jwt.secret}") String secretString) {
        if (secretString == null || secretString.isBlank()) {
            throw new CredentialIntegrityException(CredentialIntegrityException.SIGNING_KEY_MISCONFIGURED,
                    "jwt.secret is empty");
        }
        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(secretString);
        } catch (IllegalArgumentException ex) {
            keyBytes = secretString.getBytes(StandardCharsets.UTF_8);
        }
        if (keyBytes.length < MIN_KEY_BYTES) {
            throw new CredentialIntegrityException(CredentialIntegrityException.SIGNING_KEY_MISCONFIGURED,
                    "jwt.secret must provide at least " + MIN_KEY_BYTES + " bytes for HS256, got " + keyBytes.length);
        }
        this.secretKey = new SecretKeySpec(keyBytes, HMAC_SHA_256);
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }
}
