package com.cdcportal.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import io.jsonwebtoken.io.DecodingException;
import io.jsonwebtoken.io.Decoders;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * HMAC-SHA256 key shared with the login service that issues the portal's tokens.
 * {@code jwt.secret} is normally Base64; anything that does not decode is used
 * as raw UTF-8 text.
 */
@Component
public class JwtTokenProvider {

    private static final String HMAC_SHA_256 = "HmacSHA256";
    private static final int MIN_KEY_BYTES = 32;

    private final SecretKey secretKey;

    public JwtTokenProvider(@Value("${jwt.secret}") String secret) {
        byte[] keyBytes = decode(secret.trim());
        if (keyBytes.length < MIN_KEY_BYTES) {
            throw new IllegalStateException(
                    "jwt.secret must provide at least " + MIN_KEY_BYTES * 8 + " bits, got " + keyBytes.length * 8);
        }
        this.secretKey = new SecretKeySpec(keyBytes, HMAC_SHA_256);
    }

    private static byte[] decode(String secret) {
        try {
            return Decoders.BASE64.decode(secret);
        } catch (DecodingException ex) {
            return secret.getBytes(StandardCharsets.UTF_8);
        }
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }
}
