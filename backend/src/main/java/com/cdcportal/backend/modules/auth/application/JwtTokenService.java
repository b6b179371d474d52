package com.cdcportal.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.util.Date;

import com.cdcportal.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Verifies access tokens issued by the login service. {@link #issueAccessToken} mints
 * tokens with the same claims for tests and operational tooling.
 */
@Service
public class JwtTokenService {

    static final String CLAIM_USERNAME = "username";
    static final String CLAIM_ROLE = "role";
    static final String CLAIM_TENANT_ID = "tenantId";

    private final JwtTokenProvider tokenProvider;
    private final long accessTokenTtlMillis;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:3600000}") long accessTokenTtlMillis,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.accessTokenTtlMillis = accessTokenTtlMillis;
        this.clock = clock;
    }

    public String issueAccessToken(Long userId, String username, String role, Long tenantId) {
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(userId.toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plusMillis(accessTokenTtlMillis)))
                .claim(CLAIM_USERNAME, username)
                .claim(CLAIM_ROLE, role)
                .claim(CLAIM_TENANT_ID, tenantId)
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();
    }

    public ParsedToken parseAccessToken(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            Long userId = Long.valueOf(claims.getSubject());
            String role = claims.get(CLAIM_ROLE, String.class);
            if (role == null || role.isBlank()) {
                throw new InvalidTokenException("Access token carries no role", null);
            }
            Number tenantClaim = claims.get(CLAIM_TENANT_ID, Number.class);
            Long tenantId = tenantClaim == null ? null : tenantClaim.longValue();
            return new ParsedToken(userId, claims.get(CLAIM_USERNAME, String.class), role, tenantId);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }
    }

    public record ParsedToken(Long userId, String username, String role, Long tenantId) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
