package com.cdcportal.backend.global.security;

/**
 * Claims of a verified access token. {@code tenantId} is whatever the token says;
 * scoped operations re-check it against the stored account.
 */
public record JwtAuthenticationPrincipal(Long userId, String username, String role, Long tenantId) {
}
