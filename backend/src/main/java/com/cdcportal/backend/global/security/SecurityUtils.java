package com.cdcportal.backend.global.security;

import com.cdcportal.backend.modules.access.domain.CallerIdentity;
import com.cdcportal.backend.modules.account.domain.UserRoleType;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.server.ResponseStatusException;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static JwtAuthenticationPrincipal getCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof JwtAuthenticationPrincipal principal)) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED");
        }
        return principal;
    }

    public static Long getCurrentUserId() {
        return getCurrentPrincipal().userId();
    }

    /**
     * Token claims as a caller identity. Unknown role codes map to {@code UNASSIGNED}.
     */
    public static CallerIdentity getCurrentIdentity() {
        JwtAuthenticationPrincipal principal = getCurrentPrincipal();
        return new CallerIdentity(principal.userId(), UserRoleType.fromCode(principal.role()), principal.tenantId());
    }
}
