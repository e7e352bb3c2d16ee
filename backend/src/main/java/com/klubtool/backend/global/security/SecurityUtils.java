package com.klubtool.backend.global.security;

import java.util.Optional;
import java.util.UUID;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    /**
     * Principal of the current request, empty for anonymous callers.
     */
    public static Optional<PortalAuthenticationPrincipal> findCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof PortalAuthenticationPrincipal principal)) {
            return Optional.empty();
        }
        return Optional.of(principal);
    }

    public static Optional<UUID> findCurrentUserId() {
        return findCurrentPrincipal().map(PortalAuthenticationPrincipal::userId);
    }
}
