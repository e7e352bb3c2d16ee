package com.klubtool.backend.global.security;

import java.util.UUID;

public record PortalAuthenticationPrincipal(UUID userId, String loginId) {
}
