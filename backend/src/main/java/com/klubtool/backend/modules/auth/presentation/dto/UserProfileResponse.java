package com.klubtool.backend.modules.auth.presentation.dto;

import java.util.List;
import java.util.UUID;

public record UserProfileResponse(
        UUID userId,
        String loginId,
        String fullName,
        String email,
        String roleName,
        List<String> permissions,
        String language,
        boolean superuser
) {
}
