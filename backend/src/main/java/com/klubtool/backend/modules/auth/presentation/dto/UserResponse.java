package com.klubtool.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record UserResponse(
        UUID id,
        String loginId,
        String fullName,
        String email,
        UUID roleId,
        String roleName,
        String language,
        boolean superuser,
        boolean active,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
