package com.klubtool.backend.modules.group.presentation.dto;

import java.util.Set;
import java.util.UUID;

import com.klubtool.backend.modules.group.domain.StructuralRole;

import jakarta.validation.constraints.NotNull;

public record GroupMemberRequest(
        @NotNull(message = "GROUP_REQUIRED")
        UUID groupId,
        @NotNull(message = "USER_REQUIRED")
        UUID userId,
        Set<StructuralRole> roles
) {
}
