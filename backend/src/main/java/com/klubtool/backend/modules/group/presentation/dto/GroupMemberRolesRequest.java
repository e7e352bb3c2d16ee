package com.klubtool.backend.modules.group.presentation.dto;

import java.util.Set;

import com.klubtool.backend.modules.group.domain.StructuralRole;

import jakarta.validation.constraints.NotNull;

public record GroupMemberRolesRequest(
        @NotNull(message = "ROLES_REQUIRED")
        Set<StructuralRole> roles
) {
}
