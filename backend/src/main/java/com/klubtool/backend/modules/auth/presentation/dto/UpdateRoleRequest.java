package com.klubtool.backend.modules.auth.presentation.dto;

import java.util.Set;

import jakarta.validation.constraints.Size;

public record UpdateRoleRequest(
        @Size(min = 1, max = 100, message = "NAME_INVALID")
        String name,
        @Size(max = 255, message = "DESCRIPTION_TOO_LONG")
        String description,
        Set<String> permissions,
        Boolean active
) {
}
