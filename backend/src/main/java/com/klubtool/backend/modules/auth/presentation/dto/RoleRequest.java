package com.klubtool.backend.modules.auth.presentation.dto;

import java.util.Set;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RoleRequest(
        @NotBlank(message = "NAME_REQUIRED")
        @Size(max = 100, message = "NAME_TOO_LONG")
        String name,
        @Size(max = 255, message = "DESCRIPTION_TOO_LONG")
        String description,
        Set<String> permissions
) {
}
