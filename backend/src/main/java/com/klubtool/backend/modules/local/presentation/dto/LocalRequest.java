package com.klubtool.backend.modules.local.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record LocalRequest(
        @NotBlank(message = "NAME_REQUIRED")
        @Size(max = 200, message = "NAME_TOO_LONG")
        String name,
        @NotBlank(message = "CODE_REQUIRED")
        @Size(max = 20, message = "CODE_TOO_LONG")
        String code,
        String description,
        Boolean active
) {
}
