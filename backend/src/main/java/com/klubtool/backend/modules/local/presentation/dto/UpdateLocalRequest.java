package com.klubtool.backend.modules.local.presentation.dto;

import jakarta.validation.constraints.Size;

/**
 * Partial update; null fields are left unchanged.
 */
public record UpdateLocalRequest(
        @Size(max = 200, message = "NAME_TOO_LONG")
        String name,
        @Size(max = 20, message = "CODE_TOO_LONG")
        String code,
        String description,
        Boolean active
) {
}
