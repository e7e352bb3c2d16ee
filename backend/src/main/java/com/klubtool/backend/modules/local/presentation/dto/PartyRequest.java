package com.klubtool.backend.modules.local.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record PartyRequest(
        @NotBlank(message = "NAME_REQUIRED")
        @Size(max = 200, message = "NAME_TOO_LONG")
        String name,
        @Size(max = 20, message = "SHORT_NAME_TOO_LONG")
        String shortName
) {
}
