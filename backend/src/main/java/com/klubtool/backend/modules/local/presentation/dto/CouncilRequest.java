package com.klubtool.backend.modules.local.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CouncilRequest(
        @NotBlank(message = "NAME_REQUIRED")
        @Size(max = 200, message = "NAME_TOO_LONG")
        String name,
        @NotNull(message = "LOCAL_REQUIRED")
        UUID localId,
        @Size(max = 50, message = "BADGE_TOO_LONG")
        String calendarBadgeName
) {
}
