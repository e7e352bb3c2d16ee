package com.klubtool.backend.modules.local.presentation.dto;

import jakarta.validation.constraints.Size;

public record UpdateCouncilRequest(
        @Size(max = 200, message = "NAME_TOO_LONG")
        String name,
        @Size(max = 50, message = "BADGE_TOO_LONG")
        String calendarBadgeName,
        Boolean active
) {
}
