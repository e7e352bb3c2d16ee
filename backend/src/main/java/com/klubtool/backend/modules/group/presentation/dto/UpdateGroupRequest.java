package com.klubtool.backend.modules.group.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.Size;

public record UpdateGroupRequest(
        @Size(min = 1, max = 200, message = "NAME_INVALID")
        String name,
        @Size(max = 20, message = "SHORT_NAME_TOO_LONG")
        String shortName,
        UUID partyId,
        @Size(max = 50, message = "BADGE_NAME_TOO_LONG")
        String calendarBadgeName,
        Boolean active
) {
}
