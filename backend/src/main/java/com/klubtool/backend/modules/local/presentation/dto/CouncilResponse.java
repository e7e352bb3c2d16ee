package com.klubtool.backend.modules.local.presentation.dto;

import java.util.UUID;

public record CouncilResponse(
        UUID id,
        String name,
        UUID localId,
        String localName,
        String calendarBadgeName,
        boolean active
) {
}
