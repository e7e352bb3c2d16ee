package com.klubtool.backend.modules.group.presentation.dto;

import java.util.UUID;

public record GroupResponse(
        UUID id,
        String name,
        String shortName,
        UUID partyId,
        String partyName,
        UUID localId,
        String calendarBadgeName,
        boolean active
) {
}
