package com.klubtool.backend.modules.committee.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record CommitteeMeetingResponse(
        UUID id,
        UUID committeeId,
        String committeeName,
        String title,
        OffsetDateTime scheduledAt,
        String location,
        String description,
        boolean active
) {
}
