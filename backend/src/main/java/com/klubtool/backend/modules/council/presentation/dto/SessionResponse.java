package com.klubtool.backend.modules.council.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.klubtool.backend.modules.council.domain.SessionStatus;

public record SessionResponse(
        UUID id,
        String title,
        UUID councilId,
        String councilName,
        UUID committeeId,
        SessionStatus status,
        OffsetDateTime scheduledAt,
        String location,
        String agenda,
        boolean active,
        boolean excusedByCurrentUser
) {
}
