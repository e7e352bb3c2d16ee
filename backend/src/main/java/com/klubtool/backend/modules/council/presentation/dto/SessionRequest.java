package com.klubtool.backend.modules.council.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.klubtool.backend.modules.council.domain.SessionStatus;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record SessionRequest(
        @Size(max = 200, message = "TITLE_TOO_LONG")
        String title,
        @NotNull(message = "COUNCIL_REQUIRED")
        UUID councilId,
        UUID committeeId,
        SessionStatus status,
        @NotNull(message = "SCHEDULED_AT_REQUIRED")
        OffsetDateTime scheduledAt,
        @Size(max = 200, message = "LOCATION_TOO_LONG")
        String location,
        String agenda
) {
}
