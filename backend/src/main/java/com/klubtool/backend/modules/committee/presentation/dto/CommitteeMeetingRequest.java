package com.klubtool.backend.modules.committee.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CommitteeMeetingRequest(
        @NotNull(message = "COMMITTEE_REQUIRED")
        UUID committeeId,
        @NotBlank(message = "TITLE_REQUIRED")
        @Size(max = 200, message = "TITLE_TOO_LONG")
        String title,
        @NotNull(message = "SCHEDULED_AT_REQUIRED")
        OffsetDateTime scheduledAt,
        @Size(max = 200, message = "LOCATION_TOO_LONG")
        String location,
        String description
) {
}
