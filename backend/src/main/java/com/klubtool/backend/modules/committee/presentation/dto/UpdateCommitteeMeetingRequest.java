package com.klubtool.backend.modules.committee.presentation.dto;

import java.time.OffsetDateTime;

import jakarta.validation.constraints.Size;

public record UpdateCommitteeMeetingRequest(
        @Size(min = 1, max = 200, message = "TITLE_INVALID")
        String title,
        OffsetDateTime scheduledAt,
        @Size(max = 200, message = "LOCATION_TOO_LONG")
        String location,
        String description,
        Boolean active
) {
}
