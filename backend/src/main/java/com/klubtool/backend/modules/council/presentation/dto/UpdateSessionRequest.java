package com.klubtool.backend.modules.council.presentation.dto;

import java.time.OffsetDateTime;

import com.klubtool.backend.modules.council.domain.SessionStatus;

import jakarta.validation.constraints.Size;

public record UpdateSessionRequest(
        @Size(max = 200, message = "TITLE_TOO_LONG")
        String title,
        SessionStatus status,
        OffsetDateTime scheduledAt,
        @Size(max = 200, message = "LOCATION_TOO_LONG")
        String location,
        String agenda,
        Boolean active
) {
}
