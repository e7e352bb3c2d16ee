package com.klubtool.backend.modules.group.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.klubtool.backend.modules.group.domain.GroupMeetingStatus;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record GroupMeetingRequest(
        @NotNull(message = "GROUP_REQUIRED")
        UUID groupId,
        @Size(max = 200, message = "TITLE_TOO_LONG")
        String title,
        @NotNull(message = "SCHEDULED_AT_REQUIRED")
        OffsetDateTime scheduledAt,
        @Size(max = 200, message = "LOCATION_TOO_LONG")
        String location,
        String description,
        GroupMeetingStatus status
) {
}
