package com.klubtool.backend.modules.group.presentation.dto;

import java.time.OffsetDateTime;

import com.klubtool.backend.modules.group.domain.GroupMeetingStatus;

import jakarta.validation.constraints.Size;

public record UpdateGroupMeetingRequest(
        @Size(max = 200, message = "TITLE_TOO_LONG")
        String title,
        OffsetDateTime scheduledAt,
        @Size(max = 200, message = "LOCATION_TOO_LONG")
        String location,
        String description,
        GroupMeetingStatus status,
        Boolean active
) {
}
