package com.klubtool.backend.modules.group.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.klubtool.backend.modules.group.domain.GroupMeetingStatus;

public record GroupMeetingResponse(
        UUID id,
        UUID groupId,
        String groupName,
        String title,
        OffsetDateTime scheduledAt,
        String location,
        String description,
        GroupMeetingStatus status,
        boolean active
) {
}
