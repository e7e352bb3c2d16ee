package com.klubtool.backend.modules.motion.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.klubtool.backend.modules.motion.domain.MotionKind;
import com.klubtool.backend.modules.motion.domain.MotionStatus;

public record MotionResponse(
        UUID id,
        MotionKind kind,
        String title,
        String text,
        MotionStatus status,
        UUID sessionId,
        String sessionTitle,
        UUID councilId,
        UUID groupId,
        String groupName,
        UUID submittedById,
        String submittedByName,
        boolean active,
        VoteTally votes,
        OffsetDateTime createdAt
) {
}
