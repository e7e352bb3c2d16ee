package com.klubtool.backend.modules.motion.presentation.dto;

import java.util.UUID;

import com.klubtool.backend.modules.motion.domain.MotionStatus;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record MotionRequest(
        @NotBlank(message = "TITLE_REQUIRED")
        @Size(max = 200, message = "TITLE_TOO_LONG")
        String title,
        @NotBlank(message = "TEXT_REQUIRED")
        String text,
        @NotNull(message = "SESSION_REQUIRED")
        UUID sessionId,
        @NotNull(message = "GROUP_REQUIRED")
        UUID groupId,
        MotionStatus status
) {
}
