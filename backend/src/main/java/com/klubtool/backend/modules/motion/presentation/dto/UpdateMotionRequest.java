package com.klubtool.backend.modules.motion.presentation.dto;

import com.klubtool.backend.modules.motion.domain.MotionStatus;

import jakarta.validation.constraints.Size;

public record UpdateMotionRequest(
        @Size(min = 1, max = 200, message = "TITLE_INVALID")
        String title,
        @Size(min = 1, message = "TEXT_INVALID")
        String text,
        MotionStatus status,
        Boolean active
) {
}
