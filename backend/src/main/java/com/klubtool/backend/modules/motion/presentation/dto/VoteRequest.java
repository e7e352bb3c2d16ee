package com.klubtool.backend.modules.motion.presentation.dto;

import com.klubtool.backend.modules.motion.domain.VoteChoice;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record VoteRequest(
        @NotNull(message = "VOTE_REQUIRED")
        VoteChoice choice,
        @Size(max = 1000, message = "REASON_TOO_LONG")
        String reason
) {
}
