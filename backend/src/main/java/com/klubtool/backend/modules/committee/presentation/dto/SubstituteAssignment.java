package com.klubtool.backend.modules.committee.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record SubstituteAssignment(
        @NotNull(message = "MEMBER_REQUIRED")
        UUID memberId,
        @NotNull(message = "SUBSTITUTE_REQUIRED")
        UUID substituteMemberId
) {
}
