package com.klubtool.backend.modules.committee.presentation.dto;

import java.util.UUID;

import com.klubtool.backend.modules.committee.domain.CommitteeRole;

import jakarta.validation.constraints.NotNull;

public record CommitteeMemberRequest(
        @NotNull(message = "USER_REQUIRED")
        UUID userId,
        CommitteeRole role
) {
}
