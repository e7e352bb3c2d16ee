package com.klubtool.backend.modules.committee.presentation.dto;

import java.util.UUID;

import com.klubtool.backend.modules.committee.domain.CommitteeRole;

public record CommitteeMemberResponse(
        UUID id,
        UUID committeeId,
        UUID userId,
        String fullName,
        CommitteeRole role,
        boolean active
) {
}
