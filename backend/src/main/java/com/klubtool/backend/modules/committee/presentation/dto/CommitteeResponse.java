package com.klubtool.backend.modules.committee.presentation.dto;

import java.util.UUID;

import com.klubtool.backend.modules.committee.domain.CommitteeType;

public record CommitteeResponse(
        UUID id,
        String name,
        String abbreviation,
        UUID councilId,
        String councilName,
        CommitteeType committeeType,
        String committeeTypeLabel,
        String description,
        boolean active
) {
}
