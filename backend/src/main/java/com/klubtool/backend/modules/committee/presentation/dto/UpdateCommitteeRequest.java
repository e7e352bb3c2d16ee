package com.klubtool.backend.modules.committee.presentation.dto;

import com.klubtool.backend.modules.committee.domain.CommitteeType;

import jakarta.validation.constraints.Size;

public record UpdateCommitteeRequest(
        @Size(min = 1, max = 200, message = "NAME_INVALID")
        String name,
        @Size(max = 20, message = "ABBREVIATION_TOO_LONG")
        String abbreviation,
        CommitteeType committeeType,
        String description,
        Boolean active
) {
}
