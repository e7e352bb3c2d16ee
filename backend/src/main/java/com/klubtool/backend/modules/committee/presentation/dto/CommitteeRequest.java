package com.klubtool.backend.modules.committee.presentation.dto;

import java.util.UUID;

import com.klubtool.backend.modules.committee.domain.CommitteeType;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CommitteeRequest(
        @NotBlank(message = "NAME_REQUIRED")
        @Size(max = 200, message = "NAME_TOO_LONG")
        String name,
        @Size(max = 20, message = "ABBREVIATION_TOO_LONG")
        String abbreviation,
        @NotNull(message = "COUNCIL_REQUIRED")
        UUID councilId,
        CommitteeType committeeType,
        String description
) {
}
