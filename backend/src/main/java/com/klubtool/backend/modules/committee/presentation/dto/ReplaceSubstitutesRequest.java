package com.klubtool.backend.modules.committee.presentation.dto;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record ReplaceSubstitutesRequest(
        @NotNull(message = "ASSIGNMENTS_REQUIRED")
        List<@NotNull(message = "ASSIGNMENT_REQUIRED") @Valid SubstituteAssignment> assignments
) {
}
