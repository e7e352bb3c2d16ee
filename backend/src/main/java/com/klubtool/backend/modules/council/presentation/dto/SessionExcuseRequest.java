package com.klubtool.backend.modules.council.presentation.dto;

import jakarta.validation.constraints.Size;

public record SessionExcuseRequest(
        @Size(max = 500, message = "NOTE_TOO_LONG")
        String note
) {
}
