package com.klubtool.backend.modules.local.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record LocalResponse(
        UUID id,
        String name,
        String code,
        String description,
        boolean active,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
