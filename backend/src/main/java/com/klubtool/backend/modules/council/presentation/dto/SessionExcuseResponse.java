package com.klubtool.backend.modules.council.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record SessionExcuseResponse(UUID sessionId, UUID userId, String note, OffsetDateTime createdAt) {
}
