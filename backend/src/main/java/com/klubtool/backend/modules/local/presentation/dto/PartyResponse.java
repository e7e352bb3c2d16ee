package com.klubtool.backend.modules.local.presentation.dto;

import java.util.UUID;

public record PartyResponse(UUID id, String name, String shortName, UUID localId, boolean active) {
}
