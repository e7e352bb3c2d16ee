package com.klubtool.backend.modules.group.presentation.dto;

import java.util.List;
import java.util.UUID;

import com.klubtool.backend.modules.group.domain.StructuralRole;

public record GroupMemberResponse(
        UUID id,
        UUID groupId,
        String groupName,
        UUID userId,
        String fullName,
        List<StructuralRole> roles,
        boolean active
) {
}
