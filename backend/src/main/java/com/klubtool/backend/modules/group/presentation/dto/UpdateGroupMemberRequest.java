package com.klubtool.backend.modules.group.presentation.dto;

public record UpdateGroupMemberRequest(Boolean active) {
}
