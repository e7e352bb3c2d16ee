package com.klubtool.backend.modules.group.domain;

public enum GroupMeetingStatus {
    SCHEDULED,
    INVITED,
    CANCELLED
}
