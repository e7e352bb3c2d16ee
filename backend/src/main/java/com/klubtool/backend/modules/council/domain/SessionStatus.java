package com.klubtool.backend.modules.council.domain;

public enum SessionStatus {
    SCHEDULED,
    INVITED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED
}
