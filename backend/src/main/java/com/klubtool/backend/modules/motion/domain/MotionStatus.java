package com.klubtool.backend.modules.motion.domain;

public enum MotionStatus {
    DRAFT,
    SUBMITTED,
    APPROVED,
    REJECTED,
    WITHDRAWN
}
