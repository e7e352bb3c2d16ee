package com.klubtool.backend.modules.motion.domain;

import com.klubtool.backend.modules.access.domain.ResourceType;

/**
 * Motions and inquiries share one table and one permission domain.
 */
public enum MotionKind {
    MOTION(ResourceType.MOTION, "MOTION_NOT_FOUND"),
    INQUIRY(ResourceType.INQUIRY, "INQUIRY_NOT_FOUND");

    private final ResourceType resourceType;
    private final String notFoundCode;

    MotionKind(ResourceType resourceType, String notFoundCode) {
        this.resourceType = resourceType;
        this.notFoundCode = notFoundCode;
    }

    public ResourceType resourceType() {
        return resourceType;
    }

    public String notFoundCode() {
        return notFoundCode;
    }
}
