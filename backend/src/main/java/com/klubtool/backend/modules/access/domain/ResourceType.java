package com.klubtool.backend.modules.access.domain;

/**
 * Access-controlled resources with the permission domain that governs them.
 */
public enum ResourceType {
    USER("user"),
    ROLE("role"),
    LOCAL("local"),
    COUNCIL("council"),
    SESSION("session"),
    COMMITTEE("committee"),
    COMMITTEE_MEETING("committee"),
    GROUP("group"),
    GROUP_MEMBER("group"),
    GROUP_MEETING("group"),
    MOTION("motion"),
    INQUIRY("motion");

    private final String permissionDomain;

    ResourceType(String permissionDomain) {
        this.permissionDomain = permissionDomain;
    }

    public String permissionDomain() {
        return permissionDomain;
    }
}
