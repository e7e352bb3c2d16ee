package com.klubtool.backend.modules.group.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Roles a member holds inside one group. They grant authority only within that group.
 */
public enum StructuralRole {
    LEADER,
    DEPUTY_LEADER,
    GROUP_ADMIN,
    SECRETARY,
    TREASURER,
    MEMBER;

    public static final Set<StructuralRole> LEADERSHIP = EnumSet.of(LEADER, DEPUTY_LEADER);
    public static final Set<StructuralRole> MANAGING = EnumSet.of(LEADER, DEPUTY_LEADER, GROUP_ADMIN);
}
