package com.klubtool.backend.modules.committee.domain;

public enum CommitteeRole {
    CHAIRPERSON,
    VICE_CHAIRPERSON,
    MEMBER,
    SUBSTITUTE_MEMBER
}
