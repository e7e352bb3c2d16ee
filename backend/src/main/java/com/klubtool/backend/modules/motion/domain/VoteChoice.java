package com.klubtool.backend.modules.motion.domain;

public enum VoteChoice {
    YES,
    NO,
    ABSTAIN,
    ABSENT
}
