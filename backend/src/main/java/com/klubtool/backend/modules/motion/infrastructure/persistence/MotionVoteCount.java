package com.klubtool.backend.modules.motion.infrastructure.persistence;

import java.util.UUID;

import com.klubtool.backend.modules.motion.domain.VoteChoice;

public record MotionVoteCount(UUID motionId, VoteChoice choice, long count) {
}
