package com.klubtool.backend.modules.motion.presentation.dto;

import java.util.Map;

import com.klubtool.backend.modules.motion.domain.VoteChoice;

public record VoteTally(long yes, long no, long abstain, long absent, long total) {

    public static final VoteTally EMPTY = new VoteTally(0, 0, 0, 0, 0);

    public static VoteTally of(Map<VoteChoice, Long> counts) {
        long yes = counts.getOrDefault(VoteChoice.YES, 0L);
        long no = counts.getOrDefault(VoteChoice.NO, 0L);
        long abstain = counts.getOrDefault(VoteChoice.ABSTAIN, 0L);
        long absent = counts.getOrDefault(VoteChoice.ABSENT, 0L);
        return new VoteTally(yes, no, abstain, absent, yes + no + abstain + absent);
    }
}
