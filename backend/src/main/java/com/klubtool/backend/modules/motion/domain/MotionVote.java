package com.klubtool.backend.modules.motion.domain;

import com.klubtool.backend.global.jpa.AuditedEntity;
import com.klubtool.backend.modules.auth.domain.PortalUser;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

/**
 * One voter's current vote on a motion. Voting again replaces the choice.
 */
@Entity
@Table(name = "motion_vote",
        uniqueConstraints = @UniqueConstraint(name = "uq_motion_vote_motion_voter",
                columnNames = {"motion_id", "voter_id"}))
public class MotionVote extends AuditedEntity {

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "motion_id", nullable = false)
    private Motion motion;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "voter_id", nullable = false)
    private PortalUser voter;

    @Enumerated(EnumType.STRING)
    @Column(name = "choice", nullable = false, length = 10)
    private VoteChoice choice;

    @Column(name = "reason", length = 1000)
    private String reason;

    protected MotionVote() {
    }

    public MotionVote(Motion motion, PortalUser voter) {
        this.motion = motion;
        this.voter = voter;
    }

    public Motion getMotion() {
        return motion;
    }

    public PortalUser getVoter() {
        return voter;
    }

    public VoteChoice getChoice() {
        return choice;
    }

    public void setChoice(VoteChoice choice) {
        this.choice = choice;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }
}
