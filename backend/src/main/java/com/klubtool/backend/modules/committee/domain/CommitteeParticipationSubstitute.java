package com.klubtool.backend.modules.committee.domain;

import com.klubtool.backend.global.jpa.AuditedEntity;

import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

/**
 * For one meeting, {@code substituteMember} attends in place of {@code member}.
 * Each member and each substitute appears at most once per meeting.
 */
@Entity
@Table(name = "committee_participation_substitute",
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_participation_meeting_member",
                        columnNames = {"committee_meeting_id", "member_id"}),
                @UniqueConstraint(name = "uq_participation_meeting_substitute",
                        columnNames = {"committee_meeting_id", "substitute_member_id"})
        })
public class CommitteeParticipationSubstitute extends AuditedEntity {

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "committee_meeting_id", nullable = false)
    private CommitteeMeeting committeeMeeting;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "member_id", nullable = false)
    private CommitteeMember member;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "substitute_member_id", nullable = false)
    private CommitteeMember substituteMember;

    protected CommitteeParticipationSubstitute() {
    }

    public CommitteeParticipationSubstitute(CommitteeMeeting committeeMeeting,
                                            CommitteeMember member,
                                            CommitteeMember substituteMember) {
        this.committeeMeeting = committeeMeeting;
        this.member = member;
        this.substituteMember = substituteMember;
    }

    public CommitteeMeeting getCommitteeMeeting() {
        return committeeMeeting;
    }

    public CommitteeMember getMember() {
        return member;
    }

    public CommitteeMember getSubstituteMember() {
        return substituteMember;
    }
}
