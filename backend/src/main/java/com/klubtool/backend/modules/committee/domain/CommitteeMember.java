package com.klubtool.backend.modules.committee.domain;

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

@Entity
@Table(name = "committee_member",
        uniqueConstraints = @UniqueConstraint(name = "uq_committee_member_committee_user",
                columnNames = {"committee_id", "user_id"}))
public class CommitteeMember extends AuditedEntity {

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "committee_id", nullable = false)
    private Committee committee;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private PortalUser user;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 20)
    private CommitteeRole role = CommitteeRole.MEMBER;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    public Committee getCommittee() {
        return committee;
    }

    public void setCommittee(Committee committee) {
        this.committee = committee;
    }

    public PortalUser getUser() {
        return user;
    }

    public void setUser(PortalUser user) {
        this.user = user;
    }

    public CommitteeRole getRole() {
        return role;
    }

    public void setRole(CommitteeRole role) {
        this.role = role;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }
}
