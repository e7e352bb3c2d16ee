package com.klubtool.backend.modules.motion.domain;

import com.klubtool.backend.global.jpa.AuditedEntity;
import com.klubtool.backend.modules.auth.domain.PortalUser;
import com.klubtool.backend.modules.council.domain.CouncilSession;
import com.klubtool.backend.modules.group.domain.PoliticalGroup;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

/**
 * Motion or inquiry a group brings into a council session.
 */
@Entity
@Table(name = "motion")
public class Motion extends AuditedEntity {

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, updatable = false, length = 16)
    private MotionKind kind;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "text", nullable = false)
    private String text;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private MotionStatus status = MotionStatus.DRAFT;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "session_id", nullable = false)
    private CouncilSession session;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "group_id", nullable = false)
    private PoliticalGroup group;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "submitted_by_id")
    private PortalUser submittedBy;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    protected Motion() {
    }

    public Motion(MotionKind kind) {
        this.kind = kind;
    }

    public MotionKind getKind() {
        return kind;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public MotionStatus getStatus() {
        return status;
    }

    public void setStatus(MotionStatus status) {
        this.status = status;
    }

    public CouncilSession getSession() {
        return session;
    }

    public void setSession(CouncilSession session) {
        this.session = session;
    }

    public PoliticalGroup getGroup() {
        return group;
    }

    public void setGroup(PoliticalGroup group) {
        this.group = group;
    }

    public PortalUser getSubmittedBy() {
        return submittedBy;
    }

    public void setSubmittedBy(PortalUser submittedBy) {
        this.submittedBy = submittedBy;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }
}
