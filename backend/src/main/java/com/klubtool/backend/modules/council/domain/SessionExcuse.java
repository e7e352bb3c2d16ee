package com.klubtool.backend.modules.council.domain;

import com.klubtool.backend.global.jpa.AuditedEntity;
import com.klubtool.backend.modules.auth.domain.PortalUser;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

@Entity
@Table(name = "session_excuse",
        uniqueConstraints = @UniqueConstraint(name = "uq_session_excuse_session_user",
                columnNames = {"session_id", "user_id"}))
public class SessionExcuse extends AuditedEntity {

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "session_id", nullable = false)
    private CouncilSession session;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private PortalUser user;

    @Column(name = "note", length = 500)
    private String note;

    protected SessionExcuse() {
    }

    public SessionExcuse(CouncilSession session, PortalUser user, String note) {
        this.session = session;
        this.user = user;
        this.note = note;
    }

    public CouncilSession getSession() {
        return session;
    }

    public PortalUser getUser() {
        return user;
    }

    public String getNote() {
        return note;
    }

    public void setNote(String note) {
        this.note = note;
    }
}
