package com.klubtool.backend.modules.local.domain;

import com.klubtool.backend.global.jpa.AuditedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OneToOne;
import jakarta.persistence.Table;

@Entity
@Table(name = "council")
public class Council extends AuditedEntity {

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "local_id", nullable = false, unique = true)
    private Local local;

    @Column(name = "calendar_badge_name", length = 50)
    private String calendarBadgeName;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Local getLocal() {
        return local;
    }

    public void setLocal(Local local) {
        this.local = local;
    }

    public String getCalendarBadgeName() {
        return calendarBadgeName;
    }

    public void setCalendarBadgeName(String calendarBadgeName) {
        this.calendarBadgeName = calendarBadgeName;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }
}
