package com.klubtool.backend.modules.group.domain;

import com.klubtool.backend.global.jpa.AuditedEntity;
import com.klubtool.backend.modules.local.domain.Party;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

/**
 * Party-affiliated group (club). Visibility follows the chain group, party, local, council.
 */
@Entity
@Table(name = "political_group")
public class PoliticalGroup extends AuditedEntity {

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "short_name", length = 20)
    private String shortName;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "party_id")
    private Party party;

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

    public String getShortName() {
        return shortName;
    }

    public void setShortName(String shortName) {
        this.shortName = shortName;
    }

    public Party getParty() {
        return party;
    }

    public void setParty(Party party) {
        this.party = party;
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
