package com.klubtool.backend.modules.group.domain;

import java.time.OffsetDateTime;

import com.klubtool.backend.global.jpa.AuditedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

@Entity
@Table(name = "group_meeting")
public class GroupMeeting extends AuditedEntity {

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "group_id", nullable = false)
    private PoliticalGroup group;

    @Column(name = "title", length = 200)
    private String title;

    @Column(name = "scheduled_at", nullable = false)
    private OffsetDateTime scheduledAt;

    @Column(name = "location", length = 200)
    private String location;

    @Column(name = "description")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private GroupMeetingStatus status = GroupMeetingStatus.SCHEDULED;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    public PoliticalGroup getGroup() {
        return group;
    }

    public void setGroup(PoliticalGroup group) {
        this.group = group;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public OffsetDateTime getScheduledAt() {
        return scheduledAt;
    }

    public void setScheduledAt(OffsetDateTime scheduledAt) {
        this.scheduledAt = scheduledAt;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public GroupMeetingStatus getStatus() {
        return status;
    }

    public void setStatus(GroupMeetingStatus status) {
        this.status = status;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public boolean isCancelled() {
        return status == GroupMeetingStatus.CANCELLED;
    }

    /**
     * Cancelled meetings drop out of active listings but stay visible to calendar subscribers.
     */
    public void cancel() {
        this.status = GroupMeetingStatus.CANCELLED;
        this.active = false;
    }

    /**
     * Moves out of the cancelled state, making the meeting active again.
     */
    public void reinstate(GroupMeetingStatus newStatus) {
        if (isCancelled()) {
            this.active = true;
        }
        this.status = newStatus;
    }
}
