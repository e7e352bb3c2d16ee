package com.klubtool.backend.modules.calendar.domain;

import java.time.OffsetDateTime;

import com.klubtool.backend.global.jpa.AuditedEntity;
import com.klubtool.backend.modules.auth.domain.PortalUser;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

/**
 * Feed credential. Only the SHA-256 hash of the raw token is stored.
 */
@Entity
@Table(name = "calendar_subscription_token")
public class CalendarSubscriptionToken extends AuditedEntity {

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private PortalUser user;

    @Column(name = "token_hash", nullable = false, unique = true, length = 64)
    private String tokenHash;

    @Column(name = "revoked_at")
    private OffsetDateTime revokedAt;

    @Column(name = "last_used_at")
    private OffsetDateTime lastUsedAt;

    protected CalendarSubscriptionToken() {
    }

    public CalendarSubscriptionToken(PortalUser user, String tokenHash) {
        this.user = user;
        this.tokenHash = tokenHash;
    }

    public PortalUser getUser() {
        return user;
    }

    public String getTokenHash() {
        return tokenHash;
    }

    public OffsetDateTime getRevokedAt() {
        return revokedAt;
    }

    public OffsetDateTime getLastUsedAt() {
        return lastUsedAt;
    }

    public boolean isRevoked() {
        return revokedAt != null;
    }

    public void revoke(OffsetDateTime when) {
        if (revokedAt == null) {
            revokedAt = when;
        }
    }

    public void markUsed(OffsetDateTime when) {
        this.lastUsedAt = when;
    }
}
