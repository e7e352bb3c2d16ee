package com.klubtool.backend.modules.group.domain;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import com.klubtool.backend.global.jpa.AuditedEntity;
import com.klubtool.backend.modules.auth.domain.PortalUser;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

@Entity
@Table(name = "group_member",
        uniqueConstraints = @UniqueConstraint(name = "uq_group_member_group_user",
                columnNames = {"group_id", "user_id"}))
public class GroupMember extends AuditedEntity {

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private PortalUser user;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "group_id", nullable = false)
    private PoliticalGroup group;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "group_member_role", joinColumns = @JoinColumn(name = "group_member_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 32)
    private Set<StructuralRole> roles = EnumSet.noneOf(StructuralRole.class);

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    public PortalUser getUser() {
        return user;
    }

    public void setUser(PortalUser user) {
        this.user = user;
    }

    public PoliticalGroup getGroup() {
        return group;
    }

    public void setGroup(PoliticalGroup group) {
        this.group = group;
    }

    public Set<StructuralRole> getRoles() {
        return Collections.unmodifiableSet(roles);
    }

    /**
     * An empty role set falls back to plain {@link StructuralRole#MEMBER}.
     */
    public void replaceRoles(Set<StructuralRole> newRoles) {
        roles.clear();
        if (newRoles == null || newRoles.isEmpty()) {
            roles.add(StructuralRole.MEMBER);
        } else {
            roles.addAll(newRoles);
        }
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }
}
