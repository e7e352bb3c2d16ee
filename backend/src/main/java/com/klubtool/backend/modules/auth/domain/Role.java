package com.klubtool.backend.modules.auth.domain;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;

import com.klubtool.backend.global.jpa.AuditedEntity;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;

/**
 * Named set of permission strings. A user references at most one role.
 */
@Entity
@Table(name = "role")
public class Role extends AuditedEntity {

    @Column(name = "name", nullable = false, unique = true, length = 100)
    private String name;

    @Column(name = "description", length = 255)
    private String description;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "role_permission", joinColumns = @JoinColumn(name = "role_id"))
    @Column(name = "permission_code", nullable = false, length = 64)
    private Set<String> permissionCodes = new LinkedHashSet<>();

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public Set<String> getPermissionCodes() {
        return Collections.unmodifiableSet(permissionCodes);
    }

    public void replacePermissions(Set<Permission> permissions) {
        permissionCodes.clear();
        permissions.stream().map(Permission::code).sorted().forEach(permissionCodes::add);
    }

    /**
     * Permissions this role currently grants; empty while the role is inactive.
     */
    public Set<Permission> grantedPermissions() {
        if (!active) {
            return EnumSet.noneOf(Permission.class);
        }
        return Permission.parseKnown(permissionCodes);
    }
}
