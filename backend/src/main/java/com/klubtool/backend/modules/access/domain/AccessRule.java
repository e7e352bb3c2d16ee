package com.klubtool.backend.modules.access.domain;

import java.util.EnumSet;
import java.util.Set;

import com.klubtool.backend.modules.group.domain.StructuralRole;

/**
 * Grant sources for one (resource, action) pair, consulted in order: permission string,
 * structural role on the owning group, membership visibility.
 */
public record AccessRule(
        boolean superuserOnly,
        boolean permissionGrants,
        Set<StructuralRole> structuralRoles,
        Set<VisibilityScope> visibilityScopes
) {

    public AccessRule {
        structuralRoles = structuralRoles.isEmpty()
                ? EnumSet.noneOf(StructuralRole.class) : EnumSet.copyOf(structuralRoles);
        visibilityScopes = visibilityScopes.isEmpty()
                ? EnumSet.noneOf(VisibilityScope.class) : EnumSet.copyOf(visibilityScopes);
    }

    public static AccessRule restrictedToSuperusers() {
        return new AccessRule(true, false, Set.of(), Set.of());
    }

    public static AccessRule permission() {
        return new AccessRule(false, true, Set.of(), Set.of());
    }

    public AccessRule orStructural(Set<StructuralRole> roles) {
        return new AccessRule(superuserOnly, permissionGrants, roles, visibilityScopes);
    }

    public AccessRule orVisible(VisibilityScope first, VisibilityScope... rest) {
        return new AccessRule(superuserOnly, permissionGrants, structuralRoles, EnumSet.of(first, rest));
    }
}
