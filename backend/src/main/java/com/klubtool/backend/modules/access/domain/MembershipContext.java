package com.klubtool.backend.modules.access.domain;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import com.klubtool.backend.modules.auth.domain.Permission;
import com.klubtool.backend.modules.group.domain.StructuralRole;

/**
 * Everything access decisions and calendar aggregation need to know about one user, resolved once per request.
 */
public record MembershipContext(
        UUID userId,
        boolean authenticated,
        boolean superuser,
        Set<Permission> permissions,
        List<GroupMembershipView> groupMemberships,
        List<GroupMembershipView> leaderGroups,
        List<GroupMembershipView> adminGroups,
        List<GroupMembershipView> allGroups,
        List<NamedRef> locals,
        List<NamedRef> councils,
        Set<UUID> committeeIds,
        Set<UUID> substituteMeetingIds
) {

    public MembershipContext {
        permissions = permissions == null || permissions.isEmpty()
                ? EnumSet.noneOf(Permission.class) : EnumSet.copyOf(permissions);
        groupMemberships = List.copyOf(groupMemberships);
        leaderGroups = List.copyOf(leaderGroups);
        adminGroups = List.copyOf(adminGroups);
        allGroups = List.copyOf(allGroups);
        locals = List.copyOf(locals);
        councils = List.copyOf(councils);
        committeeIds = Set.copyOf(committeeIds);
        substituteMeetingIds = Set.copyOf(substituteMeetingIds);
    }

    public static MembershipContext anonymous() {
        return new MembershipContext(null, false, false, Set.of(), List.of(), List.of(), List.of(), List.of(),
                List.of(), List.of(), Set.of(), Set.of());
    }

    public boolean hasPermission(Permission permission) {
        return permissions.contains(permission);
    }

    public Set<UUID> memberGroupIds() {
        return groupMemberships.stream().map(GroupMembershipView::groupId).collect(Collectors.toSet());
    }

    public Set<UUID> localIds() {
        return locals.stream().map(NamedRef::id).collect(Collectors.toSet());
    }

    public Set<UUID> councilIds() {
        return councils.stream().map(NamedRef::id).collect(Collectors.toSet());
    }

    public boolean isMemberOf(UUID groupId) {
        return groupId != null && groupMemberships.stream().anyMatch(m -> groupId.equals(m.groupId()));
    }

    public Set<StructuralRole> rolesIn(UUID groupId) {
        Set<StructuralRole> roles = EnumSet.noneOf(StructuralRole.class);
        if (groupId == null) {
            return roles;
        }
        groupMemberships.stream()
                .filter(m -> groupId.equals(m.groupId()))
                .forEach(m -> roles.addAll(m.roles()));
        return roles;
    }
}
