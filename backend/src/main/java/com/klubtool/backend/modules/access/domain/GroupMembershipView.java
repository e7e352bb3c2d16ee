package com.klubtool.backend.modules.access.domain;

import java.util.Collections;
import java.util.Set;
import java.util.UUID;

import com.klubtool.backend.modules.group.domain.StructuralRole;

/**
 * One active group membership with the structural roles held in it and the local/council it reaches.
 * {@code localId} and {@code councilId} are null when the chain breaks (no party, no local, no council).
 */
public record GroupMembershipView(
        UUID membershipId,
        UUID groupId,
        String groupName,
        Set<StructuralRole> roles,
        UUID localId,
        UUID councilId
) {

    public GroupMembershipView {
        roles = roles == null ? Set.of() : Collections.unmodifiableSet(roles);
    }

    public boolean holdsAny(Set<StructuralRole> candidates) {
        return roles.stream().anyMatch(candidates::contains);
    }
}
