package com.klubtool.backend.modules.auth.presentation.dto;

import java.util.List;
import java.util.UUID;

import com.klubtool.backend.modules.access.domain.GroupMembershipView;
import com.klubtool.backend.modules.access.domain.MembershipContext;
import com.klubtool.backend.modules.access.domain.NamedRef;
import com.klubtool.backend.modules.group.domain.StructuralRole;

public record MembershipOverviewResponse(
        List<Membership> groupMemberships,
        List<Membership> leaderGroups,
        List<Membership> adminGroups,
        List<Membership> allGroups,
        List<NamedRef> locals,
        List<NamedRef> councils
) {

    public record Membership(UUID membershipId, UUID groupId, String groupName, List<StructuralRole> roles) {

        static Membership from(GroupMembershipView view) {
            return new Membership(view.membershipId(), view.groupId(), view.groupName(),
                    view.roles().stream().sorted().toList());
        }
    }

    public static MembershipOverviewResponse from(MembershipContext context) {
        return new MembershipOverviewResponse(
                context.groupMemberships().stream().map(Membership::from).toList(),
                context.leaderGroups().stream().map(Membership::from).toList(),
                context.adminGroups().stream().map(Membership::from).toList(),
                context.allGroups().stream().map(Membership::from).toList(),
                context.locals(),
                context.councils()
        );
    }
}
