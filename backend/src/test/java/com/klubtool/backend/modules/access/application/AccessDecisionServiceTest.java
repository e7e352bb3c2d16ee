package com.klubtool.backend.modules.access.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.klubtool.backend.global.error.ProblemException;
import com.klubtool.backend.modules.access.domain.AccessAction;
import com.klubtool.backend.modules.access.domain.AccessTarget;
import com.klubtool.backend.modules.access.domain.GroupMembershipView;
import com.klubtool.backend.modules.access.domain.MembershipContext;
import com.klubtool.backend.modules.access.domain.NamedRef;
import com.klubtool.backend.modules.access.domain.ResourceType;
import com.klubtool.backend.modules.auth.domain.Permission;
import com.klubtool.backend.modules.group.domain.StructuralRole;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class AccessDecisionServiceTest {

    private static final UUID USER_ID = UUID.randomUUID();
    private static final UUID GROUP_ID = UUID.randomUUID();
    private static final UUID OTHER_GROUP_ID = UUID.randomUUID();
    private static final UUID COUNCIL_ID = UUID.randomUUID();

    private final AccessDecisionService service = new AccessDecisionService(new AccessPolicy());

    @Test
    @DisplayName("anonymous users are denied everything")
    void anonymousDenied() {
        AccessTarget target = AccessTarget.of(ResourceType.MOTION).withGroup(GROUP_ID);

        assertThat(service.can(MembershipContext.anonymous(), AccessAction.VIEW, target)).isFalse();
        assertThat(service.can(null, AccessAction.VIEW, target)).isFalse();
        assertThat(service.hasGlobalAccess(MembershipContext.anonymous(), AccessAction.LIST, target)).isFalse();
    }

    @Test
    @DisplayName("superusers pass every rule including superuser-only ones")
    void superuserAllowed() {
        MembershipContext superuser = context(true, Set.of(), List.of(), List.of());

        assertThat(service.can(superuser, AccessAction.DELETE, AccessTarget.of(ResourceType.ROLE))).isTrue();
        assertThat(service.can(superuser, AccessAction.LIST, AccessTarget.of(ResourceType.USER))).isTrue();
        assertThat(service.hasGlobalAccess(superuser, AccessAction.LIST, AccessTarget.of(ResourceType.MOTION)))
                .isTrue();
    }

    @Test
    @DisplayName("superuser-only rules ignore permissions")
    void superuserOnlyIgnoresPermissions() {
        MembershipContext context = context(false, EnumSet.allOf(Permission.class), List.of(), List.of());

        assertThat(service.can(context, AccessAction.VIEW, AccessTarget.of(ResourceType.ROLE))).isFalse();
        assertThat(service.can(context, AccessAction.LIST, AccessTarget.of(ResourceType.USER))).isFalse();
        assertThat(service.can(context, AccessAction.VIEW, AccessTarget.of(ResourceType.USER))).isTrue();
    }

    @Test
    @DisplayName("a view permission grants listing and global access")
    void viewPermissionGrantsListing() {
        MembershipContext context = context(false, Set.of(Permission.MOTION_VIEW), List.of(), List.of());
        AccessTarget inquiries = AccessTarget.of(ResourceType.INQUIRY);

        assertThat(service.can(context, AccessAction.LIST, inquiries)).isTrue();
        assertThat(service.hasGlobalAccess(context, AccessAction.LIST, inquiries)).isTrue();
        assertThat(service.can(context, AccessAction.EDIT, inquiries.withGroup(GROUP_ID))).isFalse();
    }

    @Test
    @DisplayName("structural roles grant authority only inside their own group")
    void structuralRoleScopedToGroup() {
        MembershipContext leader = context(false, Set.of(),
                List.of(membership(GROUP_ID, StructuralRole.LEADER)), List.of());
        AccessTarget ownMeeting = AccessTarget.of(ResourceType.GROUP_MEETING).withGroup(GROUP_ID);
        AccessTarget otherMeeting = AccessTarget.of(ResourceType.GROUP_MEETING).withGroup(OTHER_GROUP_ID);

        assertThat(service.can(leader, AccessAction.EDIT, ownMeeting)).isTrue();
        assertThat(service.can(leader, AccessAction.EDIT, otherMeeting)).isFalse();
        assertThat(service.hasGlobalAccess(leader, AccessAction.LIST, ownMeeting)).isFalse();
    }

    @Test
    @DisplayName("plain members may view but not manage group content")
    void plainMemberVisibility() {
        MembershipContext member = context(false, Set.of(),
                List.of(membership(GROUP_ID, StructuralRole.MEMBER)), List.of());

        assertThat(service.can(member, AccessAction.VIEW,
                AccessTarget.of(ResourceType.MOTION).withGroup(GROUP_ID))).isTrue();
        assertThat(service.can(member, AccessAction.VIEW,
                AccessTarget.of(ResourceType.MOTION).withGroup(OTHER_GROUP_ID))).isFalse();
        assertThat(service.can(member, AccessAction.LIST, AccessTarget.of(ResourceType.MOTION))).isTrue();
        assertThat(service.can(member, AccessAction.EDIT,
                AccessTarget.of(ResourceType.GROUP_MEETING).withGroup(GROUP_ID))).isFalse();
        assertThat(service.can(member, AccessAction.DELETE,
                AccessTarget.of(ResourceType.MOTION).withGroup(GROUP_ID))).isFalse();
    }

    @Test
    @DisplayName("council reachability grants session visibility")
    void councilReachability() {
        MembershipContext context = context(false, Set.of(), List.of(),
                List.of(new NamedRef(COUNCIL_ID, "Gemeinderat")));

        assertThat(service.can(context, AccessAction.LIST, AccessTarget.of(ResourceType.SESSION))).isTrue();
        assertThat(service.can(context, AccessAction.VIEW,
                AccessTarget.of(ResourceType.SESSION).withCouncil(COUNCIL_ID))).isTrue();
        assertThat(service.can(context, AccessAction.VIEW,
                AccessTarget.of(ResourceType.SESSION).withCouncil(UUID.randomUUID()))).isFalse();
        assertThat(service.can(context, AccessAction.LIST, AccessTarget.of(ResourceType.COMMITTEE))).isFalse();
    }

    @Test
    @DisplayName("require throws the uniform forbidden problem")
    void requireThrowsUniformForbidden() {
        MembershipContext member = context(false, Set.of(), List.of(), List.of());

        assertThatThrownBy(() -> service.require(member, AccessAction.VIEW,
                AccessTarget.of(ResourceType.MOTION).withGroup(GROUP_ID)))
                .isInstanceOfSatisfying(ProblemException.class, problem -> {
                    assertThat(problem.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
                    assertThat(problem.getCode()).isEqualTo(ProblemException.FORBIDDEN);
                    assertThat(problem.getDetailMessage()).isEqualTo(ProblemException.FORBIDDEN);
                });
    }

    private static GroupMembershipView membership(UUID groupId, StructuralRole role) {
        return new GroupMembershipView(UUID.randomUUID(), groupId, "Klub", EnumSet.of(role), null, null);
    }

    private static MembershipContext context(boolean superuser, Set<Permission> permissions,
                                             List<GroupMembershipView> memberships, List<NamedRef> councils) {
        return new MembershipContext(USER_ID, true, superuser, permissions, memberships, List.of(), List.of(),
                List.of(), List.of(), councils, Set.of(), Set.of());
    }
}
