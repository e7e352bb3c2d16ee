package com.klubtool.backend.modules.access.application;

import static org.assertj.core.api.Assertions.assertThat;

import com.klubtool.backend.modules.access.domain.AccessAction;
import com.klubtool.backend.modules.access.domain.AccessRule;
import com.klubtool.backend.modules.access.domain.ResourceType;
import com.klubtool.backend.modules.access.domain.VisibilityScope;
import com.klubtool.backend.modules.group.domain.StructuralRole;

import org.junit.jupiter.api.Test;

class AccessPolicyTest {

    private final AccessPolicy policy = new AccessPolicy();

    @Test
    void everyResourceActionPairHasARule() {
        for (ResourceType resource : ResourceType.values()) {
            for (AccessAction action : AccessAction.CRUD) {
                assertThat(policy.ruleFor(resource, action))
                        .as("%s %s", resource, action)
                        .isPresent();
            }
        }
    }

    @Test
    void roleManagementIsSuperuserOnly() {
        for (AccessAction action : AccessAction.CRUD) {
            assertThat(policy.ruleFor(ResourceType.ROLE, action)).get()
                    .extracting(AccessRule::superuserOnly).isEqualTo(true);
        }
    }

    @Test
    void groupMeetingsAreManagedByLeadershipAndAdmins() {
        AccessRule edit = policy.ruleFor(ResourceType.GROUP_MEETING, AccessAction.EDIT).orElseThrow();

        assertThat(edit.structuralRoles()).containsExactlyInAnyOrderElementsOf(StructuralRole.MANAGING);
        assertThat(edit.visibilityScopes()).isEmpty();
    }

    @Test
    void motionCreationFollowsGroupOrCouncil() {
        AccessRule create = policy.ruleFor(ResourceType.MOTION, AccessAction.CREATE).orElseThrow();

        assertThat(create.permissionGrants()).isTrue();
        assertThat(create.visibilityScopes())
                .containsExactlyInAnyOrder(VisibilityScope.GROUP_MEMBER, VisibilityScope.COUNCIL_REACHABLE);
    }

    @Test
    void votingIsGrantedByPermissionOnMotionsOnly() {
        AccessRule vote = policy.ruleFor(ResourceType.MOTION, AccessAction.VOTE).orElseThrow();

        assertThat(vote.permissionGrants()).isTrue();
        assertThat(vote.structuralRoles()).isEmpty();
        assertThat(vote.visibilityScopes()).isEmpty();
        assertThat(policy.ruleFor(ResourceType.INQUIRY, AccessAction.VOTE)).isEmpty();
    }
}
