package com.klubtool.backend.modules.access.application;

import static com.klubtool.backend.modules.access.domain.AccessAction.CREATE;
import static com.klubtool.backend.modules.access.domain.AccessAction.DELETE;
import static com.klubtool.backend.modules.access.domain.AccessAction.EDIT;
import static com.klubtool.backend.modules.access.domain.AccessAction.LIST;
import static com.klubtool.backend.modules.access.domain.AccessAction.VIEW;
import static com.klubtool.backend.modules.access.domain.AccessAction.VOTE;
import static com.klubtool.backend.modules.access.domain.VisibilityScope.ANY_COMMITTEE;
import static com.klubtool.backend.modules.access.domain.VisibilityScope.ANY_COUNCIL;
import static com.klubtool.backend.modules.access.domain.VisibilityScope.ANY_GROUP;
import static com.klubtool.backend.modules.access.domain.VisibilityScope.COMMITTEE_MEMBER;
import static com.klubtool.backend.modules.access.domain.VisibilityScope.COUNCIL_REACHABLE;
import static com.klubtool.backend.modules.access.domain.VisibilityScope.GROUP_MEMBER;
import static com.klubtool.backend.modules.access.domain.VisibilityScope.LOCAL_REACHABLE;
import static com.klubtool.backend.modules.access.domain.VisibilityScope.MEETING_SUBSTITUTE;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import com.klubtool.backend.modules.access.domain.AccessAction;
import com.klubtool.backend.modules.access.domain.AccessRule;
import com.klubtool.backend.modules.access.domain.ResourceType;
import com.klubtool.backend.modules.group.domain.StructuralRole;

import org.springframework.stereotype.Component;

/**
 * The portal's access table. Pairs missing from it are denied to everyone but superusers.
 */
@Component
public class AccessPolicy {

    private final Map<ResourceType, Map<AccessAction, AccessRule>> rules = new EnumMap<>(ResourceType.class);

    public AccessPolicy() {
        AccessRule permission = AccessRule.permission();
        AccessRule managing = permission.orStructural(StructuralRole.MANAGING);

        define(ResourceType.USER, AccessRule.restrictedToSuperusers(), permission, permission, permission, permission);
        define(ResourceType.ROLE, AccessRule.restrictedToSuperusers(), AccessRule.restrictedToSuperusers(), AccessRule.restrictedToSuperusers(),
                AccessRule.restrictedToSuperusers(), AccessRule.restrictedToSuperusers());
        define(ResourceType.LOCAL, AccessRule.restrictedToSuperusers(),
                permission.orVisible(LOCAL_REACHABLE), permission, permission, permission);
        define(ResourceType.COUNCIL, permission,
                permission.orVisible(COUNCIL_REACHABLE), permission, permission, permission);
        define(ResourceType.SESSION, permission.orVisible(ANY_COUNCIL),
                permission.orVisible(COUNCIL_REACHABLE), permission, permission, permission);
        define(ResourceType.COMMITTEE, permission,
                permission.orVisible(COMMITTEE_MEMBER, COUNCIL_REACHABLE), permission, permission, permission);
        define(ResourceType.COMMITTEE_MEETING, permission.orVisible(ANY_COMMITTEE),
                permission.orVisible(COMMITTEE_MEMBER, MEETING_SUBSTITUTE, COUNCIL_REACHABLE),
                permission, permission, permission);
        define(ResourceType.GROUP, permission,
                managing.orVisible(GROUP_MEMBER), permission, managing, permission);
        define(ResourceType.GROUP_MEMBER, permission, permission, permission, managing, permission);
        define(ResourceType.GROUP_MEETING, permission.orVisible(ANY_GROUP),
                managing.orVisible(GROUP_MEMBER), managing, managing, managing);

        AccessRule groupContent = permission.orVisible(GROUP_MEMBER);
        for (ResourceType motionLike : new ResourceType[] {ResourceType.MOTION, ResourceType.INQUIRY}) {
            define(motionLike, permission.orVisible(ANY_GROUP), groupContent,
                    permission.orVisible(GROUP_MEMBER, COUNCIL_REACHABLE), groupContent, permission);
        }
        rules.get(ResourceType.MOTION).put(VOTE, permission);
    }

    public Optional<AccessRule> ruleFor(ResourceType resource, AccessAction action) {
        return Optional.ofNullable(rules.getOrDefault(resource, Collections.emptyMap()).get(action));
    }

    private void define(ResourceType resource, AccessRule list, AccessRule view, AccessRule create,
                        AccessRule edit, AccessRule delete) {
        Map<AccessAction, AccessRule> byAction = new EnumMap<>(AccessAction.class);
        byAction.put(LIST, list);
        byAction.put(VIEW, view);
        byAction.put(CREATE, create);
        byAction.put(EDIT, edit);
        byAction.put(DELETE, delete);
        rules.put(resource, byAction);
    }
}
