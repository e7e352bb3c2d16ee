package com.klubtool.backend.modules.group.application;

import java.util.List;
import java.util.UUID;

import com.klubtool.backend.global.error.ProblemException;
import com.klubtool.backend.modules.access.application.AccessDecisionService;
import com.klubtool.backend.modules.access.application.MembershipResolver;
import com.klubtool.backend.modules.access.domain.AccessAction;
import com.klubtool.backend.modules.access.domain.AccessTarget;
import com.klubtool.backend.modules.access.domain.ResourceType;
import com.klubtool.backend.modules.auth.domain.PortalUser;
import com.klubtool.backend.modules.auth.infrastructure.persistence.PortalUserRepository;
import com.klubtool.backend.modules.group.domain.GroupMember;
import com.klubtool.backend.modules.group.domain.PoliticalGroup;
import com.klubtool.backend.modules.group.infrastructure.persistence.GroupMemberRepository;
import com.klubtool.backend.modules.group.infrastructure.persistence.PoliticalGroupRepository;
import com.klubtool.backend.modules.group.presentation.dto.GroupMemberRequest;
import com.klubtool.backend.modules.group.presentation.dto.GroupMemberResponse;
import com.klubtool.backend.modules.group.presentation.dto.GroupMemberRolesRequest;
import com.klubtool.backend.modules.group.presentation.dto.UpdateGroupMemberRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Group memberships and their structural roles. Every decision is made against the membership's group.
 */
@Service
@Transactional
public class GroupMemberService {

    private static final Logger log = LoggerFactory.getLogger(GroupMemberService.class);

    private final GroupMemberRepository memberRepository;
    private final PoliticalGroupRepository groupRepository;
    private final PortalUserRepository portalUserRepository;
    private final MembershipResolver membershipResolver;
    private final AccessDecisionService accessDecisionService;

    public GroupMemberService(
            GroupMemberRepository memberRepository,
            PoliticalGroupRepository groupRepository,
            PortalUserRepository portalUserRepository,
            MembershipResolver membershipResolver,
            AccessDecisionService accessDecisionService
    ) {
        this.memberRepository = memberRepository;
        this.groupRepository = groupRepository;
        this.portalUserRepository = portalUserRepository;
        this.membershipResolver = membershipResolver;
        this.accessDecisionService = accessDecisionService;
    }

    @Transactional(readOnly = true)
    public List<GroupMemberResponse> listMembers(UUID groupId) {
        AccessTarget target = AccessTarget.of(ResourceType.GROUP_MEMBER);
        if (groupId != null) {
            target = target.withGroup(groupId);
        }
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.LIST, target);
        List<GroupMember> members = groupId == null
                ? memberRepository.findAllDetailed()
                : memberRepository.findByGroupId(groupId);
        return members.stream().map(GroupMemberService::toResponse).toList();
    }

    @Transactional(readOnly = true)
    public GroupMemberResponse getMember(UUID memberId) {
        GroupMember member = loadMember(memberId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.VIEW, targetOf(member));
        return toResponse(member);
    }

    public GroupMemberResponse addMember(GroupMemberRequest request) {
        PoliticalGroup group = groupRepository.findById(request.groupId())
                .orElseThrow(() -> ProblemException.notFound("GROUP_NOT_FOUND"));
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.CREATE,
                AccessTarget.of(ResourceType.GROUP_MEMBER).withGroup(group.getId()));
        PortalUser user = portalUserRepository.findById(request.userId())
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND"));
        if (memberRepository.existsByGroup_IdAndUser_Id(group.getId(), user.getId())) {
            throw new ProblemException(HttpStatus.CONFLICT, "GROUP_MEMBER_EXISTS");
        }

        GroupMember member = new GroupMember();
        member.setGroup(group);
        member.setUser(user);
        member.replaceRoles(request.roles());
        return toResponse(memberRepository.save(member));
    }

    public GroupMemberResponse updateMember(UUID memberId, UpdateGroupMemberRequest request) {
        GroupMember member = loadMember(memberId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.EDIT, targetOf(member));
        if (request.active() != null) {
            member.setActive(request.active());
        }
        return toResponse(member);
    }

    /**
     * Replaces the structural roles of a membership; an empty set leaves plain membership.
     */
    public GroupMemberResponse replaceRoles(UUID memberId, GroupMemberRolesRequest request) {
        GroupMember member = loadMember(memberId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.EDIT, targetOf(member));
        member.replaceRoles(request.roles());
        log.info("Group member {} now holds roles {}", member.getId(), member.getRoles());
        return toResponse(member);
    }

    public void removeMember(UUID memberId) {
        GroupMember member = loadMember(memberId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.DELETE, targetOf(member));
        memberRepository.delete(member);
    }

    private GroupMember loadMember(UUID memberId) {
        return memberRepository.findDetailedById(memberId)
                .orElseThrow(() -> ProblemException.notFound("GROUP_MEMBER_NOT_FOUND"));
    }

    private static AccessTarget targetOf(GroupMember member) {
        return AccessTarget.of(ResourceType.GROUP_MEMBER).withGroup(member.getGroup().getId());
    }

    private static GroupMemberResponse toResponse(GroupMember member) {
        return new GroupMemberResponse(
                member.getId(),
                member.getGroup().getId(),
                member.getGroup().getName(),
                member.getUser().getId(),
                member.getUser().getFullName(),
                member.getRoles().stream().sorted().toList(),
                member.isActive()
        );
    }
}
