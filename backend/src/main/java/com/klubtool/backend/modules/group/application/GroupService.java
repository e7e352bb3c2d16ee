package com.klubtool.backend.modules.group.application;

import static com.klubtool.backend.global.common.TextValues.trimToNull;

import java.util.List;
import java.util.UUID;

import com.klubtool.backend.global.error.ProblemException;
import com.klubtool.backend.modules.access.application.AccessDecisionService;
import com.klubtool.backend.modules.access.application.MembershipResolver;
import com.klubtool.backend.modules.access.domain.AccessAction;
import com.klubtool.backend.modules.access.domain.AccessTarget;
import com.klubtool.backend.modules.access.domain.ResourceType;
import com.klubtool.backend.modules.group.domain.PoliticalGroup;
import com.klubtool.backend.modules.group.infrastructure.persistence.PoliticalGroupRepository;
import com.klubtool.backend.modules.group.presentation.dto.GroupRequest;
import com.klubtool.backend.modules.group.presentation.dto.GroupResponse;
import com.klubtool.backend.modules.group.presentation.dto.UpdateGroupRequest;
import com.klubtool.backend.modules.local.domain.Party;
import com.klubtool.backend.modules.local.infrastructure.persistence.PartyRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class GroupService {

    private final PoliticalGroupRepository groupRepository;
    private final PartyRepository partyRepository;
    private final MembershipResolver membershipResolver;
    private final AccessDecisionService accessDecisionService;

    public GroupService(
            PoliticalGroupRepository groupRepository,
            PartyRepository partyRepository,
            MembershipResolver membershipResolver,
            AccessDecisionService accessDecisionService
    ) {
        this.groupRepository = groupRepository;
        this.partyRepository = partyRepository;
        this.membershipResolver = membershipResolver;
        this.accessDecisionService = accessDecisionService;
    }

    @Transactional(readOnly = true)
    public List<GroupResponse> listGroups() {
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.LIST,
                AccessTarget.of(ResourceType.GROUP));
        return groupRepository.findAllOrderByName().stream().map(GroupService::toResponse).toList();
    }

    @Transactional(readOnly = true)
    public GroupResponse getGroup(UUID groupId) {
        PoliticalGroup group = loadGroup(groupId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.VIEW, targetOf(group));
        return toResponse(group);
    }

    public GroupResponse createGroup(GroupRequest request) {
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.CREATE,
                AccessTarget.of(ResourceType.GROUP));
        PoliticalGroup group = new PoliticalGroup();
        group.setName(request.name().trim());
        group.setShortName(trimToNull(request.shortName()));
        group.setCalendarBadgeName(trimToNull(request.calendarBadgeName()));
        if (request.partyId() != null) {
            group.setParty(loadParty(request.partyId()));
        }
        return toResponse(groupRepository.save(group));
    }

    /**
     * Leaders, deputies and group admins may edit their own group.
     */
    public GroupResponse updateGroup(UUID groupId, UpdateGroupRequest request) {
        PoliticalGroup group = loadGroup(groupId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.EDIT, targetOf(group));

        if (request.name() != null) {
            group.setName(request.name().trim());
        }
        if (request.shortName() != null) {
            group.setShortName(trimToNull(request.shortName()));
        }
        if (request.partyId() != null) {
            group.setParty(loadParty(request.partyId()));
        }
        if (request.calendarBadgeName() != null) {
            group.setCalendarBadgeName(trimToNull(request.calendarBadgeName()));
        }
        if (request.active() != null) {
            group.setActive(request.active());
        }
        return toResponse(group);
    }

    public void deleteGroup(UUID groupId) {
        PoliticalGroup group = loadGroup(groupId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.DELETE, targetOf(group));
        groupRepository.delete(group);
    }

    private PoliticalGroup loadGroup(UUID groupId) {
        return groupRepository.findWithChainById(groupId)
                .orElseThrow(() -> ProblemException.notFound("GROUP_NOT_FOUND"));
    }

    private Party loadParty(UUID partyId) {
        return partyRepository.findById(partyId)
                .orElseThrow(() -> ProblemException.notFound("PARTY_NOT_FOUND"));
    }

    private static AccessTarget targetOf(PoliticalGroup group) {
        AccessTarget target = AccessTarget.of(ResourceType.GROUP).withGroup(group.getId());
        Party party = group.getParty();
        return party != null && party.getLocal() != null ? target.withLocal(party.getLocal().getId()) : target;
    }

    private static GroupResponse toResponse(PoliticalGroup group) {
        Party party = group.getParty();
        return new GroupResponse(
                group.getId(),
                group.getName(),
                group.getShortName(),
                party == null ? null : party.getId(),
                party == null ? null : party.getName(),
                party == null || party.getLocal() == null ? null : party.getLocal().getId(),
                group.getCalendarBadgeName(),
                group.isActive()
        );
    }
}
