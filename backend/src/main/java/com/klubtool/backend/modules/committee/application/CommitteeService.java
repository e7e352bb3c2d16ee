package com.klubtool.backend.modules.committee.application;

import static com.klubtool.backend.global.common.TextValues.trimToNull;

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
import com.klubtool.backend.modules.committee.domain.Committee;
import com.klubtool.backend.modules.committee.domain.CommitteeMember;
import com.klubtool.backend.modules.committee.domain.CommitteeRole;
import com.klubtool.backend.modules.committee.domain.CommitteeType;
import com.klubtool.backend.modules.committee.infrastructure.persistence.CommitteeMemberRepository;
import com.klubtool.backend.modules.committee.infrastructure.persistence.CommitteeRepository;
import com.klubtool.backend.modules.committee.presentation.dto.CommitteeMemberRequest;
import com.klubtool.backend.modules.committee.presentation.dto.CommitteeMemberResponse;
import com.klubtool.backend.modules.committee.presentation.dto.CommitteeRequest;
import com.klubtool.backend.modules.committee.presentation.dto.CommitteeResponse;
import com.klubtool.backend.modules.committee.presentation.dto.UpdateCommitteeRequest;
import com.klubtool.backend.modules.local.domain.Council;
import com.klubtool.backend.modules.local.infrastructure.persistence.CouncilRepository;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Committees of a council and their standing membership. Members follow the access rules of the committee.
 */
@Service
@Transactional
public class CommitteeService {

    private final CommitteeRepository committeeRepository;
    private final CommitteeMemberRepository memberRepository;
    private final CouncilRepository councilRepository;
    private final PortalUserRepository portalUserRepository;
    private final MembershipResolver membershipResolver;
    private final AccessDecisionService accessDecisionService;

    public CommitteeService(
            CommitteeRepository committeeRepository,
            CommitteeMemberRepository memberRepository,
            CouncilRepository councilRepository,
            PortalUserRepository portalUserRepository,
            MembershipResolver membershipResolver,
            AccessDecisionService accessDecisionService
    ) {
        this.committeeRepository = committeeRepository;
        this.memberRepository = memberRepository;
        this.councilRepository = councilRepository;
        this.portalUserRepository = portalUserRepository;
        this.membershipResolver = membershipResolver;
        this.accessDecisionService = accessDecisionService;
    }

    @Transactional(readOnly = true)
    public List<CommitteeResponse> listCommittees() {
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.LIST,
                AccessTarget.of(ResourceType.COMMITTEE));
        return committeeRepository.findAllOrderByName().stream().map(this::toResponse).toList();
    }

    @Transactional(readOnly = true)
    public CommitteeResponse getCommittee(UUID committeeId) {
        Committee committee = loadCommittee(committeeId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.VIEW, targetOf(committee));
        return toResponse(committee);
    }

    public CommitteeResponse createCommittee(CommitteeRequest request) {
        Council council = councilRepository.findById(request.councilId())
                .orElseThrow(() -> ProblemException.notFound("COUNCIL_NOT_FOUND"));
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.CREATE,
                AccessTarget.of(ResourceType.COMMITTEE).withCouncil(council.getId()));

        Committee committee = new Committee();
        committee.setName(request.name().trim());
        committee.setAbbreviation(trimToNull(request.abbreviation()));
        committee.setCouncil(council);
        committee.setCommitteeType(request.committeeType() == null ? CommitteeType.AUSSCHUSS : request.committeeType());
        committee.setDescription(trimToNull(request.description()));
        return toResponse(committeeRepository.save(committee));
    }

    public CommitteeResponse updateCommittee(UUID committeeId, UpdateCommitteeRequest request) {
        Committee committee = loadCommittee(committeeId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.EDIT, targetOf(committee));

        if (request.name() != null) {
            committee.setName(request.name().trim());
        }
        if (request.abbreviation() != null) {
            committee.setAbbreviation(trimToNull(request.abbreviation()));
        }
        if (request.committeeType() != null) {
            committee.setCommitteeType(request.committeeType());
        }
        if (request.description() != null) {
            committee.setDescription(trimToNull(request.description()));
        }
        if (request.active() != null) {
            committee.setActive(request.active());
        }
        return toResponse(committee);
    }

    public void deleteCommittee(UUID committeeId) {
        Committee committee = loadCommittee(committeeId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.DELETE,
                targetOf(committee));
        committeeRepository.delete(committee);
    }

    @Transactional(readOnly = true)
    public List<CommitteeMemberResponse> listMembers(UUID committeeId) {
        Committee committee = loadCommittee(committeeId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.VIEW, targetOf(committee));
        return memberRepository.findByCommittee_IdOrderByRoleAsc(committee.getId()).stream()
                .map(CommitteeService::toResponse)
                .toList();
    }

    public CommitteeMemberResponse addMember(UUID committeeId, CommitteeMemberRequest request) {
        Committee committee = loadCommittee(committeeId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.EDIT, targetOf(committee));
        PortalUser user = portalUserRepository.findById(request.userId())
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND"));
        if (memberRepository.existsByCommittee_IdAndUser_Id(committee.getId(), user.getId())) {
            throw new ProblemException(HttpStatus.CONFLICT, "COMMITTEE_MEMBER_EXISTS");
        }

        CommitteeMember member = new CommitteeMember();
        member.setCommittee(committee);
        member.setUser(user);
        member.setRole(request.role() == null ? CommitteeRole.MEMBER : request.role());
        return toResponse(memberRepository.save(member));
    }

    public void removeMember(UUID committeeId, UUID memberId) {
        Committee committee = loadCommittee(committeeId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.EDIT, targetOf(committee));
        CommitteeMember member = memberRepository.findById(memberId)
                .filter(candidate -> candidate.getCommittee().getId().equals(committee.getId()))
                .orElseThrow(() -> ProblemException.notFound("COMMITTEE_MEMBER_NOT_FOUND"));
        memberRepository.delete(member);
    }

    private Committee loadCommittee(UUID committeeId) {
        return committeeRepository.findWithCouncilById(committeeId)
                .orElseThrow(() -> ProblemException.notFound("COMMITTEE_NOT_FOUND"));
    }

    private static AccessTarget targetOf(Committee committee) {
        return AccessTarget.of(ResourceType.COMMITTEE)
                .withCommittee(committee.getId())
                .withCouncil(committee.getCouncil().getId());
    }

    private CommitteeResponse toResponse(Committee committee) {
        return new CommitteeResponse(
                committee.getId(),
                committee.getName(),
                committee.getAbbreviation(),
                committee.getCouncil().getId(),
                committee.getCouncil().getName(),
                committee.getCommitteeType(),
                committee.getCommitteeType().getLabel(),
                committee.getDescription(),
                committee.isActive()
        );
    }

    private static CommitteeMemberResponse toResponse(CommitteeMember member) {
        return new CommitteeMemberResponse(
                member.getId(),
                member.getCommittee().getId(),
                member.getUser().getId(),
                member.getUser().getFullName(),
                member.getRole(),
                member.isActive()
        );
    }
}
