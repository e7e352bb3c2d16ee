package com.klubtool.backend.modules.motion.application;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.klubtool.backend.global.error.ProblemException;
import com.klubtool.backend.modules.access.application.AccessDecisionService;
import com.klubtool.backend.modules.access.application.MembershipResolver;
import com.klubtool.backend.modules.access.domain.AccessAction;
import com.klubtool.backend.modules.access.domain.AccessTarget;
import com.klubtool.backend.modules.access.domain.MembershipContext;
import com.klubtool.backend.modules.auth.domain.PortalUser;
import com.klubtool.backend.modules.council.domain.CouncilSession;
import com.klubtool.backend.modules.council.infrastructure.persistence.CouncilSessionRepository;
import com.klubtool.backend.modules.group.domain.PoliticalGroup;
import com.klubtool.backend.modules.group.infrastructure.persistence.PoliticalGroupRepository;
import com.klubtool.backend.modules.motion.domain.Motion;
import com.klubtool.backend.modules.motion.domain.MotionKind;
import com.klubtool.backend.modules.motion.domain.MotionStatus;
import com.klubtool.backend.modules.motion.domain.MotionVote;
import com.klubtool.backend.modules.motion.domain.VoteChoice;
import com.klubtool.backend.modules.motion.infrastructure.persistence.MotionRepository;
import com.klubtool.backend.modules.motion.infrastructure.persistence.MotionVoteCount;
import com.klubtool.backend.modules.motion.infrastructure.persistence.MotionVoteRepository;
import com.klubtool.backend.modules.motion.presentation.dto.MotionRequest;
import com.klubtool.backend.modules.motion.presentation.dto.MotionResponse;
import com.klubtool.backend.modules.motion.presentation.dto.UpdateMotionRequest;
import com.klubtool.backend.modules.motion.presentation.dto.VoteRequest;
import com.klubtool.backend.modules.motion.presentation.dto.VoteTally;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Motions and inquiries. Both kinds share storage and rules; every call names the kind it operates on, and a
 * row of the other kind is reported as not found.
 */
@Service
@Transactional
public class MotionService {

    private static final Logger log = LoggerFactory.getLogger(MotionService.class);

    private final MotionRepository motionRepository;
    private final MotionVoteRepository voteRepository;
    private final CouncilSessionRepository sessionRepository;
    private final PoliticalGroupRepository groupRepository;
    private final MembershipResolver membershipResolver;
    private final AccessDecisionService accessDecisionService;

    public MotionService(
            MotionRepository motionRepository,
            MotionVoteRepository voteRepository,
            CouncilSessionRepository sessionRepository,
            PoliticalGroupRepository groupRepository,
            MembershipResolver membershipResolver,
            AccessDecisionService accessDecisionService
    ) {
        this.motionRepository = motionRepository;
        this.voteRepository = voteRepository;
        this.sessionRepository = sessionRepository;
        this.groupRepository = groupRepository;
        this.membershipResolver = membershipResolver;
        this.accessDecisionService = accessDecisionService;
    }

    @Transactional(readOnly = true)
    public List<MotionResponse> list(MotionKind kind) {
        MembershipContext context = membershipResolver.resolveCurrentUser();
        AccessTarget target = AccessTarget.of(kind.resourceType());
        List<Motion> motions;
        if (accessDecisionService.hasGlobalAccess(context, AccessAction.LIST, target)) {
            motions = motionRepository.findAllByKind(kind);
        } else {
            accessDecisionService.require(context, AccessAction.LIST, target);
            Set<UUID> groupIds = context.memberGroupIds();
            motions = groupIds.isEmpty() ? List.of() : motionRepository.findByKindAndGroupIds(kind, groupIds);
        }
        Map<UUID, VoteTally> tallies = talliesFor(motions.stream().map(Motion::getId).toList());
        return motions.stream()
                .map(motion -> toResponse(motion, tallies.getOrDefault(motion.getId(), VoteTally.EMPTY)))
                .toList();
    }

    @Transactional(readOnly = true)
    public MotionResponse get(MotionKind kind, UUID motionId) {
        Motion motion = load(kind, motionId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.VIEW, targetOf(motion));
        return toResponse(motion, tallyOf(motion));
    }

    /**
     * Members of the submitting group may file, as may anyone reaching the session's council.
     */
    public MotionResponse create(MotionKind kind, MotionRequest request) {
        CouncilSession session = sessionRepository.findDetailedById(request.sessionId())
                .orElseThrow(() -> ProblemException.notFound("SESSION_NOT_FOUND"));
        PoliticalGroup group = groupRepository.findById(request.groupId())
                .orElseThrow(() -> ProblemException.notFound("GROUP_NOT_FOUND"));
        PortalUser submitter = membershipResolver.findCurrentUser().orElseThrow(ProblemException::forbidden);
        accessDecisionService.require(membershipResolver.resolve(submitter), AccessAction.CREATE,
                AccessTarget.of(kind.resourceType())
                        .withGroup(group.getId())
                        .withCouncil(session.getCouncil().getId()));

        Motion motion = new Motion(kind);
        motion.setTitle(request.title().trim());
        motion.setText(request.text());
        motion.setSession(session);
        motion.setGroup(group);
        motion.setStatus(request.status() == null ? MotionStatus.DRAFT : request.status());
        motion.setSubmittedBy(submitter);
        return toResponse(motionRepository.save(motion), VoteTally.EMPTY);
    }

    public MotionResponse update(MotionKind kind, UUID motionId, UpdateMotionRequest request) {
        Motion motion = load(kind, motionId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.EDIT, targetOf(motion));

        if (request.title() != null) {
            motion.setTitle(request.title().trim());
        }
        if (request.text() != null) {
            motion.setText(request.text());
        }
        if (request.status() != null) {
            motion.setStatus(request.status());
        }
        if (request.active() != null) {
            motion.setActive(request.active());
        }
        return toResponse(motion, tallyOf(motion));
    }

    /**
     * Records or replaces the caller's vote. Voters must be able to see the motion and hold {@code motion.vote}.
     */
    public MotionResponse vote(UUID motionId, VoteRequest request) {
        Motion motion = load(MotionKind.MOTION, motionId);
        PortalUser voter = membershipResolver.findCurrentUser().orElseThrow(ProblemException::forbidden);
        MembershipContext context = membershipResolver.resolve(voter);
        AccessTarget target = targetOf(motion);
        accessDecisionService.require(context, AccessAction.VIEW, target);
        accessDecisionService.require(context, AccessAction.VOTE, target);

        MotionVote vote = voteRepository.findByMotionIdAndVoterId(motion.getId(), voter.getId())
                .orElseGet(() -> new MotionVote(motion, voter));
        vote.setChoice(request.choice());
        vote.setReason(request.reason());
        voteRepository.saveAndFlush(vote);
        log.info("Vote {} on motion {} recorded for {}", request.choice(), motion.getId(), voter.getId());
        return toResponse(motion, tallyOf(motion));
    }

    public void delete(MotionKind kind, UUID motionId) {
        Motion motion = load(kind, motionId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.DELETE, targetOf(motion));
        motionRepository.delete(motion);
    }

    private VoteTally tallyOf(Motion motion) {
        return talliesFor(List.of(motion.getId())).getOrDefault(motion.getId(), VoteTally.EMPTY);
    }

    private Map<UUID, VoteTally> talliesFor(List<UUID> motionIds) {
        if (motionIds.isEmpty()) {
            return Map.of();
        }
        Map<UUID, Map<VoteChoice, Long>> counts = new HashMap<>();
        for (MotionVoteCount row : voteRepository.countByChoice(motionIds)) {
            counts.computeIfAbsent(row.motionId(), id -> new EnumMap<>(VoteChoice.class))
                    .put(row.choice(), row.count());
        }
        Map<UUID, VoteTally> tallies = new HashMap<>();
        counts.forEach((id, byChoice) -> tallies.put(id, VoteTally.of(byChoice)));
        return tallies;
    }

    private Motion load(MotionKind kind, UUID motionId) {
        return motionRepository.findDetailedById(motionId, kind)
                .orElseThrow(() -> ProblemException.notFound(kind.notFoundCode()));
    }

    private static AccessTarget targetOf(Motion motion) {
        return AccessTarget.of(motion.getKind().resourceType())
                .withGroup(motion.getGroup().getId())
                .withCouncil(motion.getSession().getCouncil().getId());
    }

    private static MotionResponse toResponse(Motion motion, VoteTally votes) {
        CouncilSession session = motion.getSession();
        PortalUser submitter = motion.getSubmittedBy();
        return new MotionResponse(
                motion.getId(),
                motion.getKind(),
                motion.getTitle(),
                motion.getText(),
                motion.getStatus(),
                session.getId(),
                session.getTitle(),
                session.getCouncil().getId(),
                motion.getGroup().getId(),
                motion.getGroup().getName(),
                submitter == null ? null : submitter.getId(),
                submitter == null ? null : submitter.getFullName(),
                motion.isActive(),
                votes,
                motion.getCreatedAt()
        );
    }
}
