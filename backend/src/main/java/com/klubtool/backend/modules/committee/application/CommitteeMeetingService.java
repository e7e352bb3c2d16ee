package com.klubtool.backend.modules.committee.application;

import static com.klubtool.backend.global.common.TextValues.trimToNull;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.klubtool.backend.global.error.ProblemException;
import com.klubtool.backend.modules.access.application.AccessDecisionService;
import com.klubtool.backend.modules.access.application.MembershipResolver;
import com.klubtool.backend.modules.access.domain.AccessAction;
import com.klubtool.backend.modules.access.domain.AccessTarget;
import com.klubtool.backend.modules.access.domain.MembershipContext;
import com.klubtool.backend.modules.access.domain.ResourceType;
import com.klubtool.backend.modules.calendar.application.CalendarEventMapper;
import com.klubtool.backend.modules.calendar.application.IcsCalendarWriter;
import com.klubtool.backend.modules.calendar.application.IcsRenderContext;
import com.klubtool.backend.modules.committee.domain.Committee;
import com.klubtool.backend.modules.committee.domain.CommitteeMeeting;
import com.klubtool.backend.modules.committee.domain.CommitteeMember;
import com.klubtool.backend.modules.committee.domain.CommitteeParticipationSubstitute;
import com.klubtool.backend.modules.committee.infrastructure.persistence.CommitteeMeetingRepository;
import com.klubtool.backend.modules.committee.infrastructure.persistence.CommitteeMemberRepository;
import com.klubtool.backend.modules.committee.infrastructure.persistence.CommitteeParticipationSubstituteRepository;
import com.klubtool.backend.modules.committee.infrastructure.persistence.CommitteeRepository;
import com.klubtool.backend.modules.committee.presentation.dto.CommitteeMeetingRequest;
import com.klubtool.backend.modules.committee.presentation.dto.CommitteeMeetingResponse;
import com.klubtool.backend.modules.committee.presentation.dto.ReplaceSubstitutesRequest;
import com.klubtool.backend.modules.committee.presentation.dto.SubstituteAssignment;
import com.klubtool.backend.modules.committee.presentation.dto.SubstituteResponse;
import com.klubtool.backend.modules.committee.presentation.dto.UpdateCommitteeMeetingRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class CommitteeMeetingService {

    private static final Logger log = LoggerFactory.getLogger(CommitteeMeetingService.class);
    private static final String SUBSTITUTE_CONFLICT = "SUBSTITUTE_CONFLICT";

    private final CommitteeMeetingRepository meetingRepository;
    private final CommitteeRepository committeeRepository;
    private final CommitteeMemberRepository memberRepository;
    private final CommitteeParticipationSubstituteRepository substituteRepository;
    private final MembershipResolver membershipResolver;
    private final AccessDecisionService accessDecisionService;
    private final CalendarEventMapper calendarEventMapper;
    private final IcsCalendarWriter icsCalendarWriter;

    public CommitteeMeetingService(
            CommitteeMeetingRepository meetingRepository,
            CommitteeRepository committeeRepository,
            CommitteeMemberRepository memberRepository,
            CommitteeParticipationSubstituteRepository substituteRepository,
            MembershipResolver membershipResolver,
            AccessDecisionService accessDecisionService,
            CalendarEventMapper calendarEventMapper,
            IcsCalendarWriter icsCalendarWriter
    ) {
        this.meetingRepository = meetingRepository;
        this.committeeRepository = committeeRepository;
        this.memberRepository = memberRepository;
        this.substituteRepository = substituteRepository;
        this.membershipResolver = membershipResolver;
        this.accessDecisionService = accessDecisionService;
        this.calendarEventMapper = calendarEventMapper;
        this.icsCalendarWriter = icsCalendarWriter;
    }

    @Transactional(readOnly = true)
    public List<CommitteeMeetingResponse> listMeetings() {
        MembershipContext context = membershipResolver.resolveCurrentUser();
        AccessTarget target = AccessTarget.of(ResourceType.COMMITTEE_MEETING);
        List<CommitteeMeeting> meetings;
        if (accessDecisionService.hasGlobalAccess(context, AccessAction.LIST, target)) {
            meetings = meetingRepository.findAllOrderByScheduledAtDesc();
        } else {
            accessDecisionService.require(context, AccessAction.LIST, target);
            meetings = meetingRepository.findVisible(context.committeeIds(), context.substituteMeetingIds(),
                    context.councilIds());
        }
        return meetings.stream().map(CommitteeMeetingService::toResponse).toList();
    }

    @Transactional(readOnly = true)
    public CommitteeMeetingResponse getMeeting(UUID meetingId) {
        CommitteeMeeting meeting = loadMeeting(meetingId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.VIEW, targetOf(meeting));
        return toResponse(meeting);
    }

    public CommitteeMeetingResponse createMeeting(CommitteeMeetingRequest request) {
        Committee committee = committeeRepository.findWithCouncilById(request.committeeId())
                .orElseThrow(() -> ProblemException.notFound("COMMITTEE_NOT_FOUND"));
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.CREATE,
                AccessTarget.of(ResourceType.COMMITTEE_MEETING)
                        .withCommittee(committee.getId())
                        .withCouncil(committee.getCouncil().getId()));

        CommitteeMeeting meeting = new CommitteeMeeting();
        meeting.setCommittee(committee);
        meeting.setTitle(request.title().trim());
        meeting.setScheduledAt(request.scheduledAt());
        meeting.setLocation(trimToNull(request.location()));
        meeting.setDescription(trimToNull(request.description()));
        return toResponse(meetingRepository.save(meeting));
    }

    public CommitteeMeetingResponse updateMeeting(UUID meetingId, UpdateCommitteeMeetingRequest request) {
        CommitteeMeeting meeting = loadMeeting(meetingId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.EDIT, targetOf(meeting));

        if (request.title() != null) {
            meeting.setTitle(request.title().trim());
        }
        if (request.scheduledAt() != null) {
            meeting.setScheduledAt(request.scheduledAt());
        }
        if (request.location() != null) {
            meeting.setLocation(trimToNull(request.location()));
        }
        if (request.description() != null) {
            meeting.setDescription(trimToNull(request.description()));
        }
        if (request.active() != null) {
            meeting.setActive(request.active());
        }
        return toResponse(meeting);
    }

    public void deleteMeeting(UUID meetingId) {
        CommitteeMeeting meeting = loadMeeting(meetingId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.DELETE,
                targetOf(meeting));
        substituteRepository.deleteByCommitteeMeetingId(meeting.getId());
        meetingRepository.delete(meeting);
    }

    @Transactional(readOnly = true)
    public List<SubstituteResponse> listSubstitutes(UUID meetingId) {
        CommitteeMeeting meeting = loadMeeting(meetingId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.VIEW, targetOf(meeting));
        return substituteRepository.findByCommitteeMeeting_Id(meeting.getId()).stream()
                .map(CommitteeMeetingService::toResponse)
                .toList();
    }

    /**
     * Replaces every substitution of the meeting. A member may be replaced once and a substitute may stand in
     * for one member only; both must belong to the meeting's committee.
     */
    public List<SubstituteResponse> replaceSubstitutes(UUID meetingId, ReplaceSubstitutesRequest request) {
        CommitteeMeeting meeting = loadMeeting(meetingId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.EDIT, targetOf(meeting));

        List<SubstituteAssignment> assignments = request.assignments();
        Set<UUID> replacedMembers = new HashSet<>();
        Set<UUID> substitutes = new HashSet<>();
        Set<UUID> referenced = new HashSet<>();
        for (SubstituteAssignment assignment : assignments) {
            if (assignment.memberId().equals(assignment.substituteMemberId())
                    || !replacedMembers.add(assignment.memberId())
                    || !substitutes.add(assignment.substituteMemberId())) {
                throw new ProblemException(HttpStatus.CONFLICT, SUBSTITUTE_CONFLICT);
            }
            referenced.add(assignment.memberId());
            referenced.add(assignment.substituteMemberId());
        }

        Map<UUID, CommitteeMember> members = referenced.isEmpty()
                ? Map.of()
                : memberRepository.findDetailedByIds(referenced).stream()
                        .collect(Collectors.toMap(CommitteeMember::getId, Function.identity()));
        UUID committeeId = meeting.getCommittee().getId();
        for (UUID id : referenced) {
            CommitteeMember member = members.get(id);
            if (member == null || !member.getCommittee().getId().equals(committeeId)) {
                throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "validation_error",
                        "assignments: MEMBER_NOT_IN_COMMITTEE");
            }
        }

        substituteRepository.deleteByCommitteeMeetingId(meeting.getId());
        List<CommitteeParticipationSubstitute> saved = assignments.stream()
                .map(assignment -> new CommitteeParticipationSubstitute(meeting,
                        members.get(assignment.memberId()), members.get(assignment.substituteMemberId())))
                .map(substituteRepository::save)
                .toList();
        log.info("Committee meeting {} now has {} substitution(s)", meeting.getId(), saved.size());
        return saved.stream().map(CommitteeMeetingService::toResponse).toList();
    }

    @Transactional(readOnly = true)
    public String exportIcs(UUID meetingId, IcsRenderContext renderContext) {
        CommitteeMeeting meeting = loadMeeting(meetingId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.VIEW, targetOf(meeting));
        return icsCalendarWriter.render(List.of(calendarEventMapper.fromCommitteeMeeting(meeting)), renderContext);
    }

    private CommitteeMeeting loadMeeting(UUID meetingId) {
        return meetingRepository.findDetailedById(meetingId)
                .orElseThrow(() -> ProblemException.notFound("COMMITTEE_MEETING_NOT_FOUND"));
    }

    private static AccessTarget targetOf(CommitteeMeeting meeting) {
        Committee committee = meeting.getCommittee();
        return AccessTarget.of(ResourceType.COMMITTEE_MEETING)
                .withCommittee(committee.getId())
                .withCommitteeMeeting(meeting.getId())
                .withCouncil(committee.getCouncil().getId());
    }

    private static CommitteeMeetingResponse toResponse(CommitteeMeeting meeting) {
        return new CommitteeMeetingResponse(
                meeting.getId(),
                meeting.getCommittee().getId(),
                meeting.getCommittee().getName(),
                meeting.getTitle(),
                meeting.getScheduledAt(),
                meeting.getLocation(),
                meeting.getDescription(),
                meeting.isActive()
        );
    }

    private static SubstituteResponse toResponse(CommitteeParticipationSubstitute substitute) {
        return new SubstituteResponse(
                substitute.getMember().getId(),
                substitute.getMember().getUser().getFullName(),
                substitute.getSubstituteMember().getId(),
                substitute.getSubstituteMember().getUser().getFullName()
        );
    }
}
