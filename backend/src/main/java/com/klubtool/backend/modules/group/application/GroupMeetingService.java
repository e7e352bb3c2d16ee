package com.klubtool.backend.modules.group.application;

import static com.klubtool.backend.global.common.TextValues.trimToNull;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

import com.klubtool.backend.global.error.ProblemException;
import com.klubtool.backend.global.i18n.Messages;
import com.klubtool.backend.modules.access.application.AccessDecisionService;
import com.klubtool.backend.modules.access.application.MembershipResolver;
import com.klubtool.backend.modules.access.domain.AccessAction;
import com.klubtool.backend.modules.access.domain.AccessTarget;
import com.klubtool.backend.modules.access.domain.MembershipContext;
import com.klubtool.backend.modules.access.domain.ResourceType;
import com.klubtool.backend.modules.auth.application.UserLocaleResolver;
import com.klubtool.backend.modules.auth.domain.PortalUser;
import com.klubtool.backend.modules.calendar.application.CalendarEventMapper;
import com.klubtool.backend.modules.calendar.application.IcsCalendarWriter;
import com.klubtool.backend.modules.calendar.application.IcsRenderContext;
import com.klubtool.backend.modules.group.domain.GroupMeeting;
import com.klubtool.backend.modules.group.domain.GroupMeetingStatus;
import com.klubtool.backend.modules.group.domain.PoliticalGroup;
import com.klubtool.backend.modules.group.infrastructure.persistence.GroupMeetingRepository;
import com.klubtool.backend.modules.group.infrastructure.persistence.PoliticalGroupRepository;
import com.klubtool.backend.modules.group.presentation.dto.GroupMeetingRequest;
import com.klubtool.backend.modules.group.presentation.dto.GroupMeetingResponse;
import com.klubtool.backend.modules.group.presentation.dto.UpdateGroupMeetingRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class GroupMeetingService {

    private static final Logger log = LoggerFactory.getLogger(GroupMeetingService.class);
    private static final DateTimeFormatter TITLE_DATE = DateTimeFormatter.ofPattern("dd.MM.yyyy");

    private final GroupMeetingRepository meetingRepository;
    private final PoliticalGroupRepository groupRepository;
    private final MembershipResolver membershipResolver;
    private final AccessDecisionService accessDecisionService;
    private final CalendarEventMapper calendarEventMapper;
    private final IcsCalendarWriter icsCalendarWriter;
    private final UserLocaleResolver localeResolver;
    private final Messages messages;

    public GroupMeetingService(
            GroupMeetingRepository meetingRepository,
            PoliticalGroupRepository groupRepository,
            MembershipResolver membershipResolver,
            AccessDecisionService accessDecisionService,
            CalendarEventMapper calendarEventMapper,
            IcsCalendarWriter icsCalendarWriter,
            UserLocaleResolver localeResolver,
            Messages messages
    ) {
        this.meetingRepository = meetingRepository;
        this.groupRepository = groupRepository;
        this.membershipResolver = membershipResolver;
        this.accessDecisionService = accessDecisionService;
        this.calendarEventMapper = calendarEventMapper;
        this.icsCalendarWriter = icsCalendarWriter;
        this.localeResolver = localeResolver;
        this.messages = messages;
    }

    /**
     * Everything for holders of {@code group.view}; otherwise meetings of the user's own groups.
     */
    @Transactional(readOnly = true)
    public List<GroupMeetingResponse> listMeetings() {
        MembershipContext context = membershipResolver.resolveCurrentUser();
        AccessTarget target = AccessTarget.of(ResourceType.GROUP_MEETING);
        List<GroupMeeting> meetings;
        if (accessDecisionService.hasGlobalAccess(context, AccessAction.LIST, target)) {
            meetings = meetingRepository.findAllOrderByScheduledAtDesc();
        } else {
            accessDecisionService.require(context, AccessAction.LIST, target);
            Set<UUID> groupIds = context.memberGroupIds();
            meetings = groupIds.isEmpty() ? List.of() : meetingRepository.findByGroupIds(groupIds);
        }
        return meetings.stream().map(GroupMeetingService::toResponse).toList();
    }

    @Transactional(readOnly = true)
    public GroupMeetingResponse getMeeting(UUID meetingId) {
        GroupMeeting meeting = loadMeeting(meetingId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.VIEW, targetOf(meeting));
        return toResponse(meeting);
    }

    public GroupMeetingResponse createMeeting(GroupMeetingRequest request) {
        PoliticalGroup group = groupRepository.findById(request.groupId())
                .orElseThrow(() -> ProblemException.notFound("GROUP_NOT_FOUND"));
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.CREATE,
                AccessTarget.of(ResourceType.GROUP_MEETING).withGroup(group.getId()));

        GroupMeeting meeting = new GroupMeeting();
        meeting.setGroup(group);
        meeting.setScheduledAt(request.scheduledAt());
        meeting.setLocation(trimToNull(request.location()));
        meeting.setDescription(trimToNull(request.description()));
        if (request.status() == GroupMeetingStatus.CANCELLED) {
            meeting.cancel();
        } else if (request.status() != null) {
            meeting.setStatus(request.status());
        }
        String title = trimToNull(request.title());
        meeting.setTitle(title != null ? title : defaultTitle(meeting));
        return toResponse(meetingRepository.save(meeting));
    }

    public GroupMeetingResponse updateMeeting(UUID meetingId, UpdateGroupMeetingRequest request) {
        GroupMeeting meeting = loadMeeting(meetingId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.EDIT, targetOf(meeting));

        if (request.title() != null) {
            String title = trimToNull(request.title());
            meeting.setTitle(title != null ? title : defaultTitle(meeting));
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
        if (request.status() == GroupMeetingStatus.CANCELLED) {
            meeting.cancel();
        } else if (request.status() != null) {
            meeting.reinstate(request.status());
        }
        if (request.active() != null) {
            meeting.setActive(request.active());
        }
        return toResponse(meeting);
    }

    /**
     * Cancelled meetings leave active listings but remain in subscription feeds marked as cancelled.
     */
    public GroupMeetingResponse cancelMeeting(UUID meetingId) {
        GroupMeeting meeting = loadMeeting(meetingId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.EDIT, targetOf(meeting));
        meeting.cancel();
        log.info("Group meeting {} cancelled", meeting.getId());
        return toResponse(meeting);
    }

    public void deleteMeeting(UUID meetingId) {
        GroupMeeting meeting = loadMeeting(meetingId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.DELETE,
                targetOf(meeting));
        meetingRepository.delete(meeting);
    }

    @Transactional(readOnly = true)
    public String exportIcs(UUID meetingId, IcsRenderContext renderContext) {
        GroupMeeting meeting = loadMeeting(meetingId);
        PortalUser user = membershipResolver.findCurrentUser().orElseThrow(ProblemException::forbidden);
        accessDecisionService.require(membershipResolver.resolve(user), AccessAction.VIEW, targetOf(meeting));
        Locale locale = localeResolver.resolve(user);
        return icsCalendarWriter.render(List.of(calendarEventMapper.fromGroupMeeting(meeting, locale)), renderContext);
    }

    private GroupMeeting loadMeeting(UUID meetingId) {
        return meetingRepository.findWithGroupById(meetingId)
                .orElseThrow(() -> ProblemException.notFound("GROUP_MEETING_NOT_FOUND"));
    }

    private String defaultTitle(GroupMeeting meeting) {
        Locale locale = localeResolver.resolve(membershipResolver.findCurrentUser().orElse(null));
        return messages.get("group-meeting.default-title", locale) + " " + meeting.getScheduledAt().format(TITLE_DATE);
    }

    private static AccessTarget targetOf(GroupMeeting meeting) {
        return AccessTarget.of(ResourceType.GROUP_MEETING).withGroup(meeting.getGroup().getId());
    }

    private static GroupMeetingResponse toResponse(GroupMeeting meeting) {
        return new GroupMeetingResponse(
                meeting.getId(),
                meeting.getGroup().getId(),
                meeting.getGroup().getName(),
                meeting.getTitle(),
                meeting.getScheduledAt(),
                meeting.getLocation(),
                meeting.getDescription(),
                meeting.getStatus(),
                meeting.isActive()
        );
    }
}
