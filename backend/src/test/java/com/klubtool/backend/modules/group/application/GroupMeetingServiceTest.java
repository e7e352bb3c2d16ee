package com.klubtool.backend.modules.group.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.klubtool.backend.global.i18n.Messages;
import com.klubtool.backend.modules.access.application.AccessDecisionService;
import com.klubtool.backend.modules.access.application.MembershipResolver;
import com.klubtool.backend.modules.access.domain.MembershipContext;
import com.klubtool.backend.modules.auth.application.UserLocaleResolver;
import com.klubtool.backend.modules.calendar.application.CalendarEventMapper;
import com.klubtool.backend.modules.calendar.application.IcsCalendarWriter;
import com.klubtool.backend.modules.group.domain.GroupMeeting;
import com.klubtool.backend.modules.group.domain.GroupMeetingStatus;
import com.klubtool.backend.modules.group.domain.PoliticalGroup;
import com.klubtool.backend.modules.group.infrastructure.persistence.GroupMeetingRepository;
import com.klubtool.backend.modules.group.infrastructure.persistence.PoliticalGroupRepository;
import com.klubtool.backend.modules.group.presentation.dto.GroupMeetingResponse;
import com.klubtool.backend.modules.group.presentation.dto.UpdateGroupMeetingRequest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class GroupMeetingServiceTest {

    @Mock
    private GroupMeetingRepository meetingRepository;
    @Mock
    private PoliticalGroupRepository groupRepository;
    @Mock
    private MembershipResolver membershipResolver;
    @Mock
    private AccessDecisionService accessDecisionService;
    @Mock
    private CalendarEventMapper calendarEventMapper;
    @Mock
    private IcsCalendarWriter icsCalendarWriter;
    @Mock
    private UserLocaleResolver localeResolver;
    @Mock
    private Messages messages;

    private GroupMeetingService service;
    private GroupMeeting meeting;

    @BeforeEach
    void setUp() {
        service = new GroupMeetingService(meetingRepository, groupRepository, membershipResolver,
                accessDecisionService, calendarEventMapper, icsCalendarWriter, localeResolver, messages);

        PoliticalGroup group = new PoliticalGroup();
        ReflectionTestUtils.setField(group, "id", UUID.randomUUID());
        group.setName("Klub");
        meeting = new GroupMeeting();
        ReflectionTestUtils.setField(meeting, "id", UUID.randomUUID());
        meeting.setGroup(group);
        meeting.setTitle("Klubsitzung");
        meeting.setScheduledAt(OffsetDateTime.parse("2025-03-03T19:00:00+01:00"));
        meeting.cancel();

        when(meetingRepository.findWithGroupById(meeting.getId())).thenReturn(Optional.of(meeting));
        when(membershipResolver.resolveCurrentUser()).thenReturn(new MembershipContext(UUID.randomUUID(), true, true,
                Set.of(), List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), Set.of(), Set.of()));
    }

    @Test
    @DisplayName("rescheduling a cancelled meeting makes it active again")
    void reschedulingReactivatesMeeting() {
        GroupMeetingResponse response = service.updateMeeting(meeting.getId(),
                new UpdateGroupMeetingRequest(null, null, null, null, GroupMeetingStatus.SCHEDULED, null));

        assertThat(response.status()).isEqualTo(GroupMeetingStatus.SCHEDULED);
        assertThat(response.active()).isTrue();
    }

    @Test
    void explicitInactiveFlagWinsOverRescheduling() {
        GroupMeetingResponse response = service.updateMeeting(meeting.getId(),
                new UpdateGroupMeetingRequest(null, null, null, null, GroupMeetingStatus.SCHEDULED, false));

        assertThat(response.active()).isFalse();
    }

    @Test
    void cancellingDeactivates() {
        meeting.reinstate(GroupMeetingStatus.SCHEDULED);

        GroupMeetingResponse response = service.cancelMeeting(meeting.getId());

        assertThat(response.status()).isEqualTo(GroupMeetingStatus.CANCELLED);
        assertThat(response.active()).isFalse();
    }
}
