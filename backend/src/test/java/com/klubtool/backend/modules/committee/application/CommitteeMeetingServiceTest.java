package com.klubtool.backend.modules.committee.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.klubtool.backend.global.error.ProblemException;
import com.klubtool.backend.modules.access.application.AccessDecisionService;
import com.klubtool.backend.modules.access.application.MembershipResolver;
import com.klubtool.backend.modules.access.domain.MembershipContext;
import com.klubtool.backend.modules.auth.domain.PortalUser;
import com.klubtool.backend.modules.calendar.application.CalendarEventMapper;
import com.klubtool.backend.modules.calendar.application.IcsCalendarWriter;
import com.klubtool.backend.modules.committee.domain.Committee;
import com.klubtool.backend.modules.committee.domain.CommitteeMeeting;
import com.klubtool.backend.modules.committee.domain.CommitteeMember;
import com.klubtool.backend.modules.committee.domain.CommitteeParticipationSubstitute;
import com.klubtool.backend.modules.committee.infrastructure.persistence.CommitteeMeetingRepository;
import com.klubtool.backend.modules.committee.infrastructure.persistence.CommitteeMemberRepository;
import com.klubtool.backend.modules.committee.infrastructure.persistence.CommitteeParticipationSubstituteRepository;
import com.klubtool.backend.modules.committee.infrastructure.persistence.CommitteeRepository;
import com.klubtool.backend.modules.committee.presentation.dto.ReplaceSubstitutesRequest;
import com.klubtool.backend.modules.committee.presentation.dto.SubstituteAssignment;
import com.klubtool.backend.modules.committee.presentation.dto.SubstituteResponse;
import com.klubtool.backend.modules.local.domain.Council;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class CommitteeMeetingServiceTest {

    @Mock
    private CommitteeMeetingRepository meetingRepository;
    @Mock
    private CommitteeRepository committeeRepository;
    @Mock
    private CommitteeMemberRepository memberRepository;
    @Mock
    private CommitteeParticipationSubstituteRepository substituteRepository;
    @Mock
    private MembershipResolver membershipResolver;
    @Mock
    private AccessDecisionService accessDecisionService;
    @Mock
    private CalendarEventMapper calendarEventMapper;
    @Mock
    private IcsCalendarWriter icsCalendarWriter;

    private CommitteeMeetingService service;
    private Committee committee;
    private CommitteeMeeting meeting;

    @BeforeEach
    void setUp() {
        service = new CommitteeMeetingService(meetingRepository, committeeRepository, memberRepository,
                substituteRepository, membershipResolver, accessDecisionService, calendarEventMapper,
                icsCalendarWriter);

        Council council = new Council();
        ReflectionTestUtils.setField(council, "id", UUID.randomUUID());
        committee = committee(council);
        meeting = new CommitteeMeeting();
        meeting.setCommittee(committee);
        ReflectionTestUtils.setField(meeting, "id", UUID.randomUUID());

        when(meetingRepository.findDetailedById(meeting.getId())).thenReturn(Optional.of(meeting));
        when(membershipResolver.resolveCurrentUser()).thenReturn(MembershipContext.anonymous());
    }

    @Test
    @DisplayName("a member cannot substitute for themselves")
    void selfSubstitutionConflicts() {
        UUID memberId = UUID.randomUUID();

        assertThatThrownBy(() -> service.replaceSubstitutes(meeting.getId(),
                new ReplaceSubstitutesRequest(List.of(new SubstituteAssignment(memberId, memberId)))))
                .isInstanceOfSatisfying(ProblemException.class, problem -> {
                    assertThat(problem.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(problem.getCode()).isEqualTo("SUBSTITUTE_CONFLICT");
                });
        verify(substituteRepository, never()).deleteByCommitteeMeetingId(any());
    }

    @Test
    @DisplayName("one substitute cannot cover two members")
    void duplicateSubstituteConflicts() {
        UUID substituteId = UUID.randomUUID();
        ReplaceSubstitutesRequest request = new ReplaceSubstitutesRequest(List.of(
                new SubstituteAssignment(UUID.randomUUID(), substituteId),
                new SubstituteAssignment(UUID.randomUUID(), substituteId)));

        assertThatThrownBy(() -> service.replaceSubstitutes(meeting.getId(), request))
                .isInstanceOfSatisfying(ProblemException.class,
                        problem -> assertThat(problem.getStatusCode()).isEqualTo(HttpStatus.CONFLICT));
        verify(memberRepository, never()).findDetailedByIds(anyCollection());
    }

    @Test
    @DisplayName("members of another committee are rejected")
    void foreignMemberRejected() {
        CommitteeMember member = member(committee, "Anna Berger");
        CommitteeMember outsider = member(committee(committee.getCouncil()), "Karl Huber");
        when(memberRepository.findDetailedByIds(anyCollection())).thenReturn(List.of(member, outsider));

        assertThatThrownBy(() -> service.replaceSubstitutes(meeting.getId(), new ReplaceSubstitutesRequest(
                List.of(new SubstituteAssignment(member.getId(), outsider.getId())))))
                .isInstanceOfSatisfying(ProblemException.class, problem -> {
                    assertThat(problem.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
                    assertThat(problem.getDetailMessage()).isEqualTo("assignments: MEMBER_NOT_IN_COMMITTEE");
                });
        verify(substituteRepository, never()).deleteByCommitteeMeetingId(any());
    }

    @Test
    @DisplayName("valid assignments replace the existing set")
    void replacesExistingAssignments() {
        CommitteeMember member = member(committee, "Anna Berger");
        CommitteeMember substitute = member(committee, "Maria Gruber");
        when(memberRepository.findDetailedByIds(anyCollection())).thenReturn(List.of(member, substitute));
        when(substituteRepository.save(any(CommitteeParticipationSubstitute.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));

        List<SubstituteResponse> responses = service.replaceSubstitutes(meeting.getId(), new ReplaceSubstitutesRequest(
                List.of(new SubstituteAssignment(member.getId(), substitute.getId()))));

        assertThat(responses).containsExactly(new SubstituteResponse(
                member.getId(), "Anna Berger", substitute.getId(), "Maria Gruber"));
        InOrder order = inOrder(substituteRepository);
        order.verify(substituteRepository).deleteByCommitteeMeetingId(meeting.getId());
        order.verify(substituteRepository).save(any(CommitteeParticipationSubstitute.class));
    }

    @Test
    void emptyAssignmentsClearSubstitutes() {
        List<SubstituteResponse> responses =
                service.replaceSubstitutes(meeting.getId(), new ReplaceSubstitutesRequest(List.of()));

        assertThat(responses).isEmpty();
        verify(substituteRepository).deleteByCommitteeMeetingId(meeting.getId());
        verify(memberRepository, never()).findDetailedByIds(anyCollection());
    }

    private static Committee committee(Council council) {
        Committee committee = new Committee();
        committee.setCouncil(council);
        ReflectionTestUtils.setField(committee, "id", UUID.randomUUID());
        return committee;
    }

    private static CommitteeMember member(Committee committee, String fullName) {
        PortalUser user = new PortalUser();
        user.setFullName(fullName);
        ReflectionTestUtils.setField(user, "id", UUID.randomUUID());
        CommitteeMember member = new CommitteeMember();
        member.setCommittee(committee);
        member.setUser(user);
        ReflectionTestUtils.setField(member, "id", UUID.randomUUID());
        return member;
    }
}
