package com.klubtool.backend.modules.council.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.klubtool.backend.global.i18n.Messages;
import com.klubtool.backend.modules.access.application.AccessDecisionService;
import com.klubtool.backend.modules.access.application.MembershipResolver;
import com.klubtool.backend.modules.access.domain.MembershipContext;
import com.klubtool.backend.modules.auth.application.UserLocaleResolver;
import com.klubtool.backend.modules.calendar.application.CalendarEventMapper;
import com.klubtool.backend.modules.calendar.application.IcsCalendarWriter;
import com.klubtool.backend.modules.committee.infrastructure.persistence.CommitteeRepository;
import com.klubtool.backend.modules.council.domain.CouncilSession;
import com.klubtool.backend.modules.council.infrastructure.persistence.CouncilSessionRepository;
import com.klubtool.backend.modules.council.infrastructure.persistence.SessionExcuseRepository;
import com.klubtool.backend.modules.council.presentation.dto.SessionResponse;
import com.klubtool.backend.modules.local.domain.Council;
import com.klubtool.backend.modules.local.infrastructure.persistence.CouncilRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class SessionServiceTest {

    @Mock
    private CouncilSessionRepository sessionRepository;
    @Mock
    private SessionExcuseRepository excuseRepository;
    @Mock
    private CouncilRepository councilRepository;
    @Mock
    private CommitteeRepository committeeRepository;
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

    private SessionService service;
    private UUID userId;

    @BeforeEach
    void setUp() {
        service = new SessionService(sessionRepository, excuseRepository, councilRepository, committeeRepository,
                membershipResolver, accessDecisionService, calendarEventMapper, icsCalendarWriter, localeResolver,
                messages);
        userId = UUID.randomUUID();
    }

    @Test
    @DisplayName("listing loads the caller's excuses with one query")
    void listingLoadsExcusesOnce() {
        Council council = new Council();
        ReflectionTestUtils.setField(council, "id", UUID.randomUUID());
        council.setName("Bezirksvertretung");
        CouncilSession excusedSession = session(council);
        CouncilSession attendedSession = session(council);
        when(membershipResolver.resolveCurrentUser()).thenReturn(context());
        when(accessDecisionService.hasGlobalAccess(any(), any(), any())).thenReturn(true);
        when(sessionRepository.findAllOrderByScheduledAtDesc()).thenReturn(List.of(excusedSession, attendedSession));
        when(excuseRepository.findExcusedSessionIds(eq(userId), anyCollection()))
                .thenReturn(Set.of(excusedSession.getId()));

        List<SessionResponse> responses = service.listSessions();

        assertThat(responses).extracting(SessionResponse::excusedByCurrentUser).containsExactly(true, false);
        verify(excuseRepository, times(1)).findExcusedSessionIds(eq(userId), anyCollection());
        verify(excuseRepository, never()).findBySession_IdAndUser_Id(any(), any());
    }

    @Test
    void emptyListingSkipsExcuseLookup() {
        when(membershipResolver.resolveCurrentUser()).thenReturn(context());
        when(accessDecisionService.hasGlobalAccess(any(), any(), any())).thenReturn(true);
        when(sessionRepository.findAllOrderByScheduledAtDesc()).thenReturn(List.of());

        assertThat(service.listSessions()).isEmpty();
        verify(excuseRepository, never()).findExcusedSessionIds(any(), anyCollection());
    }

    private static CouncilSession session(Council council) {
        CouncilSession session = new CouncilSession();
        ReflectionTestUtils.setField(session, "id", UUID.randomUUID());
        session.setTitle("Sitzung");
        session.setCouncil(council);
        session.setScheduledAt(OffsetDateTime.parse("2025-02-01T18:00:00+01:00"));
        return session;
    }

    private MembershipContext context() {
        return new MembershipContext(userId, true, false, Set.of(), List.of(), List.of(), List.of(), List.of(),
                List.of(), List.of(), Set.of(), Set.of());
    }
}
