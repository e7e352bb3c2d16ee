package com.klubtool.backend.modules.council.application;

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
import com.klubtool.backend.modules.committee.domain.Committee;
import com.klubtool.backend.modules.committee.infrastructure.persistence.CommitteeRepository;
import com.klubtool.backend.modules.council.domain.CouncilSession;
import com.klubtool.backend.modules.council.domain.SessionExcuse;
import com.klubtool.backend.modules.council.domain.SessionStatus;
import com.klubtool.backend.modules.council.infrastructure.persistence.CouncilSessionRepository;
import com.klubtool.backend.modules.council.infrastructure.persistence.SessionExcuseRepository;
import com.klubtool.backend.modules.council.presentation.dto.SessionExcuseRequest;
import com.klubtool.backend.modules.council.presentation.dto.SessionExcuseResponse;
import com.klubtool.backend.modules.council.presentation.dto.SessionRequest;
import com.klubtool.backend.modules.council.presentation.dto.SessionResponse;
import com.klubtool.backend.modules.council.presentation.dto.UpdateSessionRequest;
import com.klubtool.backend.modules.local.domain.Council;
import com.klubtool.backend.modules.local.infrastructure.persistence.CouncilRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);
    private static final DateTimeFormatter TITLE_DATE = DateTimeFormatter.ofPattern("dd.MM.yyyy");

    private final CouncilSessionRepository sessionRepository;
    private final SessionExcuseRepository excuseRepository;
    private final CouncilRepository councilRepository;
    private final CommitteeRepository committeeRepository;
    private final MembershipResolver membershipResolver;
    private final AccessDecisionService accessDecisionService;
    private final CalendarEventMapper calendarEventMapper;
    private final IcsCalendarWriter icsCalendarWriter;
    private final UserLocaleResolver localeResolver;
    private final Messages messages;

    public SessionService(
            CouncilSessionRepository sessionRepository,
            SessionExcuseRepository excuseRepository,
            CouncilRepository councilRepository,
            CommitteeRepository committeeRepository,
            MembershipResolver membershipResolver,
            AccessDecisionService accessDecisionService,
            CalendarEventMapper calendarEventMapper,
            IcsCalendarWriter icsCalendarWriter,
            UserLocaleResolver localeResolver,
            Messages messages
    ) {
        this.sessionRepository = sessionRepository;
        this.excuseRepository = excuseRepository;
        this.councilRepository = councilRepository;
        this.committeeRepository = committeeRepository;
        this.membershipResolver = membershipResolver;
        this.accessDecisionService = accessDecisionService;
        this.calendarEventMapper = calendarEventMapper;
        this.icsCalendarWriter = icsCalendarWriter;
        this.localeResolver = localeResolver;
        this.messages = messages;
    }

    /**
     * Everything for holders of {@code session.view}; otherwise the sessions of reachable councils.
     */
    @Transactional(readOnly = true)
    public List<SessionResponse> listSessions() {
        MembershipContext context = membershipResolver.resolveCurrentUser();
        AccessTarget target = AccessTarget.of(ResourceType.SESSION);
        List<CouncilSession> sessions;
        if (accessDecisionService.hasGlobalAccess(context, AccessAction.LIST, target)) {
            sessions = sessionRepository.findAllOrderByScheduledAtDesc();
        } else {
            accessDecisionService.require(context, AccessAction.LIST, target);
            sessions = sessionRepository.findByCouncilIds(context.councilIds());
        }
        Set<UUID> excused = context.userId() == null || sessions.isEmpty()
                ? Set.of()
                : excuseRepository.findExcusedSessionIds(context.userId(),
                        sessions.stream().map(CouncilSession::getId).toList());
        return sessions.stream()
                .map(session -> toResponse(session, excused.contains(session.getId())))
                .toList();
    }

    @Transactional(readOnly = true)
    public SessionResponse getSession(UUID sessionId) {
        CouncilSession session = loadSession(sessionId);
        MembershipContext context = membershipResolver.resolveCurrentUser();
        accessDecisionService.require(context, AccessAction.VIEW, targetOf(session));
        return toResponse(session, context.userId());
    }

    public SessionResponse createSession(SessionRequest request) {
        Council council = councilRepository.findById(request.councilId())
                .orElseThrow(() -> ProblemException.notFound("COUNCIL_NOT_FOUND"));
        MembershipContext context = membershipResolver.resolveCurrentUser();
        accessDecisionService.require(context, AccessAction.CREATE,
                AccessTarget.of(ResourceType.SESSION).withCouncil(council.getId()));

        CouncilSession session = new CouncilSession();
        session.setCouncil(council);
        if (request.committeeId() != null) {
            session.setCommittee(loadCommitteeOfCouncil(request.committeeId(), council));
        }
        session.setStatus(request.status() == null ? SessionStatus.SCHEDULED : request.status());
        session.setScheduledAt(request.scheduledAt());
        session.setLocation(trimToNull(request.location()));
        session.setAgenda(trimToNull(request.agenda()));
        String title = trimToNull(request.title());
        session.setTitle(title != null ? title : defaultTitle(session));
        return toResponse(sessionRepository.save(session), context.userId());
    }

    public SessionResponse updateSession(UUID sessionId, UpdateSessionRequest request) {
        CouncilSession session = loadSession(sessionId);
        MembershipContext context = membershipResolver.resolveCurrentUser();
        accessDecisionService.require(context, AccessAction.EDIT, targetOf(session));

        if (request.title() != null) {
            String title = trimToNull(request.title());
            session.setTitle(title != null ? title : defaultTitle(session));
        }
        if (request.status() != null) {
            session.setStatus(request.status());
        }
        if (request.scheduledAt() != null) {
            session.setScheduledAt(request.scheduledAt());
        }
        if (request.location() != null) {
            session.setLocation(trimToNull(request.location()));
        }
        if (request.agenda() != null) {
            session.setAgenda(trimToNull(request.agenda()));
        }
        if (request.active() != null) {
            session.setActive(request.active());
        }
        return toResponse(session, context.userId());
    }

    public void deleteSession(UUID sessionId) {
        CouncilSession session = loadSession(sessionId);
        accessDecisionService.require(membershipResolver.resolveCurrentUser(), AccessAction.DELETE,
                targetOf(session));
        sessionRepository.delete(session);
    }

    /**
     * Records that the current user will not attend. Repeating the call only updates the note.
     */
    public SessionExcuseResponse excuseCurrentUser(UUID sessionId, SessionExcuseRequest request) {
        CouncilSession session = loadSession(sessionId);
        PortalUser user = currentUser();
        accessDecisionService.require(membershipResolver.resolve(user), AccessAction.VIEW, targetOf(session));

        String note = request == null ? null : trimToNull(request.note());
        SessionExcuse excuse = excuseRepository.findBySession_IdAndUser_Id(session.getId(), user.getId())
                .map(existing -> {
                    existing.setNote(note);
                    return existing;
                })
                .orElseGet(() -> excuseRepository.save(new SessionExcuse(session, user, note)));
        log.info("User {} excused from session {}", user.getId(), session.getId());
        return new SessionExcuseResponse(session.getId(), user.getId(), excuse.getNote(), excuse.getCreatedAt());
    }

    public void withdrawExcuse(UUID sessionId) {
        CouncilSession session = loadSession(sessionId);
        PortalUser user = currentUser();
        accessDecisionService.require(membershipResolver.resolve(user), AccessAction.VIEW, targetOf(session));
        excuseRepository.findBySession_IdAndUser_Id(session.getId(), user.getId())
                .ifPresent(excuseRepository::delete);
    }

    @Transactional(readOnly = true)
    public String exportIcs(UUID sessionId, IcsRenderContext renderContext) {
        CouncilSession session = loadSession(sessionId);
        PortalUser user = currentUser();
        accessDecisionService.require(membershipResolver.resolve(user), AccessAction.VIEW, targetOf(session));
        Locale locale = localeResolver.resolve(user);
        return icsCalendarWriter.render(List.of(calendarEventMapper.fromSession(session, locale)), renderContext);
    }

    private PortalUser currentUser() {
        return membershipResolver.findCurrentUser().orElseThrow(ProblemException::forbidden);
    }

    private CouncilSession loadSession(UUID sessionId) {
        return sessionRepository.findDetailedById(sessionId)
                .orElseThrow(() -> ProblemException.notFound("SESSION_NOT_FOUND"));
    }

    private Committee loadCommitteeOfCouncil(UUID committeeId, Council council) {
        Committee committee = committeeRepository.findWithCouncilById(committeeId)
                .orElseThrow(() -> ProblemException.notFound("COMMITTEE_NOT_FOUND"));
        if (!committee.getCouncil().getId().equals(council.getId())) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "validation_error",
                    "committeeId: COMMITTEE_COUNCIL_MISMATCH");
        }
        return committee;
    }

    private String defaultTitle(CouncilSession session) {
        Locale locale = localeResolver.resolve(membershipResolver.findCurrentUser().orElse(null));
        return messages.get("session.default-title", locale) + " " + session.getScheduledAt().format(TITLE_DATE);
    }

    private static AccessTarget targetOf(CouncilSession session) {
        return AccessTarget.of(ResourceType.SESSION).withCouncil(session.getCouncil().getId());
    }

    private SessionResponse toResponse(CouncilSession session, UUID currentUserId) {
        boolean excused = currentUserId != null && session.getId() != null
                && excuseRepository.findBySession_IdAndUser_Id(session.getId(), currentUserId).isPresent();
        return toResponse(session, excused);
    }

    private static SessionResponse toResponse(CouncilSession session, boolean excused) {
        return new SessionResponse(
                session.getId(),
                session.getTitle(),
                session.getCouncil().getId(),
                session.getCouncil().getName(),
                session.getCommittee() == null ? null : session.getCommittee().getId(),
                session.getStatus(),
                session.getScheduledAt(),
                session.getLocation(),
                session.getAgenda(),
                session.isActive(),
                excused
        );
    }
}
