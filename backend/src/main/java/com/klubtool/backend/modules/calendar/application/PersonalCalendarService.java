package com.klubtool.backend.modules.calendar.application;

import java.util.List;
import java.util.Locale;

import com.klubtool.backend.global.error.ProblemException;
import com.klubtool.backend.modules.access.application.MembershipResolver;
import com.klubtool.backend.modules.access.domain.MembershipContext;
import com.klubtool.backend.modules.auth.application.UserLocaleResolver;
import com.klubtool.backend.modules.auth.domain.PortalUser;
import com.klubtool.backend.modules.calendar.domain.CalendarEvent;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * The personal calendar in its three shapes: JSON events, one-shot ICS download, subscription feed.
 */
@Service
@Transactional(readOnly = true)
public class PersonalCalendarService {

    private final MembershipResolver membershipResolver;
    private final CalendarAggregator calendarAggregator;
    private final IcsCalendarWriter icsCalendarWriter;
    private final CalendarSubscriptionService subscriptionService;
    private final UserLocaleResolver localeResolver;

    public PersonalCalendarService(
            MembershipResolver membershipResolver,
            CalendarAggregator calendarAggregator,
            IcsCalendarWriter icsCalendarWriter,
            CalendarSubscriptionService subscriptionService,
            UserLocaleResolver localeResolver
    ) {
        this.membershipResolver = membershipResolver;
        this.calendarAggregator = calendarAggregator;
        this.icsCalendarWriter = icsCalendarWriter;
        this.subscriptionService = subscriptionService;
        this.localeResolver = localeResolver;
    }

    public List<CalendarEvent> upcomingEventsForCurrentUser() {
        PortalUser user = membershipResolver.findCurrentUser().orElseThrow(ProblemException::forbidden);
        return eventsFor(user, false);
    }

    public String exportForCurrentUser(IcsRenderContext renderContext) {
        return icsCalendarWriter.render(upcomingEventsForCurrentUser(), renderContext);
    }

    /**
     * Every token failure yields the same forbidden outcome.
     */
    @Transactional
    public String renderFeed(String rawToken, IcsRenderContext renderContext) {
        PortalUser user = subscriptionService.resolveFeedUser(rawToken).orElseThrow(ProblemException::forbidden);
        return icsCalendarWriter.render(eventsFor(user, true), renderContext);
    }

    private List<CalendarEvent> eventsFor(PortalUser user, boolean includeRecentPast) {
        MembershipContext context = membershipResolver.resolve(user);
        Locale locale = localeResolver.resolve(user);
        return calendarAggregator.aggregate(context, locale, includeRecentPast);
    }
}
