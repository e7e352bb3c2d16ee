package com.klubtool.backend.modules.calendar.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.klubtool.backend.modules.access.domain.MembershipContext;
import com.klubtool.backend.modules.calendar.domain.CalendarEvent;
import com.klubtool.backend.modules.committee.domain.CommitteeMeeting;
import com.klubtool.backend.modules.committee.infrastructure.persistence.CommitteeMeetingRepository;
import com.klubtool.backend.modules.council.infrastructure.persistence.CouncilSessionRepository;
import com.klubtool.backend.modules.group.infrastructure.persistence.GroupMeetingRepository;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Merges council sessions, committee meetings and group meetings visible to one user into a
 * single list ordered by start time. Sources with no matching membership contribute nothing.
 */
@Service
@Transactional(readOnly = true)
public class CalendarAggregator {

    private final CouncilSessionRepository councilSessionRepository;
    private final CommitteeMeetingRepository committeeMeetingRepository;
    private final GroupMeetingRepository groupMeetingRepository;
    private final CalendarEventMapper eventMapper;
    private final Clock clock;
    private final Duration feedLookback;

    public CalendarAggregator(
            CouncilSessionRepository councilSessionRepository,
            CommitteeMeetingRepository committeeMeetingRepository,
            GroupMeetingRepository groupMeetingRepository,
            CalendarEventMapper eventMapper,
            Clock clock,
            @Value("${app.calendar.feed-lookback:P30D}") Duration feedLookback
    ) {
        this.councilSessionRepository = councilSessionRepository;
        this.committeeMeetingRepository = committeeMeetingRepository;
        this.groupMeetingRepository = groupMeetingRepository;
        this.eventMapper = eventMapper;
        this.clock = clock;
        this.feedLookback = feedLookback;
    }

    /**
     * @param includeRecentPast subscription-feed mode: the window starts {@code feed-lookback} ago and
     *                          cancelled group meetings are kept even when inactive
     */
    public List<CalendarEvent> aggregate(MembershipContext context, Locale locale, boolean includeRecentPast) {
        if (context == null || !context.authenticated()) {
            return List.of();
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime from = includeRecentPast ? now.minus(feedLookback) : now;

        List<CalendarEvent> events = new ArrayList<>();
        events.addAll(councilSessions(context, locale, from));
        events.addAll(committeeMeetings(context, from));
        events.addAll(groupMeetings(context, locale, from, includeRecentPast));

        // List.sort is stable: equal timestamps keep source order
        events.sort(Comparator.comparing(CalendarEvent::scheduledAt));
        return events;
    }

    private List<CalendarEvent> councilSessions(MembershipContext context, Locale locale, OffsetDateTime from) {
        Set<UUID> councilIds = context.councilIds();
        if (councilIds.isEmpty()) {
            return List.of();
        }
        return councilSessionRepository.findCalendarSessions(councilIds, context.userId(), from).stream()
                .map(session -> eventMapper.fromSession(session, locale))
                .toList();
    }

    private List<CalendarEvent> committeeMeetings(MembershipContext context, OffsetDateTime from) {
        Set<UUID> committeeIds = context.committeeIds();
        Set<UUID> substituteMeetingIds = context.substituteMeetingIds();
        if (committeeIds.isEmpty() && substituteMeetingIds.isEmpty()) {
            return List.of();
        }
        Map<UUID, CommitteeMeeting> meetings = new LinkedHashMap<>();
        if (!committeeIds.isEmpty()) {
            committeeMeetingRepository.findActiveByCommitteeIds(committeeIds, from)
                    .forEach(meeting -> meetings.putIfAbsent(meeting.getId(), meeting));
        }
        if (!substituteMeetingIds.isEmpty()) {
            committeeMeetingRepository.findActiveByIds(substituteMeetingIds, from)
                    .forEach(meeting -> meetings.putIfAbsent(meeting.getId(), meeting));
        }
        return meetings.values().stream()
                .sorted(Comparator.comparing(CommitteeMeeting::getScheduledAt))
                .map(eventMapper::fromCommitteeMeeting)
                .toList();
    }

    private List<CalendarEvent> groupMeetings(MembershipContext context, Locale locale, OffsetDateTime from,
                                              boolean includeCancelled) {
        Set<UUID> groupIds = context.memberGroupIds();
        if (groupIds.isEmpty()) {
            return List.of();
        }
        return groupMeetingRepository.findCalendarMeetings(groupIds, from, includeCancelled).stream()
                .map(meeting -> eventMapper.fromGroupMeeting(meeting, locale))
                .toList();
    }
}
