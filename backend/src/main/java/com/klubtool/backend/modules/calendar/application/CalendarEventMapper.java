package com.klubtool.backend.modules.calendar.application;

import java.util.Locale;

import com.klubtool.backend.global.i18n.Messages;
import com.klubtool.backend.global.web.ResourcePaths;
import com.klubtool.backend.modules.calendar.domain.CalendarEvent;
import com.klubtool.backend.modules.calendar.domain.CalendarEventSource;
import com.klubtool.backend.modules.committee.domain.CommitteeMeeting;
import com.klubtool.backend.modules.council.domain.CouncilSession;
import com.klubtool.backend.modules.group.domain.GroupMeeting;

import org.springframework.stereotype.Component;

/**
 * Projects the three event entities onto {@link CalendarEvent}. Owning aggregates must be loaded.
 */
@Component
public class CalendarEventMapper {

    static final String COUNCIL_BADGE_KEY = "calendar.badge.council";
    static final String GROUP_MEETING_BADGE_KEY = "calendar.badge.group-meeting";

    private final Messages messages;

    public CalendarEventMapper(Messages messages) {
        this.messages = messages;
    }

    public CalendarEvent fromSession(CouncilSession session, Locale locale) {
        return new CalendarEvent(
                session.getScheduledAt(),
                session.getTitle(),
                ResourcePaths.session(session.getId()),
                ResourcePaths.sessionExport(session.getId()),
                CalendarEventSource.COUNCIL_SESSION,
                badgeOrDefault(session.getCouncil().getCalendarBadgeName(), COUNCIL_BADGE_KEY, locale),
                session.getCouncil().getName(),
                session.getLocation(),
                session.getId(),
                session.isCancelled()
        );
    }

    /**
     * Committee meetings have no cancelled state; the badge is the committee type.
     */
    public CalendarEvent fromCommitteeMeeting(CommitteeMeeting meeting) {
        return new CalendarEvent(
                meeting.getScheduledAt(),
                meeting.getTitle(),
                ResourcePaths.committeeMeeting(meeting.getId()),
                ResourcePaths.committeeMeetingExport(meeting.getId()),
                CalendarEventSource.COMMITTEE_MEETING,
                meeting.getCommittee().getCommitteeType().getLabel(),
                meeting.getCommittee().getName(),
                meeting.getLocation(),
                meeting.getId(),
                false
        );
    }

    public CalendarEvent fromGroupMeeting(GroupMeeting meeting, Locale locale) {
        return new CalendarEvent(
                meeting.getScheduledAt(),
                meeting.getTitle(),
                ResourcePaths.groupMeeting(meeting.getId()),
                ResourcePaths.groupMeetingExport(meeting.getId()),
                CalendarEventSource.GROUP_MEETING,
                badgeOrDefault(meeting.getGroup().getCalendarBadgeName(), GROUP_MEETING_BADGE_KEY, locale),
                meeting.getGroup().getName(),
                meeting.getLocation(),
                meeting.getId(),
                meeting.isCancelled()
        );
    }

    private String badgeOrDefault(String override, String defaultKey, Locale locale) {
        if (override == null || override.isBlank()) {
            return messages.get(defaultKey, locale);
        }
        return override.strip();
    }
}
