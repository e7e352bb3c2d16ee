package com.klubtool.backend.global.web;

import java.util.UUID;

/**
 * Canonical relative paths of the resources that appear in calendars and subscription links.
 */
public final class ResourcePaths {

    public static final String SESSIONS = "/sessions";
    public static final String COMMITTEE_MEETINGS = "/committee-meetings";
    public static final String GROUP_MEETINGS = "/group-meetings";
    public static final String CALENDAR_FEED = "/calendar/feed";
    private static final String ICS_SUFFIX = "/export.ics";

    private ResourcePaths() {
    }

    public static String session(UUID id) {
        return SESSIONS + "/" + id;
    }

    public static String sessionExport(UUID id) {
        return session(id) + ICS_SUFFIX;
    }

    public static String committeeMeeting(UUID id) {
        return COMMITTEE_MEETINGS + "/" + id;
    }

    public static String committeeMeetingExport(UUID id) {
        return committeeMeeting(id) + ICS_SUFFIX;
    }

    public static String groupMeeting(UUID id) {
        return GROUP_MEETINGS + "/" + id;
    }

    public static String groupMeetingExport(UUID id) {
        return groupMeeting(id) + ICS_SUFFIX;
    }

    public static String calendarFeed(String rawToken) {
        return CALENDAR_FEED + "/" + rawToken + ".ics";
    }
}
