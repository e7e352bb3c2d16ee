package com.klubtool.backend.modules.calendar.domain;

/**
 * Origin of a calendar event. The model tag is part of the event's stable identity and of its ICS UID.
 */
public enum CalendarEventSource {
    COUNCIL_SESSION("council_session", "session"),
    COMMITTEE_MEETING("committee_meeting", "committeemeeting"),
    GROUP_MEETING("group_meeting", "groupmeeting");

    private final String type;
    private final String modelTag;

    CalendarEventSource(String type, String modelTag) {
        this.type = type;
        this.modelTag = modelTag;
    }

    public String type() {
        return type;
    }

    public String modelTag() {
        return modelTag;
    }
}
