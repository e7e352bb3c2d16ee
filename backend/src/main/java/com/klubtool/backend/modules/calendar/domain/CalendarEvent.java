package com.klubtool.backend.modules.calendar.domain;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;

/**
 * Normalised projection of a session, committee meeting or group meeting.
 * Text fields are never null; absent values are empty strings.
 */
public record CalendarEvent(
        OffsetDateTime scheduledAt,
        String title,
        String detailUrl,
        String icsExportUrl,
        CalendarEventSource source,
        String badgeLabel,
        String subtitle,
        String location,
        UUID id,
        boolean cancelled
) {

    public CalendarEvent {
        Objects.requireNonNull(scheduledAt, "scheduledAt");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(id, "id");
        title = title == null ? "" : title;
        detailUrl = detailUrl == null ? "" : detailUrl;
        icsExportUrl = icsExportUrl == null ? "" : icsExportUrl;
        badgeLabel = badgeLabel == null ? "" : badgeLabel;
        subtitle = subtitle == null ? "" : subtitle;
        location = location == null ? "" : location;
    }

    public String modelTag() {
        return source.modelTag();
    }
}
