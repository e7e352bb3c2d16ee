package com.klubtool.backend.modules.calendar.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.klubtool.backend.modules.calendar.domain.CalendarEvent;

public record CalendarEventResponse(
        OffsetDateTime date,
        String title,
        String url,
        String icsExportUrl,
        String type,
        String badgeLabel,
        String subtitle,
        String location,
        String model,
        UUID id,
        boolean cancelled
) {

    public static CalendarEventResponse from(CalendarEvent event) {
        return new CalendarEventResponse(
                event.scheduledAt(),
                event.title(),
                event.detailUrl(),
                event.icsExportUrl(),
                event.source().type(),
                event.badgeLabel(),
                event.subtitle(),
                event.location(),
                event.modelTag(),
                event.id(),
                event.cancelled()
        );
    }
}
