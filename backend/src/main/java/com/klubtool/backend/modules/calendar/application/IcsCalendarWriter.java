package com.klubtool.backend.modules.calendar.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

import com.klubtool.backend.modules.calendar.domain.CalendarEvent;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Serialises calendar events as an iCalendar (RFC 5545) document with CRLF line endings.
 */
@Component
public class IcsCalendarWriter {

    static final String PRODUCT_ID = "-//Klubtool//Personal Calendar//EN";
    private static final String CRLF = "\r\n";
    private static final DateTimeFormatter UTC_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'");

    private final Clock clock;
    private final Duration eventDuration;
    private final String fallbackHost;

    public IcsCalendarWriter(
            Clock clock,
            @Value("${app.calendar.event-duration:PT1H}") Duration eventDuration,
            @Value("${app.calendar.fallback-host:localhost}") String fallbackHost
    ) {
        this.clock = clock;
        this.eventDuration = eventDuration;
        this.fallbackHost = fallbackHost;
    }

    public String render(List<CalendarEvent> events, IcsRenderContext context) {
        String host = context.host() == null || context.host().isBlank() ? fallbackHost : context.host();
        String stamp = formatUtc(OffsetDateTime.now(clock));

        StringBuilder out = new StringBuilder(256 + events.size() * 256);
        line(out, "BEGIN:VCALENDAR");
        line(out, "VERSION:2.0");
        line(out, "PRODID:" + PRODUCT_ID);
        line(out, "CALSCALE:GREGORIAN");
        line(out, "METHOD:PUBLISH");
        for (CalendarEvent event : events) {
            writeEvent(out, event, host, stamp, context);
        }
        line(out, "END:VCALENDAR");
        return out.toString();
    }

    private void writeEvent(StringBuilder out, CalendarEvent event, String host, String stamp,
                            IcsRenderContext context) {
        OffsetDateTime start = event.scheduledAt();
        String description = escapeText(event.subtitle());
        String location = escapeText(event.location());

        line(out, "BEGIN:VEVENT");
        line(out, "UID:" + event.modelTag() + "-" + event.id() + "@" + host);
        line(out, "DTSTART:" + formatUtc(start));
        line(out, "DTEND:" + formatUtc(start.plus(eventDuration)));
        line(out, "SUMMARY:" + escapeText(event.title()));
        if (!description.isEmpty()) {
            line(out, "DESCRIPTION:" + description);
        }
        if (!location.isEmpty()) {
            line(out, "LOCATION:" + location);
        }
        context.absolute(event.detailUrl()).ifPresent(url -> line(out, "URL:" + url));
        line(out, "DTSTAMP:" + stamp);
        if (event.cancelled()) {
            line(out, "STATUS:CANCELLED");
            // a bumped sequence tells subscribed clients this replaces the UID they already know
            line(out, "SEQUENCE:1");
        } else {
            line(out, "STATUS:CONFIRMED");
        }
        line(out, "END:VEVENT");
    }

    /**
     * Escapes backslash, comma, semicolon and line breaks (CR, LF or CRLF all become {@code \n}).
     */
    public static String escapeText(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return text.replace("\r\n", "\n")
                .replace('\r', '\n')
                .replace("\\", "\\\\")
                .replace(",", "\\,")
                .replace(";", "\\;")
                .replace("\n", "\\n");
    }

    static String formatUtc(OffsetDateTime value) {
        return value.withOffsetSameInstant(ZoneOffset.UTC).format(UTC_STAMP);
    }

    private static void line(StringBuilder out, String content) {
        out.append(content).append(CRLF);
    }
}
