package com.klubtool.backend.modules.calendar.presentation.dto;

import java.time.OffsetDateTime;

/**
 * The raw token appears here once and is never retrievable again.
 */
public record CalendarSubscriptionResponse(String token, String feedUrl, OffsetDateTime issuedAt) {
}
