package com.klubtool.backend.modules.calendar.presentation;

import java.util.List;

import com.klubtool.backend.global.web.ResourcePaths;
import com.klubtool.backend.modules.calendar.application.CalendarSubscriptionService;
import com.klubtool.backend.modules.calendar.application.CalendarSubscriptionService.IssuedSubscription;
import com.klubtool.backend.modules.calendar.application.PersonalCalendarService;
import com.klubtool.backend.modules.calendar.presentation.dto.CalendarEventResponse;
import com.klubtool.backend.modules.calendar.presentation.dto.CalendarSubscriptionResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

@RestController
@RequestMapping("/calendar")
@Tag(name = "Calendar", description = "Personal calendar, ICS export and subscription feed")
public class CalendarController {

    static final String EXPORT_FILENAME = "personal-calendar.ics";

    private final PersonalCalendarService personalCalendarService;
    private final CalendarSubscriptionService subscriptionService;

    public CalendarController(PersonalCalendarService personalCalendarService,
                              CalendarSubscriptionService subscriptionService) {
        this.personalCalendarService = personalCalendarService;
        this.subscriptionService = subscriptionService;
    }

    @GetMapping("/events")
    @Operation(summary = "Upcoming events of the current user")
    public ResponseEntity<List<CalendarEventResponse>> events() {
        List<CalendarEventResponse> events = personalCalendarService.upcomingEventsForCurrentUser().stream()
                .map(CalendarEventResponse::from)
                .toList();
        return ResponseEntity.ok(events);
    }

    @GetMapping("/export.ics")
    @Operation(summary = "Download upcoming events as an ICS file")
    public ResponseEntity<String> export(HttpServletRequest request) {
        String body = personalCalendarService.exportForCurrentUser(IcsResponses.renderContext(request));
        return IcsResponses.attachment(body, EXPORT_FILENAME);
    }

    @GetMapping("/feed/{token}.ics")
    @Operation(summary = "Subscription feed authenticated by token")
    public ResponseEntity<String> feed(@PathVariable("token") String token, HttpServletRequest request) {
        String body = personalCalendarService.renderFeed(token, IcsResponses.renderContext(request));
        return IcsResponses.inline(body);
    }

    @PostMapping("/subscription")
    @Operation(summary = "Issue a new feed token, revoking the previous one")
    public ResponseEntity<CalendarSubscriptionResponse> subscribe() {
        IssuedSubscription issued = subscriptionService.issueForCurrentUser();
        String feedUrl = ServletUriComponentsBuilder.fromCurrentContextPath()
                .path(ResourcePaths.calendarFeed(issued.rawToken()))
                .toUriString();
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new CalendarSubscriptionResponse(issued.rawToken(), feedUrl, issued.issuedAt()));
    }

    @DeleteMapping("/subscription")
    @Operation(summary = "Revoke the current feed token")
    public ResponseEntity<Void> unsubscribe() {
        subscriptionService.revokeForCurrentUser();
        return ResponseEntity.noContent().build();
    }
}
