package com.klubtool.backend.modules.group.presentation;

import java.util.List;
import java.util.UUID;

import com.klubtool.backend.modules.calendar.presentation.IcsResponses;
import com.klubtool.backend.modules.group.application.GroupMeetingService;
import com.klubtool.backend.modules.group.presentation.dto.GroupMeetingRequest;
import com.klubtool.backend.modules.group.presentation.dto.GroupMeetingResponse;
import com.klubtool.backend.modules.group.presentation.dto.UpdateGroupMeetingRequest;

import io.swagger.v3.oas.annotations.Operation;
import jakarta.servlet.http.HttpServletRequest;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/group-meetings")
@Tag(name = "Group meetings")
public class GroupMeetingController {

    private final GroupMeetingService meetingService;

    public GroupMeetingController(GroupMeetingService meetingService) {
        this.meetingService = meetingService;
    }

    @GetMapping
    public ResponseEntity<List<GroupMeetingResponse>> listMeetings() {
        return ResponseEntity.ok(meetingService.listMeetings());
    }

    @GetMapping("/{meetingId}")
    public ResponseEntity<GroupMeetingResponse> getMeeting(@PathVariable("meetingId") UUID meetingId) {
        return ResponseEntity.ok(meetingService.getMeeting(meetingId));
    }

    @PostMapping
    public ResponseEntity<GroupMeetingResponse> createMeeting(@Valid @RequestBody GroupMeetingRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(meetingService.createMeeting(request));
    }

    @PatchMapping("/{meetingId}")
    public ResponseEntity<GroupMeetingResponse> updateMeeting(
            @PathVariable("meetingId") UUID meetingId,
            @Valid @RequestBody UpdateGroupMeetingRequest request
    ) {
        return ResponseEntity.ok(meetingService.updateMeeting(meetingId, request));
    }

    @PostMapping("/{meetingId}/cancel")
    @Operation(summary = "Cancel a meeting; subscribers see it as cancelled")
    public ResponseEntity<GroupMeetingResponse> cancelMeeting(@PathVariable("meetingId") UUID meetingId) {
        return ResponseEntity.ok(meetingService.cancelMeeting(meetingId));
    }

    @DeleteMapping("/{meetingId}")
    public ResponseEntity<Void> deleteMeeting(@PathVariable("meetingId") UUID meetingId) {
        meetingService.deleteMeeting(meetingId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{meetingId}/export.ics")
    public ResponseEntity<String> exportIcs(@PathVariable("meetingId") UUID meetingId, HttpServletRequest request) {
        String body = meetingService.exportIcs(meetingId, IcsResponses.renderContext(request));
        return IcsResponses.attachment(body, "groupmeeting-" + meetingId + ".ics");
    }
}
