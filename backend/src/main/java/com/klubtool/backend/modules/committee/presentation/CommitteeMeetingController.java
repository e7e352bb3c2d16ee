package com.klubtool.backend.modules.committee.presentation;

import java.util.List;
import java.util.UUID;

import com.klubtool.backend.modules.calendar.presentation.IcsResponses;
import com.klubtool.backend.modules.committee.application.CommitteeMeetingService;
import com.klubtool.backend.modules.committee.presentation.dto.CommitteeMeetingRequest;
import com.klubtool.backend.modules.committee.presentation.dto.CommitteeMeetingResponse;
import com.klubtool.backend.modules.committee.presentation.dto.ReplaceSubstitutesRequest;
import com.klubtool.backend.modules.committee.presentation.dto.SubstituteResponse;
import com.klubtool.backend.modules.committee.presentation.dto.UpdateCommitteeMeetingRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/committee-meetings")
@Tag(name = "Committee meetings")
public class CommitteeMeetingController {

    private final CommitteeMeetingService meetingService;

    public CommitteeMeetingController(CommitteeMeetingService meetingService) {
        this.meetingService = meetingService;
    }

    @GetMapping
    public ResponseEntity<List<CommitteeMeetingResponse>> listMeetings() {
        return ResponseEntity.ok(meetingService.listMeetings());
    }

    @GetMapping("/{meetingId}")
    public ResponseEntity<CommitteeMeetingResponse> getMeeting(@PathVariable("meetingId") UUID meetingId) {
        return ResponseEntity.ok(meetingService.getMeeting(meetingId));
    }

    @PostMapping
    public ResponseEntity<CommitteeMeetingResponse> createMeeting(@Valid @RequestBody CommitteeMeetingRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(meetingService.createMeeting(request));
    }

    @PatchMapping("/{meetingId}")
    public ResponseEntity<CommitteeMeetingResponse> updateMeeting(
            @PathVariable("meetingId") UUID meetingId,
            @Valid @RequestBody UpdateCommitteeMeetingRequest request
    ) {
        return ResponseEntity.ok(meetingService.updateMeeting(meetingId, request));
    }

    @DeleteMapping("/{meetingId}")
    public ResponseEntity<Void> deleteMeeting(@PathVariable("meetingId") UUID meetingId) {
        meetingService.deleteMeeting(meetingId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{meetingId}/substitutes")
    public ResponseEntity<List<SubstituteResponse>> listSubstitutes(@PathVariable("meetingId") UUID meetingId) {
        return ResponseEntity.ok(meetingService.listSubstitutes(meetingId));
    }

    @PutMapping("/{meetingId}/substitutes")
    @Operation(summary = "Replace the member-to-substitute assignments of one meeting")
    public ResponseEntity<List<SubstituteResponse>> replaceSubstitutes(
            @PathVariable("meetingId") UUID meetingId,
            @Valid @RequestBody ReplaceSubstitutesRequest request
    ) {
        return ResponseEntity.ok(meetingService.replaceSubstitutes(meetingId, request));
    }

    @GetMapping("/{meetingId}/export.ics")
    public ResponseEntity<String> exportIcs(@PathVariable("meetingId") UUID meetingId, HttpServletRequest request) {
        String body = meetingService.exportIcs(meetingId, IcsResponses.renderContext(request));
        return IcsResponses.attachment(body, "committeemeeting-" + meetingId + ".ics");
    }
}
