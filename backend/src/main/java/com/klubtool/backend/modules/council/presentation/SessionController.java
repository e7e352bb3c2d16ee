package com.klubtool.backend.modules.council.presentation;

import java.util.List;
import java.util.UUID;

import com.klubtool.backend.modules.calendar.presentation.IcsResponses;
import com.klubtool.backend.modules.council.application.SessionService;
import com.klubtool.backend.modules.council.presentation.dto.SessionExcuseRequest;
import com.klubtool.backend.modules.council.presentation.dto.SessionExcuseResponse;
import com.klubtool.backend.modules.council.presentation.dto.SessionRequest;
import com.klubtool.backend.modules.council.presentation.dto.SessionResponse;
import com.klubtool.backend.modules.council.presentation.dto.UpdateSessionRequest;

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
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/sessions")
@Tag(name = "Sessions")
public class SessionController {

    private final SessionService sessionService;

    public SessionController(SessionService sessionService) {
        this.sessionService = sessionService;
    }

    @GetMapping
    public ResponseEntity<List<SessionResponse>> listSessions() {
        return ResponseEntity.ok(sessionService.listSessions());
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionResponse> getSession(@PathVariable("sessionId") UUID sessionId) {
        return ResponseEntity.ok(sessionService.getSession(sessionId));
    }

    @PostMapping
    public ResponseEntity<SessionResponse> createSession(@Valid @RequestBody SessionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(sessionService.createSession(request));
    }

    @PatchMapping("/{sessionId}")
    public ResponseEntity<SessionResponse> updateSession(
            @PathVariable("sessionId") UUID sessionId,
            @Valid @RequestBody UpdateSessionRequest request
    ) {
        return ResponseEntity.ok(sessionService.updateSession(sessionId, request));
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> deleteSession(@PathVariable("sessionId") UUID sessionId) {
        sessionService.deleteSession(sessionId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{sessionId}/excuse")
    @Operation(summary = "Excuse the current user from a session and hide it from their calendar")
    public ResponseEntity<SessionExcuseResponse> excuse(
            @PathVariable("sessionId") UUID sessionId,
            @Valid @RequestBody(required = false) SessionExcuseRequest request
    ) {
        return ResponseEntity.ok(sessionService.excuseCurrentUser(sessionId, request));
    }

    @DeleteMapping("/{sessionId}/excuse")
    public ResponseEntity<Void> withdrawExcuse(@PathVariable("sessionId") UUID sessionId) {
        sessionService.withdrawExcuse(sessionId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{sessionId}/export.ics")
    public ResponseEntity<String> exportIcs(@PathVariable("sessionId") UUID sessionId, HttpServletRequest request) {
        String body = sessionService.exportIcs(sessionId, IcsResponses.renderContext(request));
        return IcsResponses.attachment(body, "session-" + sessionId + ".ics");
    }
}
