package com.klubtool.backend.modules.committee.presentation;

import java.util.List;
import java.util.UUID;

import com.klubtool.backend.modules.committee.application.CommitteeService;
import com.klubtool.backend.modules.committee.presentation.dto.CommitteeMemberRequest;
import com.klubtool.backend.modules.committee.presentation.dto.CommitteeMemberResponse;
import com.klubtool.backend.modules.committee.presentation.dto.CommitteeRequest;
import com.klubtool.backend.modules.committee.presentation.dto.CommitteeResponse;
import com.klubtool.backend.modules.committee.presentation.dto.UpdateCommitteeRequest;

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
@RequestMapping("/committees")
@Tag(name = "Committees")
public class CommitteeController {

    private final CommitteeService committeeService;

    public CommitteeController(CommitteeService committeeService) {
        this.committeeService = committeeService;
    }

    @GetMapping
    public ResponseEntity<List<CommitteeResponse>> listCommittees() {
        return ResponseEntity.ok(committeeService.listCommittees());
    }

    @GetMapping("/{committeeId}")
    public ResponseEntity<CommitteeResponse> getCommittee(@PathVariable("committeeId") UUID committeeId) {
        return ResponseEntity.ok(committeeService.getCommittee(committeeId));
    }

    @PostMapping
    public ResponseEntity<CommitteeResponse> createCommittee(@Valid @RequestBody CommitteeRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(committeeService.createCommittee(request));
    }

    @PatchMapping("/{committeeId}")
    public ResponseEntity<CommitteeResponse> updateCommittee(
            @PathVariable("committeeId") UUID committeeId,
            @Valid @RequestBody UpdateCommitteeRequest request
    ) {
        return ResponseEntity.ok(committeeService.updateCommittee(committeeId, request));
    }

    @DeleteMapping("/{committeeId}")
    public ResponseEntity<Void> deleteCommittee(@PathVariable("committeeId") UUID committeeId) {
        committeeService.deleteCommittee(committeeId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{committeeId}/members")
    public ResponseEntity<List<CommitteeMemberResponse>> listMembers(@PathVariable("committeeId") UUID committeeId) {
        return ResponseEntity.ok(committeeService.listMembers(committeeId));
    }

    @PostMapping("/{committeeId}/members")
    public ResponseEntity<CommitteeMemberResponse> addMember(
            @PathVariable("committeeId") UUID committeeId,
            @Valid @RequestBody CommitteeMemberRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(committeeService.addMember(committeeId, request));
    }

    @DeleteMapping("/{committeeId}/members/{memberId}")
    public ResponseEntity<Void> removeMember(
            @PathVariable("committeeId") UUID committeeId,
            @PathVariable("memberId") UUID memberId
    ) {
        committeeService.removeMember(committeeId, memberId);
        return ResponseEntity.noContent().build();
    }
}
