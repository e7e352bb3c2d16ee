package com.klubtool.backend.modules.group.presentation;

import java.util.List;
import java.util.UUID;

import com.klubtool.backend.modules.group.application.GroupMemberService;
import com.klubtool.backend.modules.group.presentation.dto.GroupMemberRequest;
import com.klubtool.backend.modules.group.presentation.dto.GroupMemberResponse;
import com.klubtool.backend.modules.group.presentation.dto.GroupMemberRolesRequest;
import com.klubtool.backend.modules.group.presentation.dto.UpdateGroupMemberRequest;

import io.swagger.v3.oas.annotations.Operation;
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
import org.springframework.web.bind.annotation.RequestParam;

@RestController
@RequestMapping("/group-members")
@Tag(name = "Group members")
public class GroupMemberController {

    private final GroupMemberService memberService;

    public GroupMemberController(GroupMemberService memberService) {
        this.memberService = memberService;
    }

    @GetMapping
    public ResponseEntity<List<GroupMemberResponse>> listMembers(
            @RequestParam(name = "groupId", required = false) UUID groupId
    ) {
        return ResponseEntity.ok(memberService.listMembers(groupId));
    }

    @GetMapping("/{memberId}")
    public ResponseEntity<GroupMemberResponse> getMember(@PathVariable("memberId") UUID memberId) {
        return ResponseEntity.ok(memberService.getMember(memberId));
    }

    @PostMapping
    public ResponseEntity<GroupMemberResponse> addMember(@Valid @RequestBody GroupMemberRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(memberService.addMember(request));
    }

    @PatchMapping("/{memberId}")
    public ResponseEntity<GroupMemberResponse> updateMember(
            @PathVariable("memberId") UUID memberId,
            @Valid @RequestBody UpdateGroupMemberRequest request
    ) {
        return ResponseEntity.ok(memberService.updateMember(memberId, request));
    }

    @PostMapping("/{memberId}/roles")
    @Operation(summary = "Replace the structural roles of a membership")
    public ResponseEntity<GroupMemberResponse> replaceRoles(
            @PathVariable("memberId") UUID memberId,
            @Valid @RequestBody GroupMemberRolesRequest request
    ) {
        return ResponseEntity.ok(memberService.replaceRoles(memberId, request));
    }

    @DeleteMapping("/{memberId}")
    public ResponseEntity<Void> removeMember(@PathVariable("memberId") UUID memberId) {
        memberService.removeMember(memberId);
        return ResponseEntity.noContent().build();
    }
}
